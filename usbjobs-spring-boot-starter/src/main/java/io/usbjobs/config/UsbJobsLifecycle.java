package io.usbjobs.config;

import io.usbjobs.ProcessingJobs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the processing worker to the Spring container: polling begins after every other bean is up and
 * running jobs are handed back before the Mongo client is closed.
 */
public class UsbJobsLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(UsbJobsLifecycle.class);

    private final ProcessingJobs processingJobs;
    private volatile boolean running = false;

    public UsbJobsLifecycle(ProcessingJobs processingJobs) {
        this.processingJobs = processingJobs;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        processingJobs.start();
        running = true;
        log.debug("usbjobs lifecycle started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        try {
            processingJobs.stop();
        } finally {
            running = false;
            log.debug("usbjobs lifecycle stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // start last, stop first
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
