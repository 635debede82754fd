package io.usbjobs.internal;

import io.usbjobs.JobEventListener;
import io.usbjobs.JobExecutionContext;
import io.usbjobs.JobProcessor;
import io.usbjobs.config.UsbJobsProperties;
import io.usbjobs.core.JobLogEntry;
import io.usbjobs.core.JobLogWriter;
import io.usbjobs.core.JobProcessingException;
import io.usbjobs.core.JobStatus;
import io.usbjobs.core.LeaseManager;
import io.usbjobs.core.LogCategory;
import io.usbjobs.core.LogLevel;
import io.usbjobs.core.ProcessingJob;
import io.usbjobs.core.WorkerState;
import io.usbjobs.core.WorkerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Long-running worker that leases jobs and runs them through a {@link JobProcessor}.
 *
 * <p>Threads:
 * <ul>
 *   <li>{@code usbjobs.poller}: one lease attempt per poll interval while below the concurrency limit</li>
 *   <li>{@code usbjobs.worker-N}: fixed pool running the processor, one job per thread</li>
 *   <li>{@code usbjobs.timer}: lease renewal for every running job, plus the periodic expired-lease reaper</li>
 * </ul>
 *
 * <p>A refused renewal marks the job's context as lease-lost; the processor is expected to stop touching
 * the destination, and its later writes are rejected by the store anyway.
 */
public class ProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(ProcessingWorker.class);

    static final String SHUTDOWN_MESSAGE = "Worker shutdown before job completion";
    private static final Duration INTERRUPT_WAIT = Duration.ofSeconds(1);

    private final UsbJobsProperties props;
    private final LeaseManager leaseManager;
    private final JobProcessor processor;
    private final JobLogWriter jobLog;
    private final List<JobEventListener> listeners;
    private final String workerId;

    private volatile WorkerState state = WorkerState.STOPPED;
    private final ConcurrentHashMap<Long, ActiveJob> activeJobs = new ConcurrentHashMap<>();

    private ExecutorService workerPool;
    private ScheduledExecutorService timer;
    private Thread pollerThread;
    private int consecutiveFailures = 0;

    private static final class ActiveJob {
        private final ProcessingJob job;
        private final AtomicBoolean leaseLost = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> renewal;

        private ActiveJob(ProcessingJob job) {
            this.job = job;
        }

        private void cancelRenewal() {
            ScheduledFuture<?> r = renewal;
            if (r != null) {
                r.cancel(false);
            }
        }
    }

    public ProcessingWorker(UsbJobsProperties props, LeaseManager leaseManager, JobProcessor processor,
                            JobLogWriter jobLog, List<JobEventListener> listeners) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.leaseManager = Objects.requireNonNull(leaseManager, "leaseManager must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.jobLog = Objects.requireNonNull(jobLog, "jobLog must not be null");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Reclaim expired leases once, then start polling, renewal and reaping. Idempotent while running.
     *
     * @throws IllegalStateException if a previous {@link #stop()} has not finished yet
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public synchronized void start() {
        if (state == WorkerState.RUNNING) {
            return;
        }
        if (state == WorkerState.STOPPING) {
            throw new IllegalStateException("worker " + workerId + " is still stopping");
        }
        props.validate();

        log.info("usbjobs worker starting workerId={} leaseDuration={} pollInterval={} maxConcurrentJobs={} maxAttempts={}",
                workerId,
                props.getLeaseDuration(),
                props.getPollInterval(),
                props.getMaxConcurrentJobs(),
                leaseManager.maxAttempts());

        reapExpiredLeases();

        workerPool = Executors.newFixedThreadPool(props.getMaxConcurrentJobs(), namedThreads("usbjobs.worker"));
        timer = Executors.newSingleThreadScheduledExecutor(namedThreads("usbjobs.timer"));
        consecutiveFailures = 0;
        state = WorkerState.RUNNING;

        long reapMs = props.getReapInterval().toMillis();
        timer.scheduleWithFixedDelay(this::reapExpiredLeases, reapMs, reapMs, TimeUnit.MILLISECONDS);

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("usbjobs.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();

        fire(l -> l.workerStarted(workerId));
        log.info("usbjobs worker started workerId={}", workerId);
    }

    /**
     * Stop polling, wait up to the grace period for running jobs, then hand their leases back as retry.
     * Idempotent.
     */
    public synchronized void stop() {
        if (state != WorkerState.RUNNING) {
            return;
        }
        state = WorkerState.STOPPING;
        log.info("usbjobs worker stopping workerId={} activeJobs={}", workerId, activeJobs.size());

        Thread poller = pollerThread;
        pollerThread = null;
        if (poller != null) {
            poller.interrupt();
            try {
                poller.join(props.getPollInterval().toMillis() + 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        timer.shutdownNow();
        workerPool.shutdown();
        boolean finished = false;
        try {
            finished = workerPool.awaitTermination(props.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (!finished) {
            releaseUnfinished();
        }
        workerPool.shutdownNow();
        try {
            if (!workerPool.awaitTermination(INTERRUPT_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("usbjobs job threads ignored interrupt workerId={} activeJobs={}",
                        workerId, activeJobs.keySet());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        // entries stay until runJob returns, so a restart still counts them against the limit
        for (ActiveJob active : activeJobs.values()) {
            active.cancelRenewal();
        }
        workerPool = null;
        timer = null;

        state = WorkerState.STOPPED;
        fire(l -> l.workerStopped(workerId));
        log.info("usbjobs worker stopped workerId={}", workerId);
    }

    private void releaseUnfinished() {
        for (ActiveJob active : new ArrayList<>(activeJobs.values())) {
            active.leaseLost.set(true);
            long jobId = active.job.id();
            try {
                boolean released = leaseManager.releaseLease(jobId, workerId, JobStatus.RETRY, SHUTDOWN_MESSAGE);
                log.warn("usbjobs job still running at shutdown jobId={} workerId={} released={}",
                        jobId, workerId, released);
            } catch (RuntimeException e) {
                log.error("usbjobs release at shutdown failed jobId={} workerId={} msg={}",
                        jobId, workerId, e.getMessage(), e);
            }
        }
    }

    public WorkerStatus status() {
        Set<Long> ids = Collections.unmodifiableSet(new TreeSet<>(activeJobs.keySet()));
        return new WorkerStatus(workerId, state, ids, props.getMaxConcurrentJobs(), props.getLeaseDuration());
    }

    private void pollerLoop() {
        while (state == WorkerState.RUNNING) {
            try {
                pollOnce();
                consecutiveFailures = 0;
            } catch (Exception e) {
                if (state != WorkerState.RUNNING) {
                    break;
                }
                consecutiveFailures++;
                log.error("usbjobs poll failed workerId={} consecutiveFailures={} msg={}",
                        workerId, consecutiveFailures, e.getMessage(), e);
            }

            if (state != WorkerState.RUNNING) {
                break;
            }
            try {
                Thread.sleep(props.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    /**
     * One polling tick.
     *
     * @return true when a job was leased and handed to the pool
     */
    boolean pollOnce() {
        if (activeJobs.size() >= props.getMaxConcurrentJobs()) {
            return false;
        }

        Optional<ProcessingJob> leased = leaseManager.acquireLease(workerId, props.getLeaseDuration());
        if (leased.isEmpty()) {
            return false;
        }
        ProcessingJob job = leased.get();

        if (state != WorkerState.RUNNING) {
            leaseManager.releaseLease(job.id(), workerId, JobStatus.RETRY, SHUTDOWN_MESSAGE);
            return false;
        }
        launch(job);
        return true;
    }

    private void launch(ProcessingJob job) {
        ActiveJob active = new ActiveJob(job);
        activeJobs.put(job.id(), active);
        scheduleRenewal(active, renewalDelay());

        try {
            workerPool.submit(() -> runJob(active));
        } catch (RejectedExecutionException e) {
            activeJobs.remove(job.id());
            active.cancelRenewal();
            log.warn("usbjobs worker pool rejected job jobId={} workerId={}", job.id(), workerId);
            leaseManager.releaseLease(job.id(), workerId, JobStatus.RETRY, SHUTDOWN_MESSAGE);
        }
    }

    private void runJob(ActiveJob active) {
        ProcessingJob job = active.job;
        long jobId = job.id();
        long startedNanos = System.nanoTime();

        try {
            log.info("usbjobs job started jobId={} orderRef={} attempt={} workerId={}",
                    jobId, job.orderRef(), job.attempts(), workerId);
            jobLog.write(JobLogEntry.builder(jobId, LogLevel.INFO, LogCategory.SYSTEM,
                            "Processing started by worker " + workerId)
                    .detail("attempt", job.attempts())
                    .detail("capacity", job.capacity()));
            fire(l -> l.jobStarted(job));

            processor.process(new WorkerContext(active));

            active.cancelRenewal();
            if (leaseManager.releaseLease(jobId, workerId, JobStatus.DONE, null)) {
                log.info("usbjobs job completed jobId={} workerId={} tookMs={}",
                        jobId, workerId, Duration.ofNanos(System.nanoTime() - startedNanos).toMillis());
                fire(l -> l.jobCompleted(job));
            } else {
                log.warn("usbjobs job finished without holding its lease, result not recorded jobId={} workerId={}",
                        jobId, workerId);
            }
        } catch (Exception e) {
            active.cancelRenewal();
            handleFailure(active, e);
        } finally {
            active.cancelRenewal();
            activeJobs.remove(jobId);
        }
    }

    private void handleFailure(ActiveJob active, Exception e) {
        ProcessingJob job = active.job;
        boolean exhausted = job.attempts() >= leaseManager.maxAttempts();
        JobStatus next = exhausted ? JobStatus.FAILED : JobStatus.RETRY;
        String message = errorMessage(e);

        log.error("usbjobs job failed jobId={} workerId={} attempt={} next={} msg={}",
                job.id(), workerId, job.attempts(), next.value(), message, e);

        JobLogEntry.Builder entry = JobLogEntry.builder(job.id(), LogLevel.ERROR, LogCategory.SYSTEM,
                        "Processing failed: " + message)
                .detail("attempt", job.attempts())
                .detail("nextStatus", next.value());
        if (e instanceof JobProcessingException jpe) {
            entry.errorCode(jpe.errorCode());
        }
        jobLog.write(entry);

        try {
            if (leaseManager.releaseLease(job.id(), workerId, next, message)) {
                fire(l -> l.jobFailed(job, e));
            }
        } catch (RuntimeException storeError) {
            log.error("usbjobs release after failure failed jobId={} workerId={} msg={}",
                    job.id(), workerId, storeError.getMessage(), storeError);
        }
    }

    private static String errorMessage(Exception e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (e instanceof JobProcessingException jpe && jpe.errorCode() != null) {
            return jpe.errorCode() + ": " + message;
        }
        return message;
    }

    private long renewalDelay() {
        return props.getLeaseDuration().toMillis() * props.getLeaseExtensionThresholdPercent() / 100;
    }

    private void scheduleRenewal(ActiveJob active, long delayMs) {
        ScheduledExecutorService t = timer;
        if (t == null || t.isShutdown()) {
            return;
        }
        try {
            active.renewal = t.schedule(() -> renew(active), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("usbjobs renewal not scheduled, timer stopped jobId={}", active.job.id());
        }
    }

    private void renew(ActiveJob active) {
        long jobId = active.job.id();
        if (state != WorkerState.RUNNING || activeJobs.get(jobId) != active || active.leaseLost.get()) {
            return;
        }

        boolean extended;
        try {
            extended = leaseManager.extendLease(jobId, workerId, props.getLeaseDuration());
        } catch (RuntimeException e) {
            log.error("usbjobs lease renewal failed, retrying jobId={} workerId={} msg={}",
                    jobId, workerId, e.getMessage(), e);
            scheduleRenewal(active, props.getPollInterval().toMillis());
            return;
        }

        if (extended) {
            scheduleRenewal(active, renewalDelay());
            return;
        }
        markLeaseLost(active, "Lease extension refused");
    }

    private void markLeaseLost(ActiveJob active, String reason) {
        if (!active.leaseLost.compareAndSet(false, true)) {
            return;
        }
        ProcessingJob job = active.job;
        log.warn("usbjobs lease lost jobId={} workerId={} reason={}", job.id(), workerId, reason);
        jobLog.write(JobLogEntry.builder(job.id(), LogLevel.WARNING, LogCategory.LEASE,
                        reason + ", worker " + workerId + " no longer owns the job")
                .detail("workerId", workerId));
        fire(l -> l.leaseLost(job));
    }

    private void reapExpiredLeases() {
        try {
            leaseManager.resetExpiredLeases();
        } catch (RuntimeException e) {
            log.error("usbjobs expired lease reset failed workerId={} msg={}", workerId, e.getMessage(), e);
        }
    }

    private void fire(Consumer<JobEventListener> event) {
        for (JobEventListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.warn("usbjobs event listener failed listener={} msg={}", l.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Processor-facing view of one running job; every write is checked against this worker's lease.
     */
    private final class WorkerContext implements JobExecutionContext {
        private final ActiveJob active;

        private WorkerContext(ActiveJob active) {
            this.active = active;
        }

        @Override
        public ProcessingJob job() {
            return active.job;
        }

        @Override
        public String workerId() {
            return workerId;
        }

        @Override
        public boolean reportProgress(int progress) {
            return reportProgress(progress, null);
        }

        @Override
        public boolean reportProgress(int progress, String message) {
            if (active.leaseLost.get()) {
                return false;
            }
            try {
                if (leaseManager.reportProgress(active.job.id(), workerId, progress, message)) {
                    return true;
                }
            } catch (RuntimeException e) {
                log.warn("usbjobs progress write failed jobId={} progress={} msg={}",
                        active.job.id(), progress, e.getMessage());
                return false;
            }
            markLeaseLost(active, "Progress update rejected");
            return false;
        }

        @Override
        public boolean advanceStatus(JobStatus status) {
            if (active.leaseLost.get()) {
                return false;
            }
            try {
                if (leaseManager.advanceStatus(active.job.id(), workerId, status)) {
                    return true;
                }
            } catch (RuntimeException e) {
                log.warn("usbjobs status write failed jobId={} status={} msg={}",
                        active.job.id(), status, e.getMessage());
                return false;
            }
            markLeaseLost(active, "Status update rejected");
            return false;
        }

        @Override
        public boolean isLeaseLost() {
            return active.leaseLost.get();
        }

        @Override
        public JobLogWriter log() {
            return jobLog;
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "localhost";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("usbjobs could not resolve host name, using {}", host, e);
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = "worker-" + host + "-" + pid;
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }
}
