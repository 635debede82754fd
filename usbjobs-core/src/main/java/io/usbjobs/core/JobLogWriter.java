package io.usbjobs.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Writes job log entries without letting a sink failure abort the caller.
 *
 * <p>The job log is diagnostic; job processing must not depend on it.
 */
public class JobLogWriter {
    private static final Logger log = LoggerFactory.getLogger(JobLogWriter.class);

    private final JobLogSink sink;

    public JobLogWriter(JobLogSink sink) {
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
    }

    public void write(JobLogEntry entry) {
        try {
            sink.append(entry);
        } catch (RuntimeException e) {
            log.warn("usbjobs job log write failed jobId={} category={} message={} cause={}",
                    entry.jobId(), entry.category(), entry.message(), e.getMessage(), e);
        }
    }

    public void write(JobLogEntry.Builder entry) {
        write(entry.build());
    }

    public JobLogSink sink() {
        return sink;
    }
}
