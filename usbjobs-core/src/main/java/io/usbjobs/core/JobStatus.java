package io.usbjobs.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a processing job.
 *
 * <pre>
 * pending -> processing -> {writing | verifying}* -> done
 * processing -> retry -> processing   (bounded by the attempt ceiling)
 * processing -> failed                (terminal)
 * pending | retry -> canceled         (terminal)
 * </pre>
 */
public enum JobStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    WRITING("writing"),
    VERIFYING("verifying"),
    DONE("done"),
    FAILED("failed"),
    RETRY("retry"),
    CANCELED("canceled");

    private static final Set<JobStatus> ACQUIRABLE = EnumSet.of(PENDING, RETRY);
    private static final Set<JobStatus> TERMINAL = EnumSet.of(DONE, FAILED, CANCELED);
    private static final Set<JobStatus> ACTIVE = EnumSet.of(PROCESSING, WRITING, VERIFYING);

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Only pending and retry jobs may be leased.
     */
    public boolean isAcquirable() {
        return ACQUIRABLE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * True for the states a leased job moves through while a worker owns it.
     */
    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public static Set<JobStatus> acquirable() {
        return EnumSet.copyOf(ACQUIRABLE);
    }

    public static Set<JobStatus> active() {
        return EnumSet.copyOf(ACTIVE);
    }

    public static JobStatus fromValue(String value) {
        for (JobStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown job status: " + value);
    }
}
