package io.usbjobs.core;

/**
 * Well-known category tags for job log entries. Categories are free text; these are the ones the core writes.
 */
public final class LogCategory {
    public static final String VALIDATION = "validation";
    public static final String COPY = "copy";
    public static final String VERIFY = "verify";
    public static final String LEASE = "lease";
    public static final String PROGRESS = "progress";
    public static final String SYSTEM = "system";

    private LogCategory() {
    }
}
