package io.usbjobs.core;

/**
 * Coarse status encoding kept in storage for older readers and producers.
 *
 * <p>Never exposed to callers: {@link ProcessingJob#status()} is always a {@link JobStatus}.
 * Several fine states collapse onto one coarse value, so the reverse mapping is lossy and only used
 * for rows that carry no fine status at all.
 */
public enum StorageStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    ERROR("error"),
    FAILED("failed");

    private final String value;

    StorageStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static StorageStatus from(JobStatus status) {
        if (status == null) {
            return QUEUED;
        }
        return switch (status) {
            case PENDING, RETRY -> QUEUED;
            case PROCESSING, WRITING, VERIFYING -> PROCESSING;
            case DONE -> COMPLETED;
            case FAILED, CANCELED -> FAILED;
        };
    }

    public JobStatus toJobStatus() {
        return switch (this) {
            case QUEUED -> JobStatus.PENDING;
            case PROCESSING -> JobStatus.PROCESSING;
            case COMPLETED -> JobStatus.DONE;
            case ERROR, FAILED -> JobStatus.FAILED;
        };
    }

    /**
     * Lenient parse used for legacy rows; unknown values read as {@link #QUEUED}.
     */
    public static StorageStatus fromValue(String value) {
        if (value != null) {
            for (StorageStatus s : values()) {
                if (s.value.equalsIgnoreCase(value)) {
                    return s;
                }
            }
        }
        return QUEUED;
    }
}
