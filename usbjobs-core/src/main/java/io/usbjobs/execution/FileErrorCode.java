package io.usbjobs.execution;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;

/**
 * Classification of per-file and per-stage failures, written to the job log as {@code error_code}.
 */
public enum FileErrorCode {
    NOT_FOUND,
    NO_PERMISSION,
    NOT_FILE,
    EMPTY_FILE,
    UNKNOWN,
    SIZE_MISMATCH,
    COPY_FAILED,
    VERIFY_FAILED,
    SPACE_CHECK_FAILED,
    INSUFFICIENT_SPACE,
    VALIDATION_FAILED,
    LEASE_LOST;

    /**
     * Map an I/O failure to a code; anything that is neither a missing file nor a permission problem gets {@code fallback}.
     */
    public static FileErrorCode classify(IOException e, FileErrorCode fallback) {
        if (e instanceof NoSuchFileException) {
            return NOT_FOUND;
        }
        if (e instanceof AccessDeniedException) {
            return NO_PERMISSION;
        }
        return fallback;
    }
}
