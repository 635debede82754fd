package io.usbjobs.execution;

import java.util.List;

/**
 * Outcome of the copy stage.
 *
 * success        : true when every file was copied
 * filesProcessed : number of files copied and size-checked
 * totalSize      : bytes copied
 * errors         : one message per file that failed or was skipped
 * copied         : the transfers that succeeded, in copy order
 */
public record CopyResult(
        boolean success,
        int filesProcessed,
        long totalSize,
        List<String> errors,
        List<FileTransfer> copied
) {

    public CopyResult {
        errors = List.copyOf(errors);
        copied = List.copyOf(copied);
    }
}
