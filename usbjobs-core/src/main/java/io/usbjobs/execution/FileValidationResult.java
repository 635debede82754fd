package io.usbjobs.execution;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of the validate stage.
 *
 * valid      : true when no file produced an error
 * errors     : one entry per rejected file
 * totalSize  : summed size of the accepted files, in bytes
 * fileCount  : number of accepted files
 * validFiles : the accepted files, in input order
 */
public record FileValidationResult(
        boolean valid,
        List<FileError> errors,
        long totalSize,
        int fileCount,
        List<Path> validFiles
) {

    public FileValidationResult {
        errors = List.copyOf(errors);
        validFiles = List.copyOf(validFiles);
    }
}
