package io.usbjobs.execution;

public record FileError(
        String file,
        String message,
        FileErrorCode code
) {
}
