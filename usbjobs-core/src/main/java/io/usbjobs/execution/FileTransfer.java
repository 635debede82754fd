package io.usbjobs.execution;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One file to put on the volume.
 */
public record FileTransfer(Path source, Path destination) {

    public FileTransfer {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
    }
}
