package io.usbjobs.execution;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Files selected for a job and the volume root they are written under.
 */
public record ContentPlan(Path destinationRoot, List<FileTransfer> transfers) {

    public ContentPlan {
        Objects.requireNonNull(destinationRoot, "destinationRoot must not be null");
        transfers = List.copyOf(Objects.requireNonNull(transfers, "transfers must not be null"));
    }
}
