package io.usbjobs.execution;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reports the bytes available to this process on the volume holding a path.
 */
@FunctionalInterface
public interface DiskSpaceProbe {

    long usableBytes(Path path) throws IOException;

    /**
     * Probe backed by {@link java.nio.file.FileStore#getUsableSpace()}. A path that does not exist yet is
     * resolved to its nearest existing ancestor, so a destination folder can be checked before it is created.
     */
    static DiskSpaceProbe fileStore() {
        return path -> {
            Path p = path.toAbsolutePath();
            while (p != null && !Files.exists(p)) {
                p = p.getParent();
            }
            if (p == null) {
                throw new NoSuchFileException(path.toString());
            }
            return Files.getFileStore(p).getUsableSpace();
        };
    }
}
