package io.fullerstack.rosdiscover.io;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link FileSystem} over the local disk, reading UTF-8 text.
 */
public final class LocalFileSystem implements FileSystem {

    @Override
    public String read(String path) {
        try {
            return Files.readString(Path.of(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CollaboratorException("failed to read file: " + path, e);
        }
    }
}
