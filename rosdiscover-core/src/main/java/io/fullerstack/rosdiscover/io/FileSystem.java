package io.fullerstack.rosdiscover.io;

/**
 * Read access to the file system that holds the launch files and the files nodes read.
 */
@FunctionalInterface
public interface FileSystem {

    /**
     * Reads the full contents of a text file.
     *
     * @param path path of the file
     * @return file contents
     * @throws CollaboratorException if the file cannot be read
     */
    String read(String path);
}
