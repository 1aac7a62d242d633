package io.fullerstack.rosdiscover.io;

/**
 * Executes shell commands on the machine that holds the ROS installation.
 */
@FunctionalInterface
public interface Shell {

    /**
     * Runs a command to completion and returns its standard output.
     *
     * @param command command line, interpreted by a POSIX shell
     * @return captured standard output
     * @throws CollaboratorException if the command cannot be started, times out or exits non-zero
     */
    String runAndCapture(String command);
}
