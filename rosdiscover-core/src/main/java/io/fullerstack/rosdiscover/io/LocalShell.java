package io.fullerstack.rosdiscover.io;

import io.fullerstack.rosdiscover.config.HierarchicalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link Shell} that runs commands through {@code sh -c} on the local machine.
 * <p>
 * Each command is bounded by a timeout; a command that does not finish in time is killed.
 */
public final class LocalShell implements Shell {

    private static final Logger logger = LoggerFactory.getLogger(LocalShell.class);

    private final long timeoutMs;

    public LocalShell(long timeoutMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
        this.timeoutMs = timeoutMs;
    }

    /**
     * Shell with the timeout taken from {@code shell.timeout-ms}.
     */
    public static LocalShell fromConfig(HierarchicalConfig config) {
        return new LocalShell(config.getLong("shell.timeout-ms"));
    }

    @Override
    public String runAndCapture(String command) {
        logger.debug("executing command: {}", command);
        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command).start();
        } catch (IOException e) {
            throw new CollaboratorException("failed to start command: " + command, e);
        }

        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            if (!process.waitFor(timeoutMs, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CollaboratorException(
                    "command timed out after " + timeoutMs + "ms: " + command);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new CollaboratorException(
                    "command exited with code " + exitCode + ": " + command + "\n" + stderr.get());
            }
            return stdout.get();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CollaboratorException("interrupted while executing command: " + command, e);
        } catch (ExecutionException e) {
            throw new CollaboratorException("failed to capture output of command: " + command, e.getCause());
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new CollaboratorException("failed to read process output", e);
            }
        });
    }

    public long timeoutMs() {
        return timeoutMs;
    }
}
