package org.tessera.process;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external command with an explicit timeout and forwarded cancellation.
 * <p>
 * Output is drained by a daemon reader thread, logged at DEBUG and its last lines kept for error reports.
 * Interrupting the waiting thread, calling {@link #cancel()} or exceeding the timeout destroys the process,
 * escalating to a forced kill after a grace period.
 */
public class ExternalProcessTask {

    private static final Logger log = LoggerFactory.getLogger(ExternalProcessTask.class);

    private static final int OUTPUT_TAIL_LINES = 20;
    private static final Duration KILL_GRACE = Duration.ofSeconds(5);

    private final String name;
    private final List<String> command;
    private final Path workingDirectory;
    private final Duration timeout;

    private volatile Process process;
    private volatile boolean cancelled;

    /**
     * @param name             a short label used in logs and thread names.
     * @param command          the executable followed by its arguments.
     * @param workingDirectory the working directory, or {@code null} to inherit.
     * @param timeout          the maximum run time.
     */
    public ExternalProcessTask(String name, List<String> command, Path workingDirectory, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.workingDirectory = workingDirectory;
        this.timeout = timeout;
    }

    public List<String> command() {
        return command;
    }

    /**
     * Runs the command and waits for it.
     *
     * @return the result of a successful run.
     * @throws ProcessFailedException if the process exits non-zero, times out or was cancelled.
     * @throws IOException            if the process cannot be started.
     * @throws InterruptedException   if the waiting thread is interrupted; the process is destroyed first.
     */
    public ProcessResult run() throws IOException, InterruptedException {
        if (cancelled) {
            throw new ProcessFailedException(name + " cancelled before start", -1, false, List.of());
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        long started = System.nanoTime();
        log.info("Starting {}: {}", name, String.join(" ", command));
        Process proc = builder.start();
        this.process = proc;
        Deque<String> tail = new ArrayDeque<>();
        Thread reader = startOutputReader(proc, tail);

        boolean finished;
        try {
            finished = proc.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            destroy(proc);
            throw e;
        }
        if (!finished) {
            destroy(proc);
            throw new ProcessFailedException(
                String.format("%s timed out after %s", name, timeout), -1, true, snapshot(tail));
        }
        reader.join(TimeUnit.SECONDS.toMillis(1));

        int exitCode = proc.exitValue();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        List<String> output = snapshot(tail);
        if (cancelled) {
            throw new ProcessFailedException(name + " cancelled", exitCode, false, output);
        }
        if (exitCode != 0) {
            throw new ProcessFailedException(
                String.format("%s failed with exit code %d", name, exitCode), exitCode, false, output);
        }
        log.info("{} finished in {} s", name, elapsed.toSeconds());
        return new ProcessResult(command, exitCode, elapsed, output);
    }

    /**
     * Destroys the running process, if any, and prevents a pending run from starting.
     */
    public void cancel() {
        cancelled = true;
        Process running = process;
        if (running != null && running.isAlive()) {
            log.info("Cancelling {}", name);
            destroy(running);
        }
    }

    private Thread startOutputReader(Process running, Deque<String> tail) {
        Thread reader = new Thread(() -> {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(running.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    log.debug("[{}] {}", name, line);
                    synchronized (tail) {
                        tail.addLast(line);
                        if (tail.size() > OUTPUT_TAIL_LINES) tail.removeFirst();
                    }
                }
            } catch (IOException e) {
                if (running.isAlive()) {
                    log.warn("Lost output of {}: {}", name, e.getMessage());
                }
            }
        }, name + "-output-reader");
        reader.setDaemon(true);
        reader.start();
        return reader;
    }

    private static void destroy(Process running) {
        running.descendants().forEach(ProcessHandle::destroy);
        running.destroy();
        try {
            if (!running.waitFor(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                running.descendants().forEach(ProcessHandle::destroyForcibly);
                running.destroyForcibly();
            }
        } catch (InterruptedException e) {
            running.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    private static List<String> snapshot(Deque<String> tail) {
        synchronized (tail) {
            return new ArrayList<>(tail);
        }
    }
}
