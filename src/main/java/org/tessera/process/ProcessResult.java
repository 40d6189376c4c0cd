package org.tessera.process;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of a finished external process.
 *
 * @param command    the command line that was run.
 * @param exitCode   the process exit code.
 * @param elapsed    wall-clock run time.
 * @param outputTail the last lines of combined stdout/stderr.
 */
public record ProcessResult(List<String> command, int exitCode, Duration elapsed, List<String> outputTail) {

    public ProcessResult {
        command = List.copyOf(command);
        outputTail = List.copyOf(outputTail);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
