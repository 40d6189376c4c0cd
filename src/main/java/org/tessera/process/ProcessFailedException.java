package org.tessera.process;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when an external tool exits with a non-zero code or exceeds its timeout.
 */
public class ProcessFailedException extends IOException {

    private final int exitCode;
    private final boolean timedOut;
    private final List<String> outputTail;

    public ProcessFailedException(String message, int exitCode, boolean timedOut, List<String> outputTail) {
        super(message);
        this.exitCode = exitCode;
        this.timedOut = timedOut;
        this.outputTail = List.copyOf(outputTail);
    }

    /** The exit code, or -1 if the process was killed after a timeout. */
    public int exitCode() {
        return exitCode;
    }

    public boolean timedOut() {
        return timedOut;
    }

    public List<String> outputTail() {
        return outputTail;
    }
}
