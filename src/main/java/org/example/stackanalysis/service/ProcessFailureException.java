package org.example.stackanalysis.service;

/**
 * The analysis tool could not be launched or exited with a non-zero status.
 */
public class ProcessFailureException extends Exception {

    private final int exitCode;

    public ProcessFailureException(int exitCode) {
        super("Execution failed with code: " + exitCode);
        this.exitCode = exitCode;
    }

    public ProcessFailureException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Exit status of the process, -1 if it never ran to completion. */
    public int getExitCode() {
        return exitCode;
    }
}
