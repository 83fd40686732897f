package com.automate.ImageScan.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * The scanning engine could not be started, was interrupted, or exited with a failure code.
 * Carries the engine's stderr for operators.
 */
public class ScanEngineException extends ResponseStatusException {

    private static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String diagnostics;

    public ScanEngineException(String message, int exitCode, String diagnostics) {
        super(HttpStatus.BAD_GATEWAY, message);
        this.exitCode = exitCode;
        this.diagnostics = diagnostics;
    }

    public ScanEngineException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.diagnostics = cause == null ? null : cause.toString();
    }

    public static ScanEngineException exited(String image, int exitCode, String stderr) {
        String detail = stderr == null || stderr.isBlank()
                ? "exit code " + exitCode
                : stderr.strip();
        return new ScanEngineException("Scan of " + image + " failed: " + detail, exitCode, stderr);
    }

    public int getExitCode() { return exitCode; }
    public String getDiagnostics() { return diagnostics; }

    public boolean hasExitCode() { return exitCode != NO_EXIT_CODE; }
}
