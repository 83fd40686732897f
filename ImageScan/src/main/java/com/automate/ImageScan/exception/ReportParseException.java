package com.automate.ImageScan.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

// engine output could not be interpreted as a scan report
public class ReportParseException extends ResponseStatusException {
    public ReportParseException(String message) {
        super(HttpStatus.BAD_GATEWAY, "Failed to parse scan report: " + message);
    }

    public ReportParseException(String message, Throwable cause) {
        super(HttpStatus.BAD_GATEWAY, "Failed to parse scan report: " + message, cause);
    }
}
