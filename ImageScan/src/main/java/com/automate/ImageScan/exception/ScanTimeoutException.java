package com.automate.ImageScan.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

public class ScanTimeoutException extends ResponseStatusException {
    public ScanTimeoutException(String image, Duration timeout) {
        super(HttpStatus.BAD_GATEWAY,
                "Scan of " + image + " timed out after " + timeout.toSeconds() + " seconds");
    }
}
