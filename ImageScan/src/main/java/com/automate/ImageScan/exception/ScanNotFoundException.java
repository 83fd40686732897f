package com.automate.ImageScan.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class ScanNotFoundException extends ResponseStatusException {
    public ScanNotFoundException(long id) {
        super(HttpStatus.NOT_FOUND, "Scan not found with id: " + id);
    }
}
