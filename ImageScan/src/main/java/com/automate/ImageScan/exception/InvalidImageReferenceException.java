package com.automate.ImageScan.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

// image reference missing or blank
public class InvalidImageReferenceException extends ResponseStatusException {
    public InvalidImageReferenceException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
