package com.automate.ImageScan.dto;

public record ErrorResponse(
        int status,
        String error,
        String message,
        String path
) {}
