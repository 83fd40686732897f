package com.automate.ImageScan.Models;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * One completed scan with its full engine report. Never changes after creation.
 */
public record ScanRecord(
        Long id,
        String image,
        @JsonProperty("created_at") Instant createdAt,
        Map<Severity, Integer> summary,
        JsonNode report
) {
    public ScanModel toModel() {
        return new ScanModel(id, image, createdAt, summary);
    }
}
