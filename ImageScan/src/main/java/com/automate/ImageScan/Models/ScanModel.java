package com.automate.ImageScan.Models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.time.Instant;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ScanModel {

    private Long id;
    private String image;

    @JsonProperty("created_at")
    private Instant createdAt;

    private Map<Severity, Integer> summary;     // CRITICAL..UNKNOWN, all present
}
