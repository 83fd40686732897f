package com.automate.ImageScan.Models;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record NormalizedReport(
        JsonNode report,
        Map<Severity, Integer> summary,
        int findingCount
) {}
