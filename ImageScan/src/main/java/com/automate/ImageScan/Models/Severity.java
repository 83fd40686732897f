package com.automate.ImageScan.Models;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Severity labels shared with the UI. Keys of every summary, always all five.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN;

    /**
     * Maps an engine label to a severity, ignoring case. Missing or unrecognized labels
     * count as {@link #UNKNOWN} so no finding is ever dropped from a summary.
     */
    public static Severity parse(String label) {
        if (label == null || label.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    public static Map<Severity, Integer> emptySummary() {
        Map<Severity, Integer> summary = new EnumMap<>(Severity.class);
        for (Severity s : values()) {
            summary.put(s, 0);
        }
        return summary;
    }
}
