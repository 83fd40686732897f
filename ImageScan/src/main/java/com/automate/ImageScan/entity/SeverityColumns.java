package com.automate.ImageScan.entity;

import com.automate.ImageScan.Models.Severity;

import java.util.Map;

/** Rebuilds a summary map from the five count columns of {@code scans}. */
public final class SeverityColumns {

    private SeverityColumns() {}

    public static Map<Severity, Integer> summary(int critical, int high, int medium, int low, int unknown) {
        Map<Severity, Integer> summary = Severity.emptySummary();
        summary.put(Severity.CRITICAL, critical);
        summary.put(Severity.HIGH, high);
        summary.put(Severity.MEDIUM, medium);
        summary.put(Severity.LOW, low);
        summary.put(Severity.UNKNOWN, unknown);
        return summary;
    }
}
