package com.automate.ImageScan.trivy;

import java.time.Duration;

/**
 * What the engine printed for one successful run.
 */
public record RawScanOutput(
        String stdout,
        String stderr,
        int exitCode,
        Duration elapsed
) {
    public static RawScanOutput of(String stdout) {
        return new RawScanOutput(stdout, "", 0, Duration.ZERO);
    }
}
