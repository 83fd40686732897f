package com.automate.ImageScan.Config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties("scanner")
public class ScannerProperties {

    /** Engine command line; the image reference is appended as the last argument. */
    @NotEmpty
    private List<String> command = List.of("trivy", "image", "--quiet", "--format", "json");

    /** Engine cache directory. When {@code <cacheDir>/db} exists the database update is skipped. */
    private String cacheDir;

    private String skipDbUpdateFlag = "--skip-db-update";

    @NotNull
    private Duration timeout = Duration.ofMinutes(10);

    @Min(1) @Max(64)
    private int maxConcurrentScans = 2;

    /** stderr kept on a failed scan, for logs and the error response */
    @Min(100)
    private int diagnosticsMaxChars = 4_000;
}
