package com.automate.ImageScan.entity;

import com.automate.ImageScan.Models.Severity;
import com.automate.ImageScan.util.ImageReferences;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
@Entity
@Table(name = "scans")
public class ScansEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "image", nullable = false, updatable = false, length = ImageReferences.MAX_LENGTH)
    private String image;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "critical_count", nullable = false, updatable = false)
    private int criticalCount;

    @Column(name = "high_count", nullable = false, updatable = false)
    private int highCount;

    @Column(name = "medium_count", nullable = false, updatable = false)
    private int mediumCount;

    @Column(name = "low_count", nullable = false, updatable = false)
    private int lowCount;

    @Column(name = "unknown_count", nullable = false, updatable = false)
    private int unknownCount;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "report", nullable = false, updatable = false)
    private JsonNode report;    // engine output as received

    public void applySummary(Map<Severity, Integer> summary) {
        this.criticalCount = summary.getOrDefault(Severity.CRITICAL, 0);
        this.highCount = summary.getOrDefault(Severity.HIGH, 0);
        this.mediumCount = summary.getOrDefault(Severity.MEDIUM, 0);
        this.lowCount = summary.getOrDefault(Severity.LOW, 0);
        this.unknownCount = summary.getOrDefault(Severity.UNKNOWN, 0);
    }

    public Map<Severity, Integer> toSummary() {
        return SeverityColumns.summary(criticalCount, highCount, mediumCount, lowCount, unknownCount);
    }
}
