package com.automate.ImageScan.repository;

import com.automate.ImageScan.Models.ScanModel;
import com.automate.ImageScan.entity.SeverityColumns;

import java.time.Instant;

/**
 * Listing columns of {@code scans}. Leaves the report column unread.
 */
public interface ScanListView {
    Long getId();
    String getImage();
    Instant getCreatedAt();
    int getCriticalCount();
    int getHighCount();
    int getMediumCount();
    int getLowCount();
    int getUnknownCount();

    default ScanModel toModel() {
        return new ScanModel(getId(), getImage(), getCreatedAt(),
                SeverityColumns.summary(getCriticalCount(), getHighCount(), getMediumCount(),
                        getLowCount(), getUnknownCount()));
    }
}
