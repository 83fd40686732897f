package com.automate.ImageScan.Service;

import com.automate.ImageScan.Models.NormalizedReport;
import com.automate.ImageScan.Models.ScanModel;
import com.automate.ImageScan.Models.ScanRecord;
import com.automate.ImageScan.trivy.RawScanOutput;
import com.automate.ImageScan.trivy.ScanExecutor;
import com.automate.ImageScan.util.ImageReferences;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class ScanService {

    private final ScanExecutor scanExecutor;
    private final ReportNormalizer reportNormalizer;
    private final ScanStore scanStore;

    public ScanService(ScanExecutor scanExecutor, ReportNormalizer reportNormalizer, ScanStore scanStore) {
        this.scanExecutor = scanExecutor;
        this.reportNormalizer = reportNormalizer;
        this.scanStore = scanStore;
    }

    /**
     * Scans the image and records the result. A record exists afterwards only if this returns;
     * every failure propagates before anything is written.
     */
    public ScanModel startScan(String image) {
        String target = ImageReferences.requireValid(image);
        log.info("Starting scan for image: {}", target);

        RawScanOutput raw = scanExecutor.execute(target);
        NormalizedReport normalized = reportNormalizer.normalize(raw);
        ScanRecord record = scanStore.create(target, normalized.report(), normalized.summary());

        log.info("Scan completed: id={}, image={}, findings={}, summary={}",
                record.id(), target, normalized.findingCount(), record.summary());
        return record.toModel();
    }

    public List<ScanModel> getAllScans() {
        return scanStore.list();
    }

    public ScanRecord getScan(long id) {
        return scanStore.get(id);
    }
}
