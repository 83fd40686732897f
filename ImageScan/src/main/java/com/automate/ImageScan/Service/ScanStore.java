package com.automate.ImageScan.Service;

import com.automate.ImageScan.Models.ScanModel;
import com.automate.ImageScan.Models.ScanRecord;
import com.automate.ImageScan.Models.Severity;
import com.automate.ImageScan.entity.ScansEntity;
import com.automate.ImageScan.exception.ScanNotFoundException;
import com.automate.ImageScan.exception.ScanStorageException;
import com.automate.ImageScan.repository.ScanListView;
import com.automate.ImageScan.repository.ScansRepository;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * Durable scan history. Records are inserted once and only read afterwards.
 * Ids come from the database identity column, so listing by id is listing in creation order.
 */
@Slf4j
@Service
public class ScanStore {

    private final ScansRepository scansRepository;

    public ScanStore(ScansRepository scansRepository) {
        this.scansRepository = scansRepository;
    }

    @Transactional
    public ScanRecord create(String image, JsonNode report, Map<Severity, Integer> summary) {
        ScansEntity scan = new ScansEntity();
        scan.setImage(image);
        // database timestamps keep microseconds
        scan.setCreatedAt(Instant.now().truncatedTo(ChronoUnit.MICROS));
        scan.applySummary(summary);
        scan.setReport(report);

        try {
            scan = scansRepository.saveAndFlush(scan);
        } catch (DataAccessException e) {
            log.error("Failed to persist scan of {}", image, e);
            throw new ScanStorageException("Failed to store scan of " + image, e);
        }
        log.info("Stored scan {} for {}", scan.getId(), image);
        return toRecord(scan);
    }

    @Transactional(readOnly = true)
    public List<ScanModel> list() {
        return scansRepository.findAllByOrderByIdAsc().stream()
                .map(ScanListView::toModel)
                .toList();
    }

    @Transactional(readOnly = true)
    public ScanRecord get(long id) {
        return scansRepository.findById(id)
                .map(ScanStore::toRecord)
                .orElseThrow(() -> new ScanNotFoundException(id));
    }

    private static ScanRecord toRecord(ScansEntity scan) {
        return new ScanRecord(
                scan.getId(),
                scan.getImage(),
                scan.getCreatedAt(),
                scan.toSummary(),
                scan.getReport()
        );
    }
}
