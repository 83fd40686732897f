package com.automate.ImageScan.Controller;

import com.automate.ImageScan.Models.ScanModel;
import com.automate.ImageScan.Models.ScanRecord;
import com.automate.ImageScan.Service.ScanService;
import com.automate.ImageScan.dto.request.ScanRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@CrossOrigin(origins = "${app.cors.allowed-origins:http://localhost}")
@RequestMapping("/api")
@Slf4j
public class ScanController {

    private final ScanService scanService;

    public ScanController(ScanService scanService) {
        this.scanService = scanService;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanModel> scanImage(@Valid @RequestBody ScanRequest request) {
        log.info("Received scan request for image: {}", request.getImage());
        ScanModel result = scanService.startScan(request.getImage());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping("/scans")
    public List<ScanModel> getAllScans() {
        return scanService.getAllScans();
    }

    @GetMapping("/scans/{scanId}")
    public ResponseEntity<ScanRecord> getScanById(@PathVariable long scanId) {
        return ResponseEntity.ok(scanService.getScan(scanId));
    }
}
