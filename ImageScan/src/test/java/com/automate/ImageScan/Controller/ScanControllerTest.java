package com.automate.ImageScan.Controller;

import com.automate.ImageScan.Models.ScanModel;
import com.automate.ImageScan.Models.ScanRecord;
import com.automate.ImageScan.Models.Severity;
import com.automate.ImageScan.Service.ScanService;
import com.automate.ImageScan.exception.*;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScanController.class)
class ScanControllerTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:15:30.123456Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ScanService scanService;

    private static Map<Severity, Integer> alpineSummary() {
        Map<Severity, Integer> summary = Severity.emptySummary();
        summary.put(Severity.CRITICAL, 2);
        summary.put(Severity.LOW, 1);
        return summary;
    }

    @Test
    void startScanReturnsCreatedWithSummary() throws Exception {
        when(scanService.startScan("alpine:3.18"))
                .thenReturn(new ScanModel(1L, "alpine:3.18", CREATED, alpineSummary()));

        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"alpine:3.18\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.image").value("alpine:3.18"))
                .andExpect(jsonPath("$.created_at").value("2024-05-01T10:15:30.123456Z"))
                .andExpect(jsonPath("$.summary.CRITICAL").value(2))
                .andExpect(jsonPath("$.summary.HIGH").value(0))
                .andExpect(jsonPath("$.summary.MEDIUM").value(0))
                .andExpect(jsonPath("$.summary.LOW").value(1))
                .andExpect(jsonPath("$.summary.UNKNOWN").value(0))
                .andExpect(jsonPath("$.report").doesNotExist());
    }

    @Test
    void blankImageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Image name is required"));

        verify(scanService, never()).startScan(anyString());
    }

    @Test
    void overlongImageIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"" + "a".repeat(513) + "\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(containsString("512")));

        verify(scanService, never()).startScan(anyString());
    }

    @Test
    void nonJsonBodyIsUnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("alpine:3.18"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.message").isNotEmpty())
                .andExpect(jsonPath("$.path").value("/api/scan"));

        verifyNoInteractions(scanService);
    }

    @Test
    void wrongMethodIsMethodNotAllowed() throws Exception {
        mockMvc.perform(get("/api/scan"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(jsonPath("$.status").value(405))
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        mockMvc.perform(get("/api/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("No endpoint GET /api/nope"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("image=alpine"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").isNotEmpty());
    }

    @Test
    void engineFailureIsBadGateway() throws Exception {
        when(scanService.startScan("nope:0"))
                .thenThrow(ScanEngineException.exited("nope:0", 1, "MANIFEST_UNKNOWN"));

        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"nope:0\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value(containsString("MANIFEST_UNKNOWN")))
                .andExpect(jsonPath("$.path").value("/api/scan"));
    }

    @Test
    void timeoutIsBadGateway() throws Exception {
        when(scanService.startScan("huge:1")).thenThrow(new ScanTimeoutException("huge:1", Duration.ofMinutes(10)));

        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"huge:1\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value(containsString("timed out after 600 seconds")));
    }

    @Test
    void parseFailureIsBadGateway() throws Exception {
        when(scanService.startScan("alpine:3.18")).thenThrow(new ReportParseException("engine produced no output"));

        mockMvc.perform(post("/api/scan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"alpine:3.18\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    void listReturnsEmptyArrayWhenNoScans() throws Exception {
        when(scanService.getAllScans()).thenReturn(List.of());

        mockMvc.perform(get("/api/scans"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    void listReturnsSummariesWithoutReports() throws Exception {
        when(scanService.getAllScans()).thenReturn(List.of(
                new ScanModel(1L, "alpine:3.18", CREATED, alpineSummary()),
                new ScanModel(2L, "nginx:1.25", CREATED.plusSeconds(60), Severity.emptySummary())));

        mockMvc.perform(get("/api/scans"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[1].image").value("nginx:1.25"))
                .andExpect(jsonPath("$[1].summary.CRITICAL").value(0))
                .andExpect(jsonPath("$[0].report").doesNotExist());
    }

    @Test
    void getScanReturnsFullReport() throws Exception {
        var report = objectMapper.readTree("{\"Results\":[{\"Target\":\"alpine\",\"Vulnerabilities\":[]}]}");
        when(scanService.getScan(5L))
                .thenReturn(new ScanRecord(5L, "alpine:3.18", CREATED, Severity.emptySummary(), report));

        mockMvc.perform(get("/api/scans/5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(5))
                .andExpect(jsonPath("$.created_at").value("2024-05-01T10:15:30.123456Z"))
                .andExpect(jsonPath("$.summary.UNKNOWN").value(0))
                .andExpect(jsonPath("$.report.Results[0].Target").value("alpine"));
    }

    @Test
    void unknownScanIsNotFound() throws Exception {
        when(scanService.getScan(404L)).thenThrow(new ScanNotFoundException(404L));

        mockMvc.perform(get("/api/scans/404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Scan not found with id: 404"));
    }

    @Test
    void nonNumericIdIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/scans/latest"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(scanService);
    }
}
