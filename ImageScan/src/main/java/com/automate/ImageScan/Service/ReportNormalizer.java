package com.automate.ImageScan.Service;

import com.automate.ImageScan.Models.NormalizedReport;
import com.automate.ImageScan.Models.Severity;
import com.automate.ImageScan.exception.ReportParseException;
import com.automate.ImageScan.trivy.RawScanOutput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Turns engine JSON into a stored report and its severity summary.
 * Findings are {@code Results[*].Vulnerabilities[*]}; each is counted once under its {@code Severity}.
 */
@Service
public class ReportNormalizer {

    static final String RESULTS = "Results";
    static final String VULNERABILITIES = "Vulnerabilities";
    static final String SEVERITY = "Severity";

    // anything after the report (log lines, a second document) makes the output unusable
    private final ObjectReader reportReader;

    public ReportNormalizer(ObjectMapper objectMapper) {
        this.reportReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public NormalizedReport normalize(RawScanOutput raw) {
        String stdout = raw == null ? null : raw.stdout();
        if (stdout == null || stdout.isBlank()) {
            throw new ReportParseException("engine produced no output");
        }

        JsonNode report;
        try {
            report = reportReader.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new ReportParseException(e.getOriginalMessage(), e);
        }
        if (report == null || !report.isObject()) {
            throw new ReportParseException("expected a JSON object at the top level");
        }

        Map<Severity, Integer> summary = Severity.emptySummary();
        int findings = 0;
        for (JsonNode result : arrayOrEmpty(report, RESULTS)) {
            for (JsonNode vuln : arrayOrEmpty(result, VULNERABILITIES)) {
                Severity severity = Severity.parse(vuln.path(SEVERITY).asText(null));
                summary.merge(severity, 1, Integer::sum);
                findings++;
            }
        }
        return new NormalizedReport(report, summary, findings);
    }

    // absent and null both mean "nothing here"
    private static Iterable<JsonNode> arrayOrEmpty(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ReportParseException("'" + field + "' is not an array");
        }
        return node;
    }
}
