package com.impact.apidiff.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Writes the report as JSON to {@code breaking-changes.json-output}. Does nothing when that property is unset.
 */
@Slf4j
@Component
public class JsonFileReportSink implements ReportSink {

    private final ObjectMapper objectMapper;
    private final String outputPath;
    private final String repositoryPath;

    public JsonFileReportSink(ObjectMapper objectMapper, AnalyzerProperties properties) {
        this.objectMapper = objectMapper;
        this.outputPath = properties.getJsonOutput();
        this.repositoryPath = properties.getRepositoryPath();
    }

    @Override
    public void publish(AnalysisReport report) {
        if (outputPath == null || outputPath.isBlank()) {
            return;
        }
        Path target = Paths.get(outputPath);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(target.toFile(), toDocument(report));
            log.info("JSON report saved to {}", target.toAbsolutePath());
        } catch (IOException e) {
            log.error("Failed to write JSON report to {}: {}", target.toAbsolutePath(), e.getMessage(), e);
        }
    }

    Map<String, Object> toDocument(AnalysisReport report) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("timestamp", OffsetDateTime.now().toString());
        metadata.put("repositoryPath", repositoryPath);
        metadata.put("baseRef", report.getBaseRef());
        metadata.put("headRef", report.getHeadRef());
        metadata.put("totalFilesAnalyzed", report.getTotalFilesAnalyzed());
        metadata.put("totalChangesDetected", report.getTotalChangesDetected());
        metadata.put("exitCode", report.getExitCode());
        metadata.put("cancelled", report.isCancelled());

        List<ChangeRecord> changes = report.getBreakingChanges();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("bySeverity", report.getSeverityCounts());
        summary.put("byType", changes.stream()
                .collect(Collectors.groupingBy(change -> change.getKind().label(), TreeMap::new, Collectors.counting())));
        summary.put("filesWithChanges", changes.stream()
                .map(ChangeRecord::getFilePath)
                .collect(Collectors.toCollection(TreeSet::new)));
        summary.put("totalUsageLocations", report.getUsageLocations().values().stream().mapToInt(List::size).sum());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata);
        document.put("breakingChanges", changes);
        document.put("usageLocations", report.getUsageLocations());
        document.put("summary", summary);
        return document;
    }
}
