package com.impact.apidiff.service;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.UsageLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Writes a human-readable summary of the report to the application log.
 */
@Slf4j
@Component
public class LoggingReportSink implements ReportSink {

    static final int LOCATIONS_PER_CHANGE = 3;
    static final int LISTED_FILES = 10;

    private static final Severity[] DISPLAY_ORDER = {Severity.CRITICAL, Severity.HIGH, Severity.MEDIUM, Severity.LOW};

    @Override
    public void publish(AnalysisReport report) {
        log.info("=== Breaking changes analysis {}..{} ===", report.getBaseRef(), report.getHeadRef());
        log.info("Files analyzed: {}, breaking changes: {}, exit code: {}{}",
                report.getTotalFilesAnalyzed(), report.getTotalChangesDetected(), report.getExitCode(),
                report.isCancelled() ? " (cancelled)" : "");

        if (report.getBreakingChanges().isEmpty()) {
            log.info("No breaking changes detected.");
            return;
        }

        Map<Severity, List<ChangeRecord>> bySeverity = report.getBreakingChanges().stream()
                .collect(Collectors.groupingBy(ChangeRecord::getSeverity));
        for (Severity severity : DISPLAY_ORDER) {
            List<ChangeRecord> changes = bySeverity.getOrDefault(severity, List.of());
            if (!changes.isEmpty()) {
                logSeverityGroup(report, severity, changes);
            }
        }
        logUsageImpact(report.getUsageLocations());
    }

    private void logSeverityGroup(AnalysisReport report, Severity severity, List<ChangeRecord> changes) {
        log.info("{} severity ({} change(s)):", severity.name(), changes.size());
        int index = 1;
        for (ChangeRecord change : changes) {
            log.info("  {}. {} [{}] {}:{}", index++, change.getDescription(), change.getKind().label(),
                    change.getFilePath(), change.getLine());
            if (!change.getOldSignature().equals(change.getNewSignature())) {
                log.info("     old: {}", change.getOldSignature());
                log.info("     new: {}", change.getNewSignature());
            }
            List<UsageLocation> locations = report.getUsageLocations().get(change.usageKey());
            if (locations == null || locations.isEmpty()) {
                log.info("     No usage detected");
                continue;
            }
            log.info("     Used in {} location(s):", locations.size());
            locations.stream().limit(LOCATIONS_PER_CHANGE).forEach(location ->
                    log.info("       {}:{} ({})", location.getFilePath(), location.getLine(), location.getUsageKind().label()));
            if (locations.size() > LOCATIONS_PER_CHANGE) {
                log.info("       ... and {} more", locations.size() - LOCATIONS_PER_CHANGE);
            }
        }
    }

    private void logUsageImpact(Map<String, List<UsageLocation>> usageLocations) {
        if (usageLocations.isEmpty()) {
            return;
        }
        Map<String, Long> perFile = usageLocations.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.groupingBy(UsageLocation::getFilePath, TreeMap::new, Collectors.counting()));
        long total = perFile.values().stream().mapToLong(Long::longValue).sum();

        log.info("Usage impact: {} location(s) in {} file(s).", total, perFile.size());
        perFile.entrySet().stream().limit(LISTED_FILES).forEach(entry ->
                log.info("  - {} ({} usage(s))", entry.getKey(), entry.getValue()));
        if (perFile.size() > LISTED_FILES) {
            log.info("  ... and {} more file(s)", perFile.size() - LISTED_FILES);
        }
    }
}
