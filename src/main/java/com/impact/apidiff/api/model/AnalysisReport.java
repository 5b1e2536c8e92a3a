package com.impact.apidiff.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Complete result of one analysis run, handed to every configured report sink.
 */
@Data
public class AnalysisReport {

    @JsonProperty("baseRef")
    private String baseRef;

    @JsonProperty("headRef")
    private String headRef;

    @JsonProperty("breakingChanges")
    private List<ChangeRecord> breakingChanges = new ArrayList<>();

    /** Keyed by {@link ChangeRecord#usageKey()}. */
    @JsonProperty("usageLocations")
    private Map<String, List<UsageLocation>> usageLocations = new LinkedHashMap<>();

    @JsonProperty("totalFilesAnalyzed")
    private int totalFilesAnalyzed;

    @JsonProperty("totalChangesDetected")
    private int totalChangesDetected;

    @JsonProperty("severityCounts")
    private Map<Severity, Integer> severityCounts = new EnumMap<>(Severity.class);

    @JsonProperty("exitCode")
    private int exitCode;

    @JsonProperty("cancelled")
    private boolean cancelled;

    public static AnalysisReport empty(String baseRef, String headRef) {
        AnalysisReport report = new AnalysisReport();
        report.setBaseRef(baseRef);
        report.setHeadRef(headRef);
        return report;
    }

    public boolean hasUsages(ChangeRecord change) {
        List<UsageLocation> locations = usageLocations.get(change.usageKey());
        return locations != null && !locations.isEmpty();
    }
}
