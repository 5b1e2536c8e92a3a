package com.impact.apidiff.util;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.ConciseChangeReport;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.UsageLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Flattens a full {@link AnalysisReport} into one {@link ConciseChangeReport} per breaking change,
 * most severe first.
 */
public final class ReportPostProcessor {

    private ReportPostProcessor() {}

    private static final Comparator<ConciseChangeReport> MOST_SEVERE_FIRST =
            Comparator.comparing((ConciseChangeReport report) -> report.severity, Comparator.reverseOrder());

    public static List<ConciseChangeReport> processReport(AnalysisReport report) {
        if (report == null || report.getBreakingChanges().isEmpty()) {
            return Collections.emptyList();
        }
        List<ConciseChangeReport> concise = new ArrayList<>();
        for (ChangeRecord change : report.getBreakingChanges()) {
            concise.add(toConciseReport(change, report.getUsageLocations().get(change.usageKey())));
        }
        // Stable sort keeps detection order within a severity
        concise.sort(MOST_SEVERE_FIRST);
        return concise;
    }

    private static ConciseChangeReport toConciseReport(ChangeRecord change, List<UsageLocation> locations) {
        ConciseChangeReport concise = new ConciseChangeReport();
        concise.changedElement = change.getElementName();
        concise.filePath = change.getFilePath();
        concise.kind = change.getKind();
        concise.severity = change.getSeverity() == null ? Severity.LOW : change.getSeverity();
        concise.summary = summarize(change);
        concise.usageCount = locations == null ? 0 : locations.size();
        concise.affectedFiles = new ArrayList<>(change.getAffectedFiles());
        return concise;
    }

    /**
     * Description followed by the old and new signature; removals carry the description only.
     */
    static String summarize(ChangeRecord change) {
        String description = change.getDescription() == null ? "" : change.getDescription().trim();
        if (change.getKind() != null && change.getKind().isRemoval()) {
            return description;
        }
        if (change.getOldSignature() == null || change.getOldSignature().equals(change.getNewSignature())) {
            return description;
        }
        return description + " (" + change.getOldSignature() + " -> " + change.getNewSignature() + ")";
    }
}
