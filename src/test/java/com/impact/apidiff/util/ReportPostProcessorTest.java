package com.impact.apidiff.util;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeKind;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.ConciseChangeReport;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.UsageKind;
import com.impact.apidiff.api.model.UsageLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReportPostProcessorTest {

    private static ChangeRecord change(String element, ChangeKind kind, Severity severity, String oldSig, String newSig) {
        return ChangeRecord.builder()
                .kind(kind)
                .filePath("lib/api.py")
                .line(1)
                .elementName(element)
                .oldSignature(oldSig)
                .newSignature(newSig)
                .description("Description of " + element)
                .severity(severity)
                .build();
    }

    @Test
    @DisplayName("processReport orders most severe first and keeps detection order within a severity")
    void ordersBySeverity() {
        // Arrange
        ChangeRecord low = change("a", ChangeKind.RETURN_TYPE_ADDED, Severity.LOW, "a()", "a() -> int");
        ChangeRecord highFirst = change("b", ChangeKind.PARAMETER_REMOVED, Severity.HIGH, "b(x)", "b()");
        ChangeRecord medium = change("c", ChangeKind.DEFAULT_VALUE_CHANGED, Severity.MEDIUM, "c(x = 1)", "c(x = 2)");
        ChangeRecord highSecond = change("d", ChangeKind.FUNCTION_REMOVED, Severity.HIGH, "d()", ChangeRecord.REMOVED_SIGNATURE);
        highSecond.attachAffectedFiles(Set.of("app/z.py", "app/y.py"));

        AnalysisReport report = AnalysisReport.empty("base", "head");
        report.setBreakingChanges(List.of(low, highFirst, medium, highSecond));
        UsageLocation usage = UsageLocation.builder()
                .filePath("app/y.py").line(2).context("d()").usageKind(UsageKind.FUNCTION_CALL).confidence(0.7).build();
        report.getUsageLocations().put(highSecond.usageKey(), List.of(usage, usage));

        // Act
        List<ConciseChangeReport> concise = ReportPostProcessor.processReport(report);

        // Assert
        assertThat(concise).extracting(ConciseChangeReport::getChangedElement).containsExactly("b", "d", "c", "a");
        ConciseChangeReport removed = concise.get(1);
        assertThat(removed.getUsageCount()).isEqualTo(2);
        assertThat(removed.getAffectedFiles()).containsExactly("app/y.py", "app/z.py");
        assertThat(removed.getSummary()).isEqualTo("Description of d");
        assertThat(concise.get(0).getUsageCount()).isZero();
    }

    @Test
    @DisplayName("An empty or missing report yields an empty list")
    void emptyReport() {
        assertThat(ReportPostProcessor.processReport(null)).isEmpty();
        assertThat(ReportPostProcessor.processReport(AnalysisReport.empty("a", "b"))).isEmpty();
    }

    @Test
    @DisplayName("summarize appends old and new signatures only when they differ and the change is not a removal")
    void summarize() {
        assertThat(ReportPostProcessor.summarize(
                change("f", ChangeKind.PARAMETER_REMOVED, Severity.HIGH, "f(a)", "f()")))
                .isEqualTo("Description of f (f(a) -> f())");
        assertThat(ReportPostProcessor.summarize(
                change("g", ChangeKind.METHOD_REMOVED, Severity.HIGH, "g(self)", ChangeRecord.REMOVED_SIGNATURE)))
                .isEqualTo("Description of g");
        assertThat(ReportPostProcessor.summarize(
                change("h", ChangeKind.DEFAULT_VALUE_CHANGED, Severity.MEDIUM, "h()", "h()")))
                .isEqualTo("Description of h");
    }
}
