package com.impact.apidiff.service;

import com.impact.apidiff.analyzer.CancellationSignal;
import com.impact.apidiff.analyzer.CandidateFiles;
import com.impact.apidiff.analyzer.ChangeAggregator;
import com.impact.apidiff.analyzer.ImpactCoordinator;
import com.impact.apidiff.analyzer.PythonSyntaxParser;
import com.impact.apidiff.analyzer.SignatureDiffer;
import com.impact.apidiff.analyzer.StructuralExtractor;
import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeKind;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.UsageKind;
import com.impact.apidiff.api.model.UsageLocation;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.exception.ContentUnavailableException;
import com.impact.apidiff.exception.SourceParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BreakingChangeAnalysisServiceImplTest {

    private RevisionContentProviderFactory providerFactory;
    private RevisionContentProvider provider;
    private ChangeAggregator changeAggregator;
    private ImpactCoordinator impactCoordinator;
    private WorkingTreeFiles workingTreeFiles;
    private ReportSink firstSink;
    private ReportSink secondSink;
    private AnalyzerProperties properties;
    private BreakingChangeAnalysisServiceImpl service;

    @BeforeEach
    void setUp() throws Exception {
        providerFactory = mock(RevisionContentProviderFactory.class);
        provider = mock(RevisionContentProvider.class);
        changeAggregator = mock(ChangeAggregator.class);
        impactCoordinator = mock(ImpactCoordinator.class);
        workingTreeFiles = mock(WorkingTreeFiles.class);
        firstSink = mock(ReportSink.class);
        secondSink = mock(ReportSink.class);
        properties = new AnalyzerProperties();

        when(providerFactory.open(any(Path.class), any(), any())).thenReturn(provider);
        when(provider.baseRevision()).thenReturn("origin/main");
        when(provider.headRevision()).thenReturn("HEAD");

        StructuralExtractor extractor = new StructuralExtractor(new PythonSyntaxParser());
        service = new BreakingChangeAnalysisServiceImpl(
                providerFactory,
                changeAggregator,
                impactCoordinator,
                workingTreeFiles,
                extractor,
                new SignatureDiffer(),
                new ExitCodePolicy(properties),
                List.of(firstSink, secondSink),
                properties);
    }

    private static ChangeRecord removal(String name) {
        return ChangeRecord.builder()
                .kind(ChangeKind.FUNCTION_REMOVED)
                .filePath("lib/api.py")
                .line(1)
                .elementName(name)
                .oldSignature(name + "()")
                .newSignature(ChangeRecord.REMOVED_SIGNATURE)
                .description("Function '" + name + "' was removed")
                .severity(Severity.HIGH)
                .build();
    }

    @Test
    @DisplayName("A run with no changed files exits cleanly without a usage search")
    void noChangedFiles() throws Exception {
        // Arrange
        when(provider.changedFiles()).thenReturn(List.of());

        // Act
        AnalysisReport report = service.analyzeRepository("/repo", "", null);

        // Assert
        assertThat(report.getExitCode()).isEqualTo(ExitCodePolicy.CLEAN);
        assertThat(report.getTotalFilesAnalyzed()).isZero();
        assertThat(report.getBaseRef()).isEqualTo("origin/main");
        verify(providerFactory).open(Paths.get("/repo"), "origin/main", "HEAD");
        verify(changeAggregator, never()).aggregate(anyList(), any(), any());
        verify(provider).close();
        verify(firstSink).publish(report);
    }

    @Test
    @DisplayName("Used breaking changes are counted, linked to usages and fail the run")
    void usedChangesFail() throws Exception {
        ChangeRecord change = removal("connect");
        CandidateFiles candidates = new CandidateFiles(List.of("app.py"), path -> "");
        List<UsageLocation> usages = List.of(UsageLocation.builder()
                .filePath("app.py").line(3).context("connect()").usageKind(UsageKind.FUNCTION_CALL).confidence(0.7).build());

        when(provider.changedFiles()).thenReturn(List.of("lib/api.py", "lib/other.py"));
        when(changeAggregator.aggregate(eq(List.of("lib/api.py", "lib/other.py")), eq(provider), any(CancellationSignal.class)))
                .thenReturn(List.of(change));
        when(workingTreeFiles.list(Paths.get("/repo"))).thenReturn(candidates);
        when(impactCoordinator.computeImpact(eq(List.of(change)), eq(candidates), any(CancellationSignal.class)))
                .thenReturn(Map.of(change.usageKey(), usages));

        AnalysisReport report = service.analyzeRepository("/repo", "main", "feature");

        assertThat(report.getTotalFilesAnalyzed()).isEqualTo(2);
        assertThat(report.getTotalChangesDetected()).isEqualTo(1);
        assertThat(report.getSeverityCounts()).containsEntry(Severity.HIGH, 1);
        assertThat(report.getUsageLocations()).containsKey("lib/api.py:connect");
        assertThat(report.getExitCode()).isEqualTo(ExitCodePolicy.BREAKING);
        assertThat(report.isCancelled()).isFalse();
        verify(providerFactory).open(Paths.get("/repo"), "main", "feature");
    }

    @Test
    @DisplayName("An unknown revision produces an empty report with the failure exit code")
    void unavailableRepositoryFails() throws Exception {
        when(providerFactory.open(any(Path.class), any(), any()))
                .thenThrow(new ContentUnavailableException("Unknown revision: nope", "nope"));

        AnalysisReport report = service.analyzeRepository("/repo", "nope", "HEAD");

        assertThat(report.getExitCode()).isEqualTo(ExitCodePolicy.FAILED);
        assertThat(report.getBreakingChanges()).isEmpty();
        assertThat(report.getBaseRef()).isEqualTo("nope");
        verify(firstSink).publish(report);
    }

    @Test
    @DisplayName("A failing sink does not stop the other sinks")
    void sinkFailureIsIsolated() throws Exception {
        when(provider.changedFiles()).thenReturn(List.of());
        doThrow(new IllegalStateException("disk full")).when(firstSink).publish(any());

        AnalysisReport report = service.analyzeRepository(null, null, null);

        ArgumentCaptor<AnalysisReport> captor = ArgumentCaptor.forClass(AnalysisReport.class);
        verify(secondSink).publish(captor.capture());
        assertThat(captor.getValue()).isSameAs(report);
    }

    @Test
    @DisplayName("A cancelled run skips the usage search and is flagged")
    void cancelledRun() throws Exception {
        CancellationSignal cancellation = new CancellationSignal();
        when(provider.changedFiles()).thenReturn(List.of("lib/api.py"));
        when(changeAggregator.aggregate(anyList(), eq(provider), eq(cancellation))).thenAnswer(invocation -> {
            cancellation.cancel();
            return List.of(removal("connect"));
        });

        AnalysisReport report = service.analyzeRepository("/repo", null, null, cancellation);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.getUsageLocations()).isEmpty();
        verify(workingTreeFiles, never()).list(any());
    }

    @Test
    @DisplayName("diffSources compares two inline versions of a file")
    void diffSources() throws Exception {
        List<ChangeRecord> changes = service.diffSources("pkg/m.py",
                "def f(a, b=1):\n    pass\n", "def f(a, b):\n    pass\n");

        assertThat(changes).extracting(ChangeRecord::getKind).containsExactly(ChangeKind.PARAMETER_BECAME_REQUIRED);
    }

    @Test
    @DisplayName("diffSources rejects a blank path and invalid source")
    void diffSourcesRejectsBadInput() {
        assertThatThrownBy(() -> service.diffSources(" ", "", ""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.diffSources("m.py", "def f(:\n", ""))
                .isInstanceOf(SourceParseException.class);
    }
}
