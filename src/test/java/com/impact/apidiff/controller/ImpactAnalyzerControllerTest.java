package com.impact.apidiff.controller;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.AnalysisRequest;
import com.impact.apidiff.api.model.ChangeKind;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.ConciseChangeReport;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.SourceDiffRequest;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.exception.SourceParseException;
import com.impact.apidiff.service.BreakingChangeAnalysisService;
import com.impact.apidiff.service.ExitCodePolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImpactAnalyzerControllerTest {

    private BreakingChangeAnalysisService service;
    private ImpactAnalyzerController controller;

    @BeforeEach
    void setUp() {
        service = mock(BreakingChangeAnalysisService.class);
        AnalyzerProperties properties = new AnalyzerProperties();
        properties.setRepositoryPath("/repo");
        controller = new ImpactAnalyzerController(service, properties);
    }

    private static AnalysisRequest request(String path, String base, String head) {
        AnalysisRequest request = new AnalysisRequest();
        request.setRepositoryPath(path);
        request.setBaseRef(base);
        request.setHeadRef(head);
        return request;
    }

    private static SourceDiffRequest diffRequest(String filePath, String oldSource, String newSource) {
        SourceDiffRequest request = new SourceDiffRequest();
        request.setFilePath(filePath);
        request.setOldSource(oldSource);
        request.setNewSource(newSource);
        return request;
    }

    private static AnalysisReport reportWithExitCode(int exitCode) {
        AnalysisReport report = AnalysisReport.empty("main", "HEAD");
        report.setExitCode(exitCode);
        return report;
    }

    @Test
    @DisplayName("analyze returns the report for a valid request")
    void analyzeReturnsReport() {
        // Arrange
        AnalysisReport report = reportWithExitCode(ExitCodePolicy.CLEAN);
        when(service.analyzeRepository("/repo", "main", "HEAD~1")).thenReturn(report);

        // Act
        ResponseEntity<AnalysisReport> response = controller.analyze(request("/repo", "main", "HEAD~1"));

        // Assert
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(report);
    }

    @Test
    @DisplayName("A failed run is a server error that still carries the report")
    void analyzeFailedRun() {
        AnalysisReport report = reportWithExitCode(ExitCodePolicy.FAILED);
        when(service.analyzeRepository(any(), any(), any())).thenReturn(report);

        ResponseEntity<AnalysisReport> response = controller.analyze(request(null, null, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isSameAs(report);
    }

    @Test
    @DisplayName("Only the configured repository or a directory inside it may be analyzed")
    void analyzeRestrictsRepositoryPath() {
        // Arrange
        when(service.analyzeRepository(anyString(), any(), any())).thenReturn(reportWithExitCode(ExitCodePolicy.CLEAN));

        // Act & Assert
        assertThat(controller.analyze(request("/repo/services/api", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.OK);
        assertThat(controller.analyze(request("/etc", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.analyze(request("/repo/../etc", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.analyze(request("/repository", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.analyzeConcise(request("/etc", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        verify(service).analyzeRepository(anyString(), any(), any());
        verify(service, never()).analyzeRepository(eq("/etc"), any(), any());
    }

    @Test
    @DisplayName("Unsafe refs and blank paths are rejected before the service is called")
    void analyzeRejectsUnsafeInput() {
        assertThat(controller.analyze(request("/repo", "main..evil", null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.analyze(request("/repo", "main; rm -rf /", null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.analyze(request("   ", null, null)).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        verify(service, never()).analyzeRepository(any(), any(), any());
    }

    @Test
    @DisplayName("analyze/concise flattens the report, most severe first")
    void analyzeConcise() {
        AnalysisReport report = reportWithExitCode(ExitCodePolicy.BREAKING);
        report.setBreakingChanges(List.of(
                ChangeRecord.builder().kind(ChangeKind.RETURN_TYPE_ADDED).filePath("m.py").elementName("a")
                        .oldSignature("a()").newSignature("a() -> int").description("added").severity(Severity.LOW).build(),
                ChangeRecord.builder().kind(ChangeKind.FUNCTION_REMOVED).filePath("m.py").elementName("b")
                        .oldSignature("b()").newSignature(ChangeRecord.REMOVED_SIGNATURE).description("removed")
                        .severity(Severity.HIGH).build()));
        when(service.analyzeRepository(any(), any(), any())).thenReturn(report);

        ResponseEntity<List<ConciseChangeReport>> response = controller.analyzeConcise(request("/repo", null, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).extracting(ConciseChangeReport::getChangedElement).containsExactly("b", "a");
    }

    @Test
    @DisplayName("diff returns the change records of two inline versions")
    void diffReturnsChanges() throws Exception {
        List<ChangeRecord> changes = List.of(ChangeRecord.builder()
                .kind(ChangeKind.PARAMETER_REMOVED).filePath("pkg/m.py").elementName("f").build());
        when(service.diffSources("pkg/m.py", "old", "new")).thenReturn(changes);

        ResponseEntity<List<ChangeRecord>> response = controller.diff(diffRequest("pkg/m.py", "old", "new"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(changes);
    }

    @Test
    @DisplayName("diff maps invalid Python to 400 and rejects unsafe paths")
    void diffRejectsBadInput() throws Exception {
        when(service.diffSources(anyString(), any(), any()))
                .thenThrow(new SourceParseException("Syntax error", "pkg/m.py", 1));

        assertThat(controller.diff(diffRequest("pkg/m.py", "def f(:", "")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.diff(diffRequest("../etc/passwd.py", "", "")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.diff(diffRequest("/abs/m.py", "", "")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.diff(diffRequest("pkg/m.txt", "", "")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(controller.diff(diffRequest(null, "", "")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("Unexpected service failures become 500")
    void diffUnexpectedFailure() throws Exception {
        when(service.diffSources(anyString(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThat(controller.diff(diffRequest("pkg/m.py", "", "")).getStatusCode())
                .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
