package com.impact.apidiff.controller;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.AnalysisRequest;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.ConciseChangeReport;
import com.impact.apidiff.api.model.SourceDiffRequest;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.exception.SourceParseException;
import com.impact.apidiff.service.BreakingChangeAnalysisService;
import com.impact.apidiff.service.ExitCodePolicy;
import com.impact.apidiff.util.ReportPostProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;

/**
 * REST entry points for breaking-change analysis of a repository and of a single file.
 */
@Slf4j
@CrossOrigin
@RestController
@RequestMapping("/api/v1/impact")
public class ImpactAnalyzerController {

    private static final int MAX_PATH_LENGTH = 1024;
    private static final int MAX_REF_LENGTH = 255;
    private static final Pattern SAFE_REF = Pattern.compile("^[A-Za-z0-9_./~^@{}-]+$");
    private static final Pattern SAFE_PYTHON_FILE = Pattern.compile("^[A-Za-z0-9_./-]+\\.pyi?$");

    private final BreakingChangeAnalysisService analysisService;
    private final AnalyzerProperties properties;

    public ImpactAnalyzerController(BreakingChangeAnalysisService analysisService, AnalyzerProperties properties) {
        this.analysisService = analysisService;
        this.properties = properties;
    }

    /**
     * Full report for a repository.
     * URL: POST /api/v1/impact/analyze
     */
    @PostMapping(value = "/analyze", consumes = "application/json")
    public ResponseEntity<AnalysisReport> analyze(@RequestBody AnalysisRequest request) {
        log.info("Received analysis request for repository: {}", request.getRepositoryPath());

        if (!isValid(request)) {
            return ResponseEntity.badRequest().build();
        }

        try {
            AnalysisReport report = analysisService.analyzeRepository(
                    request.getRepositoryPath(), request.getBaseRef(), request.getHeadRef());
            if (report.getExitCode() == ExitCodePolicy.FAILED) {
                log.error("Analysis of {} failed.", request.getRepositoryPath());
                return ResponseEntity.internalServerError().body(report);
            }
            log.info("Analysis completed. {} breaking change(s) reported.", report.getTotalChangesDetected());
            return ResponseEntity.ok(report);
        } catch (IllegalArgumentException e) {
            log.error("Analysis failed due to invalid arguments: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Analysis failed due to internal server error.", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * One flat entry per breaking change, most severe first.
     * URL: POST /api/v1/impact/analyze/concise
     */
    @PostMapping(value = "/analyze/concise", consumes = "application/json")
    public ResponseEntity<List<ConciseChangeReport>> analyzeConcise(@RequestBody AnalysisRequest request) {
        log.info("Received concise analysis request for repository: {}", request.getRepositoryPath());

        if (!isValid(request)) {
            return ResponseEntity.badRequest().build();
        }

        try {
            AnalysisReport report = analysisService.analyzeRepository(
                    request.getRepositoryPath(), request.getBaseRef(), request.getHeadRef());
            if (report.getExitCode() == ExitCodePolicy.FAILED) {
                return ResponseEntity.internalServerError().build();
            }
            List<ConciseChangeReport> concise = ReportPostProcessor.processReport(report);
            log.info("Analysis completed successfully. Generated {} reports.", concise.size());
            return ResponseEntity.ok(concise);
        } catch (IllegalArgumentException e) {
            log.error("Analysis failed due to invalid arguments: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Analysis failed due to internal server error.", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    /**
     * Breaking changes between two versions of one file supplied inline.
     * URL: POST /api/v1/impact/diff
     */
    @PostMapping(value = "/diff", consumes = "application/json")
    public ResponseEntity<List<ChangeRecord>> diff(@RequestBody SourceDiffRequest request) {
        log.info("Received source diff request for file: {}", request.getFilePath());

        if (request.getFilePath() == null || !isSafeFilePath(request.getFilePath())) {
            log.warn("Bad Request: Missing or unsafe filePath: {}", request.getFilePath());
            return ResponseEntity.badRequest().build();
        }

        try {
            return ResponseEntity.ok(analysisService.diffSources(
                    request.getFilePath(), request.getOldSource(), request.getNewSource()));
        } catch (SourceParseException e) {
            log.warn("Bad Request: {} (line {})", e.getMessage(), e.getLine());
            return ResponseEntity.badRequest().build();
        } catch (IllegalArgumentException e) {
            log.error("Source diff failed due to invalid arguments: {}", e.getMessage());
            return ResponseEntity.badRequest().build();
        } catch (Exception e) {
            log.error("Source diff failed due to internal server error.", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    // --- Input Validation Helpers ---

    private boolean isValid(AnalysisRequest request) {
        String path = request.getRepositoryPath();
        if (path != null && (path.isBlank() || path.length() > MAX_PATH_LENGTH)) {
            log.warn("Bad Request: Unusable repositoryPath supplied.");
            return false;
        }
        if (path != null && !isUnderConfiguredRoot(path)) {
            log.warn("Bad Request: repositoryPath {} is outside {}", path, properties.getRepositoryPath());
            return false;
        }
        if (!isSafeRef(request.getBaseRef()) || !isSafeRef(request.getHeadRef())) {
            log.warn("Bad Request: Unsafe ref supplied: {} / {}", request.getBaseRef(), request.getHeadRef());
            return false;
        }
        return true;
    }

    // A request may only name the configured repository or a directory inside it
    private boolean isUnderConfiguredRoot(String path) {
        try {
            Path root = Paths.get(properties.getRepositoryPath()).toAbsolutePath().normalize();
            return Paths.get(path.trim()).toAbsolutePath().normalize().startsWith(root);
        } catch (InvalidPathException e) {
            log.warn("Bad Request: Invalid repositoryPath: {}", e.getMessage());
            return false;
        }
    }

    // Blank refs are allowed and fall back to the configured defaults
    private static boolean isSafeRef(String ref) {
        if (ref == null || ref.isBlank()) return true;
        String trimmed = ref.trim();
        if (trimmed.length() > MAX_REF_LENGTH || trimmed.contains("..")) return false;
        return SAFE_REF.matcher(trimmed).matches();
    }

    private static boolean isSafeFilePath(String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty() || trimmed.length() > MAX_PATH_LENGTH) return false;
        if (trimmed.contains("..") || trimmed.startsWith("/") || trimmed.contains("\\")) return false;
        return SAFE_PYTHON_FILE.matcher(trimmed).matches();
    }
}
