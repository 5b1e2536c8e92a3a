package com.impact.apidiff.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for breaking-change analysis, bound from the {@code breaking-changes.*} namespace.
 * Relaxed binding also accepts environment variables such as {@code BREAKING_CHANGES_BASE_REF}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "breaking-changes")
public class AnalyzerProperties {

    @NotBlank
    private String baseRef = "origin/main";

    @NotBlank
    private String headRef = "HEAD";

    @NotBlank
    private String repositoryPath = ".";

    /** Unused breaking changes do not fail the run. */
    private boolean ignoreUnused = false;

    @NotEmpty
    private List<String> includePatterns = new ArrayList<>(List.of("**/*.py"));

    private List<String> excludePatterns = new ArrayList<>(List.of(
            "**/test_*.py",
            "**/tests/**/*.py",
            "**/__pycache__/**",
            "**/.*/**",
            "**/venv/**",
            "**/env/**",
            "**/.venv/**",
            "**/site-packages/**",
            "**/node_modules/**"
    ));

    /** Leading path segment dropped when deriving a dotted module path. */
    private String sourceRootPrefix = "src";

    /** When set, the full report is also written to this file as JSON. */
    private String jsonOutput;

    private boolean failOnBreaking = true;

    @Min(1)
    private int maxUsageSearchFiles = 10000;

    private boolean enableAstAnalysis = true;

    private boolean enableRegexAnalysis = true;

    @Min(1)
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    private Cli cli = new Cli();

    @Data
    public static class Cli {
        /** Run one analysis of {@code repository-path} at startup and exit with its code. */
        private boolean enabled = false;
    }
}
