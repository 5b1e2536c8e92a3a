package com.impact.apidiff.service;

import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.config.AnalyzerProperties;
import org.springframework.stereotype.Component;

/**
 * Maps the findings of a run to a process exit code.
 */
@Component
public class ExitCodePolicy {

    public static final int CLEAN = 0;
    public static final int BREAKING = 1;
    public static final int FAILED = 2;

    private final boolean ignoreUnused;
    private final boolean failOnBreaking;

    public ExitCodePolicy(AnalyzerProperties properties) {
        this.ignoreUnused = properties.isIgnoreUnused();
        this.failOnBreaking = properties.isFailOnBreaking();
    }

    /**
     * Exit code for a run that completed. A used breaking change always fails the run; changes nobody
     * uses fail it unless unused changes are ignored.
     */
    public int exitCodeFor(AnalysisReport report) {
        if (report.getBreakingChanges().isEmpty()) {
            return CLEAN;
        }
        boolean anyUsed = report.getBreakingChanges().stream().anyMatch(report::hasUsages);
        int code;
        if (anyUsed) {
            code = BREAKING;
        } else {
            code = ignoreUnused ? CLEAN : BREAKING;
        }
        return failOnBreaking ? code : CLEAN;
    }

    /**
     * Exit code for a run that could not complete. Not relaxed by {@code fail-on-breaking}.
     */
    public int failure() {
        return FAILED;
    }
}
