package com.impact.apidiff.cli;

import com.impact.apidiff.analyzer.CancellationSignal;
import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.service.BreakingChangeAnalysisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Analyses the configured repository once at startup. The application exits with the resulting code.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "breaking-changes.cli", name = "enabled", havingValue = "true")
public class AnalysisCliRunner implements ApplicationRunner, ExitCodeGenerator {

    private final BreakingChangeAnalysisService analysisService;
    private final AnalyzerProperties properties;
    private final CancellationSignal cancellation = new CancellationSignal();

    private volatile int exitCode;

    public AnalysisCliRunner(BreakingChangeAnalysisService analysisService, AnalyzerProperties properties) {
        this.analysisService = analysisService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Thread interruptHook = new Thread(() -> {
            log.warn("Shutdown requested, cancelling analysis.");
            cancellation.cancel();
        }, "analysis-cancel");
        Runtime.getRuntime().addShutdownHook(interruptHook);

        try {
            AnalysisReport report = analysisService.analyzeRepository(
                    properties.getRepositoryPath(), properties.getBaseRef(), properties.getHeadRef(), cancellation);
            exitCode = report.getExitCode();
            log.info("Breaking changes CLI run finished for {} with exit code {}.",
                    properties.getRepositoryPath(), exitCode);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(interruptHook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; cancel hook left registered.");
            }
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
