package com.impact.apidiff.service;

import com.impact.apidiff.analyzer.CancellationSignal;
import com.impact.apidiff.analyzer.CandidateFiles;
import com.impact.apidiff.analyzer.ChangeAggregator;
import com.impact.apidiff.analyzer.ImpactCoordinator;
import com.impact.apidiff.analyzer.SignatureDiffer;
import com.impact.apidiff.analyzer.StructuralExtractor;
import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.Severity;
import com.impact.apidiff.api.model.StructuralModel;
import com.impact.apidiff.api.model.UsageLocation;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.exception.ContentUnavailableException;
import com.impact.apidiff.exception.SourceParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class BreakingChangeAnalysisServiceImpl implements BreakingChangeAnalysisService {

    private final RevisionContentProviderFactory providerFactory;
    private final ChangeAggregator changeAggregator;
    private final ImpactCoordinator impactCoordinator;
    private final WorkingTreeFiles workingTreeFiles;
    private final StructuralExtractor extractor;
    private final SignatureDiffer differ;
    private final ExitCodePolicy exitCodePolicy;
    private final List<ReportSink> reportSinks;
    private final AnalyzerProperties properties;

    public BreakingChangeAnalysisServiceImpl(RevisionContentProviderFactory providerFactory,
                                             ChangeAggregator changeAggregator,
                                             ImpactCoordinator impactCoordinator,
                                             WorkingTreeFiles workingTreeFiles,
                                             StructuralExtractor extractor,
                                             SignatureDiffer differ,
                                             ExitCodePolicy exitCodePolicy,
                                             List<ReportSink> reportSinks,
                                             AnalyzerProperties properties) {
        this.providerFactory = providerFactory;
        this.changeAggregator = changeAggregator;
        this.impactCoordinator = impactCoordinator;
        this.workingTreeFiles = workingTreeFiles;
        this.extractor = extractor;
        this.differ = differ;
        this.exitCodePolicy = exitCodePolicy;
        this.reportSinks = reportSinks;
        this.properties = properties;
        log.info("BreakingChangeAnalysisService initialized with {} report sink(s).", reportSinks.size());
    }

    @Override
    public AnalysisReport analyzeRepository(String repositoryPath, String baseRef, String headRef) {
        return analyzeRepository(repositoryPath, baseRef, headRef, CancellationSignal.none());
    }

    @Override
    public AnalysisReport analyzeRepository(String repositoryPath,
                                            String baseRef,
                                            String headRef,
                                            CancellationSignal cancellation) {
        String repo = orDefault(repositoryPath, properties.getRepositoryPath());
        String base = orDefault(baseRef, properties.getBaseRef());
        String head = orDefault(headRef, properties.getHeadRef());
        Path root = Paths.get(repo);

        log.info("Starting breaking changes analysis of {} ({}..{}).", root.toAbsolutePath(), base, head);
        AnalysisReport report;
        try (RevisionContentProvider provider = providerFactory.open(root, base, head)) {
            report = runAnalysis(root, provider, cancellation);
        } catch (ContentUnavailableException | IOException | RuntimeException e) {
            log.error("Critical error during analysis of {}.", root.toAbsolutePath(), e);
            report = AnalysisReport.empty(base, head);
            report.setExitCode(exitCodePolicy.failure());
        }

        publish(report);
        log.info("Analysis finished with exit code {}.", report.getExitCode());
        return report;
    }

    private AnalysisReport runAnalysis(Path root, RevisionContentProvider provider, CancellationSignal cancellation)
            throws ContentUnavailableException, IOException {
        AnalysisReport report = AnalysisReport.empty(provider.baseRevision(), provider.headRevision());

        List<String> changedFiles = provider.changedFiles();
        report.setTotalFilesAnalyzed(changedFiles.size());
        if (changedFiles.isEmpty()) {
            log.info("No Python files changed, no analysis needed.");
            report.setExitCode(exitCodePolicy.exitCodeFor(report));
            return report;
        }

        List<ChangeRecord> changes = changeAggregator.aggregate(changedFiles, provider, cancellation);
        report.setBreakingChanges(changes);
        report.setTotalChangesDetected(changes.size());
        report.setSeverityCounts(countBySeverity(changes));

        if (!changes.isEmpty() && !cancellation.isCancelled()) {
            CandidateFiles candidates = workingTreeFiles.list(root);
            Map<String, List<UsageLocation>> usages = impactCoordinator.computeImpact(changes, candidates, cancellation);
            report.setUsageLocations(usages);
        }

        report.setCancelled(cancellation.isCancelled());
        report.setExitCode(exitCodePolicy.exitCodeFor(report));
        return report;
    }

    @Override
    public List<ChangeRecord> diffSources(String filePath, String oldSource, String newSource) throws SourceParseException {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path must not be empty.");
        }
        StructuralModel oldModel = extractor.extract(nullToEmpty(oldSource), filePath);
        StructuralModel newModel = extractor.extract(nullToEmpty(newSource), filePath);
        List<ChangeRecord> changes = differ.diff(oldModel, newModel, filePath);
        log.info("Source diff of {} produced {} change(s).", filePath, changes.size());
        return changes;
    }

    private void publish(AnalysisReport report) {
        for (ReportSink sink : reportSinks) {
            try {
                sink.publish(report);
            } catch (RuntimeException e) {
                log.error("Report sink {} failed.", sink.getClass().getSimpleName(), e);
            }
        }
    }

    private static Map<Severity, Integer> countBySeverity(List<ChangeRecord> changes) {
        Map<Severity, Integer> counts = new EnumMap<>(Severity.class);
        for (ChangeRecord change : changes) {
            counts.merge(change.getSeverity(), 1, Integer::sum);
        }
        return counts;
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
