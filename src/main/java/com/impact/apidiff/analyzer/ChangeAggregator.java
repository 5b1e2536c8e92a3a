package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.StructuralModel;
import com.impact.apidiff.exception.ContentUnavailableException;
import com.impact.apidiff.service.RevisionContentProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Runs extraction and diffing for every changed file and concatenates the results.
 * <p>
 * Files are processed in parallel on the analysis executor but merged in sorted path order,
 * so the same inputs always yield the same list.
 */
@Slf4j
@Component
public class ChangeAggregator {

    private final StructuralExtractor extractor;
    private final SignatureDiffer differ;
    private final ExecutorService analysisExecutor;

    public ChangeAggregator(StructuralExtractor extractor,
                            SignatureDiffer differ,
                            ExecutorService analysisExecutor) {
        this.extractor = extractor;
        this.differ = differ;
        this.analysisExecutor = analysisExecutor;
    }

    public List<ChangeRecord> aggregate(List<String> changedFilePaths, RevisionContentProvider contentProvider) {
        return aggregate(changedFilePaths, contentProvider, CancellationSignal.none());
    }

    public List<ChangeRecord> aggregate(List<String> changedFilePaths,
                                        RevisionContentProvider contentProvider,
                                        CancellationSignal cancellation) {
        List<String> files = new ArrayList<>(new TreeSet<>(changedFilePaths));
        log.info("Analyzing {} changed file(s) between {} and {}.",
                files.size(), contentProvider.baseRevision(), contentProvider.headRevision());

        List<CompletableFuture<List<ChangeRecord>>> futures = files.stream()
                .map(file -> CompletableFuture.supplyAsync(
                        () -> analyzeFileIfActive(file, contentProvider, cancellation), analysisExecutor))
                .collect(Collectors.toList());

        // Merge in submission order, which is the sorted file order
        List<ChangeRecord> changes = new ArrayList<>();
        for (CompletableFuture<List<ChangeRecord>> future : futures) {
            changes.addAll(future.join());
        }

        log.info("Detected {} breaking change(s) across {} file(s).", changes.size(), files.size());
        return changes;
    }

    private List<ChangeRecord> analyzeFileIfActive(String filePath,
                                                   RevisionContentProvider contentProvider,
                                                   CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            log.debug("Skipping {}: analysis cancelled.", filePath);
            return List.of();
        }
        try {
            return analyzeFile(filePath, contentProvider);
        } catch (ContentUnavailableException e) {
            log.warn("Skipping {}: content unavailable at {}: {}", filePath, e.getRevision(), e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Unexpected failure while analyzing {}. File skipped.", filePath, e);
        }
        return List.of();
    }

    List<ChangeRecord> analyzeFile(String filePath, RevisionContentProvider contentProvider)
            throws ContentUnavailableException {
        String baseContent = contentProvider.contentAt(filePath, contentProvider.baseRevision());
        String headContent = contentProvider.contentAt(filePath, contentProvider.headRevision());

        if (baseContent.isEmpty() && headContent.isEmpty()) {
            log.debug("Skipping {}: empty at both revisions.", filePath);
            return List.of();
        }

        StructuralModel oldModel = baseContent.isEmpty()
                ? StructuralModel.empty()
                : extractor.tryExtract(baseContent, filePath).orElse(StructuralModel.empty());
        StructuralModel newModel = headContent.isEmpty()
                ? StructuralModel.empty()
                : extractor.tryExtract(headContent, filePath).orElse(StructuralModel.empty());
        if (oldModel.isEmpty()) {
            // Added file, or a base that did not parse
            return List.of();
        }

        List<ChangeRecord> changes = differ.diff(oldModel, newModel, filePath);
        log.debug("{}: {} change(s).", filePath, changes.size());
        return changes;
    }
}
