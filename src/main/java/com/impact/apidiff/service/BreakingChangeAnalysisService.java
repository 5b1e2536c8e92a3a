package com.impact.apidiff.service;

import com.impact.apidiff.analyzer.CancellationSignal;
import com.impact.apidiff.api.model.AnalysisReport;
import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.exception.SourceParseException;

import java.util.List;

public interface BreakingChangeAnalysisService {

    /**
     * Compares two revisions of a local repository, searches its working tree for usages of every breaking
     * change and publishes the report to all sinks. Blank arguments fall back to the configured defaults.
     * Never throws: a run that fails as a whole yields an empty report with the failure exit code.
     */
    AnalysisReport analyzeRepository(String repositoryPath, String baseRef, String headRef);

    AnalysisReport analyzeRepository(String repositoryPath, String baseRef, String headRef, CancellationSignal cancellation);

    /**
     * Breaking changes between two versions of a single file, without usage search.
     *
     * @throws SourceParseException when either version is not valid Python
     */
    List<ChangeRecord> diffSources(String filePath, String oldSource, String newSource) throws SourceParseException;
}
