package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.UsageKind;
import com.impact.apidiff.api.model.UsageLocation;
import com.impact.apidiff.api.model.UsagePattern;
import com.impact.apidiff.config.AnalyzerProperties;
import com.impact.apidiff.exception.PatternCompileException;
import com.impact.apidiff.util.ContextWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Searches candidate files for usages of one changed element with two independent passes:
 * a line-by-line text search over the generated patterns and a syntax-aware walk.
 * Both passes report into the same list; overlapping hits are kept.
 */
@Slf4j
@Component
public class UsageScanner {

    static final int TEXT_CONTEXT_LINES = 2;

    static final double TEXT_CONFIDENCE = 0.7;
    static final double QUALIFIED_TEXT_CONFIDENCE = 0.8;
    static final double STAR_IMPORT_TEXT_CONFIDENCE = 0.3;

    private static final Comparator<UsageLocation> BY_FILE_AND_LINE =
            Comparator.comparing(UsageLocation::getFilePath).thenComparingInt(UsageLocation::getLine);

    private final StructuralUsageFinder structuralFinder;
    private final ExecutorService analysisExecutor;
    private final boolean textPassEnabled;
    private final boolean structuralPassEnabled;

    public UsageScanner(StructuralUsageFinder structuralFinder,
                        ExecutorService analysisExecutor,
                        AnalyzerProperties properties) {
        this.structuralFinder = structuralFinder;
        this.analysisExecutor = analysisExecutor;
        this.textPassEnabled = properties.isEnableRegexAnalysis();
        this.structuralPassEnabled = properties.isEnableAstAnalysis();
    }

    public List<UsageLocation> scan(List<UsagePattern> patterns, CandidateFiles candidates, String excludeFilePath) {
        return scan(patterns, candidates, excludeFilePath, CancellationSignal.none());
    }

    public List<UsageLocation> scan(List<UsagePattern> patterns,
                                    CandidateFiles candidates,
                                    String excludeFilePath,
                                    CancellationSignal cancellation) {
        if (patterns.isEmpty()) {
            return List.of();
        }
        String elementName = patterns.get(0).getElementName();
        List<CompiledPattern> compiled = textPassEnabled ? compileAll(patterns) : List.of();

        List<String> files = candidates.getPaths().stream()
                .filter(path -> !isSameFile(path, excludeFilePath))
                .collect(Collectors.toList());

        List<CompletableFuture<List<UsageLocation>>> futures = files.stream()
                .map(path -> CompletableFuture.supplyAsync(
                        () -> scanFileIfActive(path, candidates.getReader(), compiled, elementName, cancellation),
                        analysisExecutor))
                .collect(Collectors.toList());

        List<UsageLocation> locations = new ArrayList<>();
        for (CompletableFuture<List<UsageLocation>> future : futures) {
            locations.addAll(future.join());
        }
        locations.sort(BY_FILE_AND_LINE);

        log.debug("Found {} usage location(s) of '{}' in {} file(s).", locations.size(), elementName, files.size());
        return locations;
    }

    private List<UsageLocation> scanFileIfActive(String filePath,
                                                 SourceFileReader reader,
                                                 List<CompiledPattern> patterns,
                                                 String elementName,
                                                 CancellationSignal cancellation) {
        if (cancellation.isCancelled()) {
            return List.of();
        }
        String source;
        try {
            source = reader.read(filePath);
        } catch (IOException e) {
            log.warn("Skipping unreadable file {}: {}", filePath, e.getMessage());
            return List.of();
        }
        if (source == null || source.isEmpty()) {
            return List.of();
        }

        List<UsageLocation> locations = new ArrayList<>();
        try {
            if (textPassEnabled) {
                locations.addAll(searchText(filePath, source, patterns));
            }
            if (structuralPassEnabled) {
                locations.addAll(structuralFinder.find(filePath, source, elementName));
            }
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Usage search failed for {}. File skipped.", filePath, e);
            return List.of();
        }
        return locations;
    }

    List<UsageLocation> searchText(String filePath, String source, List<CompiledPattern> patterns) {
        String[] lines = ContextWindow.splitLines(source);
        List<UsageLocation> locations = new ArrayList<>();
        for (CompiledPattern pattern : patterns) {
            for (int i = 0; i < lines.length; i++) {
                Matcher matcher = pattern.regex.matcher(lines[i]);
                while (matcher.find()) {
                    locations.add(UsageLocation.builder()
                            .filePath(filePath)
                            .line(i + 1)
                            .context(ContextWindow.around(lines, i + 1, TEXT_CONTEXT_LINES, TEXT_CONTEXT_LINES))
                            .usageKind(pattern.usageKind)
                            .confidence(textConfidence(pattern.usageKind))
                            .build());
                }
            }
        }
        return locations;
    }

    List<CompiledPattern> compileAll(List<UsagePattern> patterns) {
        List<CompiledPattern> compiled = new ArrayList<>(patterns.size());
        for (UsagePattern pattern : patterns) {
            try {
                compiled.add(compile(pattern));
            } catch (PatternCompileException e) {
                log.warn("Skipping usage pattern for '{}': {}", pattern.getElementName(), e.getMessage());
            }
        }
        return compiled;
    }

    private static CompiledPattern compile(UsagePattern pattern) throws PatternCompileException {
        try {
            return new CompiledPattern(Pattern.compile(pattern.getRegex()), pattern.getUsageKind());
        } catch (PatternSyntaxException e) {
            throw new PatternCompileException(pattern.getRegex(), e);
        }
    }

    private static double textConfidence(UsageKind kind) {
        switch (kind) {
            case QUALIFIED_USAGE:
            case DIRECT_IMPORT:
                return QUALIFIED_TEXT_CONFIDENCE;
            case STAR_IMPORT:
                return STAR_IMPORT_TEXT_CONFIDENCE;
            default:
                return TEXT_CONFIDENCE;
        }
    }

    private static boolean isSameFile(String candidate, String excluded) {
        if (excluded == null) {
            return false;
        }
        return normalize(candidate).equals(normalize(excluded));
    }

    private static String normalize(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.startsWith("./") ? normalized.substring(2) : normalized;
    }

    static final class CompiledPattern {
        final Pattern regex;
        final UsageKind usageKind;

        CompiledPattern(Pattern regex, UsageKind usageKind) {
            this.regex = regex;
            this.usageKind = usageKind;
        }
    }
}
