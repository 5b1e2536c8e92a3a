package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.ChangeRecord;
import com.impact.apidiff.api.model.UsageLocation;
import com.impact.apidiff.api.model.UsagePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Looks up the usages of every change record and links them back to the record.
 */
@Slf4j
@Component
public class ImpactCoordinator {

    private final UsagePatternGenerator patternGenerator;
    private final UsageScanner usageScanner;

    public ImpactCoordinator(UsagePatternGenerator patternGenerator, UsageScanner usageScanner) {
        this.patternGenerator = patternGenerator;
        this.usageScanner = usageScanner;
    }

    public Map<String, List<UsageLocation>> computeImpact(List<ChangeRecord> changes, CandidateFiles candidates) {
        return computeImpact(changes, candidates, CancellationSignal.none());
    }

    /**
     * @return usages keyed by {@link ChangeRecord#usageKey()}, in change order; keys without usages are absent
     */
    public Map<String, List<UsageLocation>> computeImpact(List<ChangeRecord> changes,
                                                          CandidateFiles candidates,
                                                          CancellationSignal cancellation) {
        log.info("Searching {} candidate file(s) for usages of {} change(s).", candidates.size(), changes.size());

        // Several changes to one element (e.g. two removed parameters) share a single scan
        Map<String, List<UsageLocation>> scans = new HashMap<>();
        for (ChangeRecord change : changes) {
            if (cancellation.isCancelled()) {
                log.warn("Usage search cancelled after {} of {} element(s).", scans.size(), changes.size());
                break;
            }
            scans.computeIfAbsent(change.usageKey(), key -> scanFor(change, candidates, cancellation));
        }

        Map<String, List<UsageLocation>> impact = new LinkedHashMap<>();
        for (ChangeRecord change : changes) {
            List<UsageLocation> locations = scans.get(change.usageKey());
            if (locations == null || locations.isEmpty()) {
                continue;
            }
            impact.putIfAbsent(change.usageKey(), locations);
            change.attachAffectedFiles(locations.stream()
                    .map(UsageLocation::getFilePath)
                    .collect(Collectors.toSet()));
        }

        int total = impact.values().stream().mapToInt(List::size).sum();
        log.info("Found {} usage location(s) for {} changed element(s).", total, impact.size());
        return impact;
    }

    private List<UsageLocation> scanFor(ChangeRecord change, CandidateFiles candidates, CancellationSignal cancellation) {
        List<UsagePattern> patterns = patternGenerator.generatePatterns(change.getElementName(), change.getFilePath());
        List<UsageLocation> locations = usageScanner.scan(patterns, candidates, change.getFilePath(), cancellation);
        log.debug("{}: {} usage location(s).", change.usageKey(), locations.size());
        return List.copyOf(locations);
    }
}
