package com.impact.apidiff.service;

import com.impact.apidiff.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;

import java.util.List;

/**
 * Include/exclude glob filter applied to repository-relative paths. Exclude patterns win over include patterns.
 */
@Slf4j
@Component
public class FileSelection {

    private final AntPathMatcher matcher = new AntPathMatcher();
    private final List<String> includePatterns;
    private final List<String> excludePatterns;

    @Autowired
    public FileSelection(AnalyzerProperties properties) {
        this(properties.getIncludePatterns(), properties.getExcludePatterns());
    }

    public FileSelection(List<String> includePatterns, List<String> excludePatterns) {
        this.includePatterns = List.copyOf(includePatterns);
        this.excludePatterns = List.copyOf(excludePatterns);
    }

    public boolean isSelected(String relativePath) {
        String path = relativePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matcher.match(pattern, path)) {
                log.trace("{} excluded by {}", path, pattern);
                return false;
            }
        }
        for (String pattern : includePatterns) {
            if (matcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }
}
