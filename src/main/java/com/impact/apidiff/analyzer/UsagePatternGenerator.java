package com.impact.apidiff.analyzer;

import com.impact.apidiff.api.model.UsageKind;
import com.impact.apidiff.api.model.UsagePattern;
import com.impact.apidiff.config.AnalyzerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces the regular expressions that locate likely references to a changed element from other files.
 */
@Slf4j
@Component
public class UsagePatternGenerator {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String PACKAGE_INIT = "__init__";

    private final String sourceRootPrefix;

    public UsagePatternGenerator(AnalyzerProperties properties) {
        this.sourceRootPrefix = properties.getSourceRootPrefix();
    }

    public List<UsagePattern> generatePatterns(String elementName, String originatingFilePath) {
        List<UsagePattern> patterns = new ArrayList<>();
        String modulePath = modulePathFor(originatingFilePath);
        String element = Pattern.quote(elementName);

        int dot = elementName.lastIndexOf('.');
        String simpleName = dot >= 0 ? elementName.substring(dot + 1) : elementName;
        String quotedSimple = Pattern.quote(simpleName);

        if (!modulePath.isEmpty()) {
            String module = Pattern.quote(modulePath);
            patterns.add(new UsagePattern("from\\s+" + module + "\\s+import\\s+.*\\b" + element + "\\b",
                    UsageKind.DIRECT_IMPORT, elementName));
            patterns.add(new UsagePattern("import\\s+" + module + "\\b",
                    UsageKind.MODULE_IMPORT, elementName));
            patterns.add(new UsagePattern(module + "\\." + element + "\\b",
                    UsageKind.QUALIFIED_USAGE, elementName));
        }

        patterns.add(new UsagePattern("\\b" + element + "\\s*\\(", UsageKind.FUNCTION_CALL, elementName));

        if (!simpleName.isEmpty() && Character.isUpperCase(simpleName.charAt(0))) {
            patterns.add(new UsagePattern("\\b" + quotedSimple + "\\s*\\(", UsageKind.CLASS_INSTANTIATION, elementName));
        }

        patterns.add(new UsagePattern("\\." + quotedSimple + "\\b", UsageKind.ATTRIBUTE_ACCESS, elementName));

        if (dot >= 0) {
            String className = Pattern.quote(elementName.substring(0, dot));
            patterns.add(new UsagePattern("\\b" + className + "\\s*\\([^)]*\\)\\." + quotedSimple + "\\s*\\(",
                    UsageKind.METHOD_CALL, elementName));
        }

        if (!modulePath.isEmpty()) {
            patterns.add(new UsagePattern("from\\s+" + Pattern.quote(modulePath) + "\\s+import\\s+\\*",
                    UsageKind.STAR_IMPORT, elementName));
        }

        log.debug("Generated {} pattern(s) for {} (module '{}').", patterns.size(), elementName, modulePath);
        return patterns;
    }

    /**
     * Dotted module path of a file, e.g. {@code src/pkg/mod.py} to {@code pkg.mod}.
     * Returns an empty string when no importable path can be derived.
     */
    public String modulePathFor(String filePath) {
        if (filePath == null || filePath.isBlank()) {
            return "";
        }
        String path = filePath;
        if (path.endsWith(".pyi")) {
            path = path.substring(0, path.length() - 4);
        } else if (path.endsWith(".py")) {
            path = path.substring(0, path.length() - 3);
        }

        List<String> segments = new ArrayList<>();
        for (String segment : path.split("[/\\\\]")) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                continue;
            }
            if (!IDENTIFIER.matcher(segment).matches()) {
                break;
            }
            segments.add(segment);
        }

        if (!segments.isEmpty() && sourceRootPrefix != null && !sourceRootPrefix.isEmpty()
                && segments.get(0).equals(sourceRootPrefix)) {
            segments.remove(0);
        }
        if (!segments.isEmpty() && PACKAGE_INIT.equals(segments.get(segments.size() - 1))) {
            segments.remove(segments.size() - 1);
        }
        return String.join(".", segments);
    }
}
