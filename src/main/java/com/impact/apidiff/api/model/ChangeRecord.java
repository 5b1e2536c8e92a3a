package com.impact.apidiff.api.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * A detected breaking change. Every field is fixed at creation except {@code affectedFiles},
 * which the impact coordinator fills in once usages are known.
 */
@Getter
@ToString
public class ChangeRecord {

    public static final String REMOVED_SIGNATURE = "<removed>";

    private final ChangeKind kind;
    private final String filePath;
    private final int line;
    private final String elementName;
    private final String oldSignature;
    private final String newSignature;
    private final String description;
    private final Severity severity;
    private final double confidence;
    private final Set<String> affectedFiles = new TreeSet<>();

    @Builder
    private ChangeRecord(ChangeKind kind,
                         String filePath,
                         int line,
                         String elementName,
                         String oldSignature,
                         String newSignature,
                         String description,
                         Severity severity,
                         Double confidence) {
        this.kind = kind;
        this.filePath = filePath;
        this.line = line;
        this.elementName = elementName;
        this.oldSignature = oldSignature;
        this.newSignature = newSignature;
        this.description = description;
        this.severity = severity;
        this.confidence = confidence == null ? 1.0 : confidence;
    }

    public Set<String> getAffectedFiles() {
        return Collections.unmodifiableSet(affectedFiles);
    }

    /**
     * Key under which usages of this change are reported: {@code <filePath>:<elementName>}.
     */
    public String usageKey() {
        return filePath + ":" + elementName;
    }

    public synchronized void attachAffectedFiles(Collection<String> files) {
        affectedFiles.addAll(files);
    }
}
