package com.impact.apidiff.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class ImportDescriptor {

    /** Marker stored in {@link #getImportedNames()} for {@code from x import *}. */
    public static final String WILDCARD = "*";

    /** Source module of a from-import; empty for a plain {@code import x}. */
    String module;
    List<String> importedNames;
    /** Original name to alias. */
    Map<String, String> aliases;
    boolean fromImport;
    int line;

    @Builder
    private ImportDescriptor(String module,
                             List<String> importedNames,
                             Map<String, String> aliases,
                             boolean fromImport,
                             int line) {
        this.module = module == null ? "" : module;
        this.importedNames = importedNames == null ? List.of() : List.copyOf(importedNames);
        this.aliases = aliases == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        this.fromImport = fromImport;
        this.line = line;
    }

    public boolean isWildcard() {
        return importedNames.contains(WILDCARD);
    }
}
