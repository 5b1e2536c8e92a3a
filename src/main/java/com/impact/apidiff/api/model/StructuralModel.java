package com.impact.apidiff.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Public surface of one file at one revision. A file that is absent or could not be parsed
 * is represented by {@link #empty()}, never by {@code null}.
 */
@Value
public class StructuralModel {

    private static final StructuralModel EMPTY = StructuralModel.builder().build();

    Map<String, FunctionSignature> functions;
    Map<String, ClassDescriptor> classes;
    Map<String, ImportDescriptor> imports;
    Set<String> moduleLevelVariableNames;

    @Builder
    private StructuralModel(Map<String, FunctionSignature> functions,
                            Map<String, ClassDescriptor> classes,
                            Map<String, ImportDescriptor> imports,
                            Set<String> moduleLevelVariableNames) {
        this.functions = functions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(functions));
        this.classes = classes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(classes));
        this.imports = imports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(imports));
        this.moduleLevelVariableNames = moduleLevelVariableNames == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(moduleLevelVariableNames));
    }

    public static StructuralModel empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return functions.isEmpty() && classes.isEmpty() && imports.isEmpty() && moduleLevelVariableNames.isEmpty();
    }
}
