package com.impact.apidiff.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module-level class and the methods declared directly in its body.
 * Methods are unique by name; when a body declares the same name twice the later declaration wins.
 */
@Value
public class ClassDescriptor {

    String name;
    List<String> bases;
    List<String> decorators;
    int line;
    Map<String, FunctionSignature> methods;

    @Builder
    private ClassDescriptor(String name,
                            List<String> bases,
                            List<String> decorators,
                            int line,
                            Map<String, FunctionSignature> methods) {
        this.name = name;
        this.bases = bases == null ? List.of() : List.copyOf(bases);
        this.decorators = decorators == null ? List.of() : List.copyOf(decorators);
        this.line = line;
        this.methods = methods == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(methods));
    }
}
