package com.impact.apidiff.api.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One callable (module-level function or method) as declared in a single revision of a file.
 * <p>
 * Defaults, annotations and decorators are kept as the literal source text of their expressions,
 * so two defaults that evaluate equal but are spelled differently ({@code 0} vs {@code 0.0}) compare as different.
 */
@Value
public class FunctionSignature {

    String name;
    /** Positional parameter names in declaration order, {@code self}/{@code cls} included. */
    List<String> parameters;
    Map<String, String> defaults;
    String vararg;
    String kwarg;
    /** Parameter annotations; may also key the vararg/kwarg names. */
    Map<String, String> annotations;
    String returnAnnotation;
    List<String> decorators;
    boolean method;
    String owningClass;
    int line;
    boolean async;

    @Builder(toBuilder = true)
    private FunctionSignature(String name,
                              List<String> parameters,
                              Map<String, String> defaults,
                              String vararg,
                              String kwarg,
                              Map<String, String> annotations,
                              String returnAnnotation,
                              List<String> decorators,
                              boolean method,
                              String owningClass,
                              int line,
                              boolean async) {
        this.name = name;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.defaults = defaults == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
        this.vararg = vararg;
        this.kwarg = kwarg;
        this.annotations = annotations == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.returnAnnotation = returnAnnotation;
        this.decorators = decorators == null ? List.of() : List.copyOf(decorators);
        this.method = method;
        this.owningClass = owningClass;
        this.line = line;
        this.async = async;
    }

    public boolean hasDefault(String parameter) {
        return defaults.containsKey(parameter);
    }

    public String defaultFor(String parameter) {
        return defaults.get(parameter);
    }

    /**
     * Annotation text for a positional parameter or for the vararg/kwarg name, or {@code null}.
     */
    public String annotationFor(String parameter) {
        return annotations.get(parameter);
    }

    /**
     * Name used in change records: {@code Class.method} for methods, the bare name otherwise.
     */
    public String qualifiedName() {
        return owningClass == null ? name : owningClass + "." + name;
    }
}
