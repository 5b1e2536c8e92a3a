package com.impact.apidiff.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a structural difference between two revisions of the same callable or class.
 */
public enum ChangeKind {
    FUNCTION_REMOVED,
    METHOD_REMOVED,
    CLASS_REMOVED,
    PARAMETER_REMOVED,
    SIGNATURE_REORDERED,
    PARAMETER_BECAME_REQUIRED,
    PARAMETER_BECAME_OPTIONAL,
    DEFAULT_VALUE_CHANGED,
    RETURN_TYPE_CHANGED,
    RETURN_TYPE_ADDED,
    RETURN_TYPE_REMOVED,
    PARAM_ANNOTATION_CHANGED,
    PARAM_ANNOTATION_ADDED,
    PARAM_ANNOTATION_REMOVED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isRemoval() {
        return this == FUNCTION_REMOVED || this == METHOD_REMOVED || this == CLASS_REMOVED;
    }
}
