package com.impact.apidiff.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UsageKind {
    DIRECT_IMPORT,
    MODULE_IMPORT,
    QUALIFIED_USAGE,
    FUNCTION_CALL,
    CLASS_INSTANTIATION,
    ATTRIBUTE_ACCESS,
    METHOD_CALL,
    STAR_IMPORT,
    NAME_REFERENCE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
