package com.impact.apidiff.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A place outside the declaring file that appears to reference a changed element.
 */
@Value
@Builder
public class UsageLocation {

    @JsonProperty("filePath")
    String filePath;

    @JsonProperty("line")
    int line;

    /** Surrounding source lines, newline separated. */
    @JsonProperty("context")
    String context;

    @JsonProperty("usageKind")
    UsageKind usageKind;

    /** Heuristic certainty in [0, 1] that this is a genuine usage rather than a name collision. */
    @JsonProperty("confidence")
    double confidence;
}
