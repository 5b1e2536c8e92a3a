package com.impact.apidiff.api.model;

import lombok.Value;

/**
 * One way a changed element could be referenced elsewhere, expressed as a regular expression
 * applied to single source lines.
 */
@Value
public class UsagePattern {
    String regex;
    UsageKind usageKind;
    String elementName;
}
