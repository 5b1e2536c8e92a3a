package com.impact.apidiff.api.model;

import lombok.Data;

/**
 * Request body for a repository analysis. Blank refs fall back to the configured defaults.
 */
@Data
public class AnalysisRequest {
    private String repositoryPath;
    private String baseRef;
    private String headRef;
}
