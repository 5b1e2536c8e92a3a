package com.impact.apidiff.api.model;

import lombok.Data;

@Data
public class SourceDiffRequest {
    private String filePath;
    private String oldSource;
    private String newSource;
}
