package com.impact.apidiff.api.model;

import lombok.Data;

import java.util.List;

@Data
public class ConciseChangeReport {
    public String changedElement;
    public String filePath;
    public ChangeKind kind;
    public Severity severity;
    public String summary;
    public int usageCount;
    public List<String> affectedFiles;
}
