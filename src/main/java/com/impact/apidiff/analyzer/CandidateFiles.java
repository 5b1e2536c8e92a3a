package com.impact.apidiff.analyzer;

import lombok.Value;

import java.util.List;

/**
 * The set of files searched for usages, together with the reader that supplies their text.
 */
@Value
public class CandidateFiles {

    List<String> paths;
    SourceFileReader reader;

    public CandidateFiles(List<String> paths, SourceFileReader reader) {
        this.paths = List.copyOf(paths);
        this.reader = reader;
    }

    public int size() {
        return paths.size();
    }
}
