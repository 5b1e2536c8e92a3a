package com.impact.apidiff.analyzer;

import java.io.IOException;

/**
 * Reads the current text of a candidate file, addressed by its repository-relative path.
 */
@FunctionalInterface
public interface SourceFileReader {

    String read(String filePath) throws IOException;
}
