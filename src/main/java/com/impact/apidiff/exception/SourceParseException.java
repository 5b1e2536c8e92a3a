package com.impact.apidiff.exception;

/**
 * Raised when source text is not valid Python. Recoverable: callers treat the file's model as unavailable.
 */
public class SourceParseException extends Exception {

    private final String filePath;
    private final int line;

    public SourceParseException(String message, String filePath, int line) {
        super(message);
        this.filePath = filePath;
        this.line = line;
    }

    public SourceParseException(String message, String filePath, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
        this.line = 0; // Unknown position
    }

    public String getFilePath() {
        return filePath;
    }

    /**
     * 1-based line of the first syntax error, or 0 when unknown.
     */
    public int getLine() {
        return line;
    }
}
