package com.impact.apidiff.exception;

/**
 * Raised when file text cannot be produced for a revision: unknown ref, unreadable repository or I/O failure.
 * A file that simply does not exist at a revision is not an error.
 */
public class ContentUnavailableException extends Exception {

    private final String revision;

    public ContentUnavailableException(String message, String revision, Throwable cause) {
        super(message, cause);
        this.revision = revision;
    }

    public ContentUnavailableException(String message, String revision) {
        super(message);
        this.revision = revision;
    }

    public String getRevision() {
        return revision;
    }
}
