package com.impact.apidiff.service;

import com.impact.apidiff.exception.ContentUnavailableException;

import java.util.List;

/**
 * Supplies the two revisions being compared: which files changed between them and the text of any file at either.
 */
public interface RevisionContentProvider extends AutoCloseable {

    /**
     * Repository-relative paths of Python files added, modified, renamed or copied between base and head.
     */
    List<String> changedFiles() throws ContentUnavailableException;

    /**
     * Text of {@code filePath} at {@code revision}; an empty string when the file does not exist there.
     *
     * @throws ContentUnavailableException when the revision or blob cannot be read at all
     */
    String contentAt(String filePath, String revision) throws ContentUnavailableException;

    String baseRevision();

    String headRevision();

    @Override
    default void close() {
    }
}
