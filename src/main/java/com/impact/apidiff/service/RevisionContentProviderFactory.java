package com.impact.apidiff.service;

import com.impact.apidiff.exception.ContentUnavailableException;

import java.nio.file.Path;

/**
 * Opens a content provider comparing {@code baseRef} and {@code headRef} of the repository at {@code repositoryPath}.
 */
@FunctionalInterface
public interface RevisionContentProviderFactory {

    RevisionContentProvider open(Path repositoryPath, String baseRef, String headRef) throws ContentUnavailableException;
}
