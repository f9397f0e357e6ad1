package com.docrepo.core;

/**
 * Describes a failed repository operation with enough context to diagnose it
 * without the original stack trace.
 *
 * @param kind           what went wrong
 * @param operation      the repository operation, e.g. {@code add}
 * @param repositoryType simple name of the repository class
 * @param modelType      simple name of the model class
 * @param payload        JSON snapshot of the model that was rejected
 * @param cause          the underlying failure
 */
public record RepositoryError(
        ErrorKind kind,
        String operation,
        String repositoryType,
        String modelType,
        String payload,
        Throwable cause
) {
    public String message() {
        return String.format("%s.%s failed for %s (%s): %s",
                repositoryType, operation, modelType, kind, payload);
    }

    public RepositoryException toException() {
        return new RepositoryException(this);
    }
}
