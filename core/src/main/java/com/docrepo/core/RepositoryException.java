package com.docrepo.core;

public class RepositoryException extends RuntimeException {
    private final RepositoryError error;

    public RepositoryException(RepositoryError error) {
        super(error.message(), error.cause());
        this.error = error;
    }

    public RepositoryError getError() {
        return error;
    }
}
