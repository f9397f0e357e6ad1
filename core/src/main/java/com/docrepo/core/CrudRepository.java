package com.docrepo.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Write access to the collection backing a model type. Arguments are
 * validated before any I/O; failures during I/O come back as a failed
 * {@link RepositoryResult} rather than an exception.
 *
 * @param <M> the model type
 */
public interface CrudRepository<M> extends QueryableRepository<M> {

    /**
     * Inserts the model, generating its key first if it is a single-key model
     * with a missing key.
     *
     * @return the model as persisted
     */
    RepositoryResult<M> add(M model);

    /**
     * Replaces the stored document with the same key.
     *
     * @return the document as it was before the replace, or empty when no document matched
     */
    RepositoryResult<Optional<M>> update(M model);

    /**
     * Deletes the stored document with the same key. Deleting a key that is
     * not stored succeeds.
     */
    RepositoryResult<Void> delete(M model);

    default CompletableFuture<RepositoryResult<M>> addAsync(M model, Executor executor) {
        Objects.requireNonNull(model, "model");
        return CompletableFuture.supplyAsync(() -> add(model), executor);
    }

    default CompletableFuture<RepositoryResult<Optional<M>>> updateAsync(M model, Executor executor) {
        Objects.requireNonNull(model, "model");
        return CompletableFuture.supplyAsync(() -> update(model), executor);
    }

    default CompletableFuture<RepositoryResult<Void>> deleteAsync(M model, Executor executor) {
        Objects.requireNonNull(model, "model");
        return CompletableFuture.supplyAsync(() -> delete(model), executor);
    }
}
