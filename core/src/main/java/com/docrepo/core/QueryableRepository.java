package com.docrepo.core;

/**
 * Read access to the collection backing a model type.
 */
public interface QueryableRepository<M> {
    Queryable<M> asQueryable();
}
