package com.docrepo.core;

import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * A deferred view over the documents of one collection. Nothing is read from
 * the store until the view is enumerated, and every enumeration issues the
 * query again.
 *
 * @param <M> the model type
 */
public interface Queryable<M> extends Iterable<M> {
    Stream<M> stream();

    List<M> toList();

    Optional<M> first();

    long count();
}
