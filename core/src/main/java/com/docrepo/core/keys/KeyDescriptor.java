package com.docrepo.core.keys;

import java.util.Optional;

/**
 * Knows how a model type is keyed: how to find its stored document and
 * whether a key has to be generated before insert.
 *
 * @param <M> the model type
 */
public interface KeyDescriptor<M> {
    /**
     * Name of the document field every filter matches against.
     */
    String KEY_FIELD = "key";

    /**
     * Value compared against {@link #KEY_FIELD} when updating or deleting.
     */
    Object filterValue(M model);

    /**
     * The encoded key to write into {@link #KEY_FIELD}, for models whose key
     * is not itself a bean property.
     */
    Optional<String> storedKey(M model);

    /**
     * Generates a key for the model if it has none. Returns whether a key was assigned.
     */
    boolean assignMissingKey(M model);

    int arity();
}
