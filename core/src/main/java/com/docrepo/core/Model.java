package com.docrepo.core;

/**
 * An entity identified by a single key.
 *
 * @param <K> the key type
 */
public interface Model<K> {
    K getKey();

    void setKey(K key);
}
