package com.docrepo.core;

/**
 * An entity identified by a two-part key. The parts are stored together as
 * an encoded string in the document's {@code key} field.
 */
public interface Model2<K1, K2> {
    K1 getKey1();

    K2 getKey2();
}
