package com.docrepo.core;

/**
 * An entity identified by a three-part key.
 *
 * @see Model2
 */
public interface Model3<K1, K2, K3> {
    K1 getKey1();

    K2 getKey2();

    K3 getKey3();
}
