package com.docrepo.core;

public class UnsupportedKeyTypeException extends RuntimeException {
    private final Class<?> keyType;

    public UnsupportedKeyTypeException(Class<?> keyType) {
        super("No key generation strategy for " + keyType.getName());
        this.keyType = keyType;
    }

    public Class<?> getKeyType() {
        return keyType;
    }
}
