package com.docrepo.core.keys;

import com.docrepo.core.Model;

import java.util.Objects;
import java.util.Optional;

class SingleKeyDescriptor<M extends Model<K>, K> implements KeyDescriptor<M> {
    private final Class<K> keyType;

    SingleKeyDescriptor(Class<K> keyType) {
        this.keyType = Objects.requireNonNull(keyType, "keyType");
    }

    @Override
    public Object filterValue(M model) {
        return model.getKey();
    }

    @Override
    public Optional<String> storedKey(M model) {
        return Optional.empty();
    }

    @Override
    public boolean assignMissingKey(M model) {
        if (!KeyUtility.isKeyMissing(model.getKey())) {
            return false;
        }
        model.setKey(KeyUtility.createRandomKey(keyType));
        return true;
    }

    @Override
    public int arity() {
        return 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SingleKeyDescriptor)) return false;
        return keyType.equals(((SingleKeyDescriptor<?, ?>) o).keyType);
    }

    @Override
    public int hashCode() {
        return keyType.hashCode();
    }

    @Override
    public String toString() {
        return "SingleKey<" + keyType.getSimpleName() + ">";
    }
}
