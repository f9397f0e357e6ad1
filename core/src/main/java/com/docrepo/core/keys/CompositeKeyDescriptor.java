package com.docrepo.core.keys;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Composite keys are never generated; the caller supplies every part.
 */
class CompositeKeyDescriptor<M> implements KeyDescriptor<M> {
    private final List<Function<M, ?>> parts;

    CompositeKeyDescriptor(List<Function<M, ?>> parts) {
        this.parts = List.copyOf(parts);
    }

    @Override
    public Object filterValue(M model) {
        return encode(model);
    }

    @Override
    public Optional<String> storedKey(M model) {
        return Optional.of(encode(model));
    }

    @Override
    public boolean assignMissingKey(M model) {
        return false;
    }

    @Override
    public int arity() {
        return parts.size();
    }

    private String encode(M model) {
        Object[] values = new Object[parts.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = parts.get(i).apply(model);
        }
        return CompositeKeys.join(values);
    }

    @Override
    public String toString() {
        return "CompositeKey[" + parts.size() + "]";
    }
}
