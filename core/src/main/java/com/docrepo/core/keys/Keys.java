package com.docrepo.core.keys;

import com.docrepo.core.Model;
import com.docrepo.core.Model2;
import com.docrepo.core.Model3;

import java.util.List;

/**
 * Factories for the key descriptor of each supported key arity. Descriptors
 * returned for the same arity and key type are equal.
 */
public final class Keys {
    private static final KeyDescriptor<Model2<?, ?>> PAIR =
            new CompositeKeyDescriptor<Model2<?, ?>>(List.of(m -> m.getKey1(), m -> m.getKey2()));
    private static final KeyDescriptor<Model3<?, ?, ?>> TRIPLE =
            new CompositeKeyDescriptor<Model3<?, ?, ?>>(List.of(m -> m.getKey1(), m -> m.getKey2(), m -> m.getKey3()));

    private Keys() {
    }

    public static <M extends Model<K>, K> KeyDescriptor<M> single(Class<K> keyType) {
        return new SingleKeyDescriptor<>(keyType);
    }

    @SuppressWarnings("unchecked")
    public static <M extends Model2<?, ?>> KeyDescriptor<M> pair() {
        return (KeyDescriptor<M>) (KeyDescriptor<?>) PAIR;
    }

    @SuppressWarnings("unchecked")
    public static <M extends Model3<?, ?, ?>> KeyDescriptor<M> triple() {
        return (KeyDescriptor<M>) (KeyDescriptor<?>) TRIPLE;
    }
}
