package com.docrepo.core.keys;

import com.docrepo.core.UnsupportedKeyTypeException;
import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.impl.TimeBasedGenerator;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

public final class KeyUtility {
    private static final UUID NIL_UUID = new UUID(0L, 0L);
    private static final TimeBasedGenerator GENERATOR = Generators.timeBasedGenerator();
    private static final ClassValue<Optional<Object>> DEFAULTS = new ClassValue<>() {
        @Override
        protected Optional<Object> computeValue(Class<?> type) {
            return defaultInstance(type);
        }
    };

    private KeyUtility() {
    }

    /**
     * Whether the key still holds its "unset" value: null, an empty string,
     * zero, the nil UUID, or a value equal to an instance of its own class
     * made with the public no-argument constructor. Classes without one have
     * no unset value.
     */
    public static boolean isKeyMissing(Object key) {
        if (key == null) {
            return true;
        }
        if (key instanceof CharSequence) {
            return ((CharSequence) key).length() == 0;
        }
        if (key instanceof BigDecimal) {
            return ((BigDecimal) key).signum() == 0;
        }
        if (key instanceof Number) {
            return ((Number) key).doubleValue() == 0d;
        }
        if (key instanceof Boolean) {
            return !((Boolean) key);
        }
        if (key instanceof Character) {
            return (Character) key == '\0';
        }
        if (key instanceof UUID) {
            return NIL_UUID.equals(key);
        }
        return DEFAULTS.get(key.getClass()).map(key::equals).orElse(false);
    }

    public static boolean canGenerate(Class<?> keyType) {
        return keyType == String.class || keyType == UUID.class;
    }

    /**
     * Creates a new, globally unique key.
     *
     * @throws UnsupportedKeyTypeException when no generation strategy exists for {@code keyType}
     */
    public static <K> K createRandomKey(Class<K> keyType) {
        if (keyType == String.class) {
            return keyType.cast(GENERATOR.generate().toString());
        }
        if (keyType == UUID.class) {
            return keyType.cast(GENERATOR.generate());
        }
        throw new UnsupportedKeyTypeException(keyType);
    }

    private static Optional<Object> defaultInstance(Class<?> type) {
        try {
            return Optional.of(type.getConstructor().newInstance());
        } catch (ReflectiveOperationException | RuntimeException e) {
            // no public default to compare against
            return Optional.empty();
        }
    }
}
