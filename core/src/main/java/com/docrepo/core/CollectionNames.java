package com.docrepo.core;

import org.modeshape.common.text.Inflector;

/**
 * Derives the collection that backs a model type from its simple name,
 * pluralized in English: {@code Person -> People}, {@code Order -> Orders}.
 */
public final class CollectionNames {
    private static final Inflector inflector = Inflector.getInstance();

    private CollectionNames() {
    }

    public static String resolve(Class<?> modelType) {
        return inflector.pluralize(modelType.getSimpleName());
    }
}
