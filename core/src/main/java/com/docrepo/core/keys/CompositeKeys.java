package com.docrepo.core.keys;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes composite key parts into the single string stored in a document's
 * {@code key} field. Parts are joined with {@code |}; a literal {@code |} or
 * {@code \} inside a part is escaped with a backslash so distinct keys never
 * encode to the same string.
 */
public final class CompositeKeys {
    public static final char SEPARATOR = '|';
    private static final char ESCAPE = '\\';

    private CompositeKeys() {
    }

    public static String join(Object... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("A composite key needs at least one part");
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (parts[i] == null) {
                throw new IllegalArgumentException("Composite key part " + (i + 1) + " is null");
            }
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            escape(String.valueOf(parts[i]), sb);
        }
        return sb.toString();
    }

    public static List<String> split(String encoded) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean escaped = false;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == ESCAPE) {
                escaped = true;
            } else if (c == SEPARATOR) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (escaped) {
            throw new IllegalArgumentException("Dangling escape in composite key: " + encoded);
        }
        parts.add(current.toString());
        return parts;
    }

    private static void escape(String part, StringBuilder sb) {
        for (int i = 0; i < part.length(); i++) {
            char c = part.charAt(i);
            if (c == SEPARATOR || c == ESCAPE) {
                sb.append(ESCAPE);
            }
            sb.append(c);
        }
    }
}
