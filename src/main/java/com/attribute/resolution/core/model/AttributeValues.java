package com.attribute.resolution.core.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Comparison rules shared by every stage: values are compared trimmed and case-insensitively,
 * and blank values count as absent.
 */
public final class AttributeValues {

    private AttributeValues() {
        // utility class
    }

    public static boolean isAbsent(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Returns the comparison key of a value, or {@code null} for an absent value.
     */
    public static String key(String value) {
        if (isAbsent(value)) {
            return null;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    public static boolean equalsIgnoreCase(String a, String b) {
        String keyA = key(a);
        return keyA != null && keyA.equals(key(b));
    }

    /**
     * Comparison keys of all present values, in first-seen order.
     */
    public static Set<String> keys(Collection<String> values) {
        Set<String> keys = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                String key = key(value);
                if (key != null) {
                    keys.add(key);
                }
            }
        }
        return keys;
    }
}
