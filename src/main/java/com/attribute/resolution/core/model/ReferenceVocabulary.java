package com.attribute.resolution.core.model;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * Controlled set of valid values for an attribute, e.g. a CDISC CT codelist.
 * Membership is tested case-insensitively.
 */
public final class ReferenceVocabulary {

    private final String name;
    private final Set<String> keys;

    private ReferenceVocabulary(String name, Set<String> keys) {
        this.name = name;
        this.keys = keys;
    }

    public static ReferenceVocabulary of(String name, Collection<String> values) {
        Objects.requireNonNull(name, "name is required");
        return new ReferenceVocabulary(name, Set.copyOf(AttributeValues.keys(values)));
    }

    public static ReferenceVocabulary empty(String name) {
        return of(name, Set.of());
    }

    public String getName() {
        return name;
    }

    public boolean contains(String value) {
        String key = AttributeValues.key(value);
        return key != null && keys.contains(key);
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public String toString() {
        return "ReferenceVocabulary{name='" + name + "', size=" + keys.size() + '}';
    }
}
