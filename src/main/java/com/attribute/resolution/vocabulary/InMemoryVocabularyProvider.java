package com.attribute.resolution.vocabulary;

import com.attribute.resolution.core.model.ReferenceVocabulary;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed vocabulary provider for callers holding the terminology in memory.
 */
public class InMemoryVocabularyProvider implements VocabularyProvider {

    private final Map<String, ReferenceVocabulary> vocabularies = new ConcurrentHashMap<>();

    public InMemoryVocabularyProvider() {
    }

    public InMemoryVocabularyProvider(Map<String, ? extends Collection<String>> codelists) {
        codelists.forEach(this::register);
    }

    /**
     * Registers (or replaces) the values of a codelist.
     */
    public InMemoryVocabularyProvider register(String vocabularyName, Collection<String> values) {
        vocabularies.put(vocabularyName, ReferenceVocabulary.of(vocabularyName, values));
        return this;
    }

    public InMemoryVocabularyProvider register(String vocabularyName, String... values) {
        return register(vocabularyName, List.of(values));
    }

    @Override
    public ReferenceVocabulary lookupReferenceValues(String vocabularyName) {
        return vocabularies.getOrDefault(vocabularyName, ReferenceVocabulary.empty(vocabularyName));
    }
}
