package com.attribute.resolution.vocabulary;

import com.attribute.resolution.core.model.ReferenceVocabulary;

/**
 * Looks up controlled terminology codelists.
 */
public interface VocabularyProvider {

    /**
     * Returns the valid values of a codelist, e.g. {@code ROUTE} or {@code DESIGN}.
     * An unknown codelist yields an empty vocabulary.
     *
     * @param vocabularyName the codelist name
     * @return the codelist values, compared case-insensitively
     */
    ReferenceVocabulary lookupReferenceValues(String vocabularyName);
}
