package com.attribute.resolution.vocabulary;

import com.attribute.resolution.validation.InputValidator;

/**
 * Location of the controlled terminology table in the data store.
 *
 * @param table          table holding one row per codelist value
 * @param codelistColumn column naming the codelist (e.g. ROUTE)
 * @param valueColumn    column holding the submission value
 */
public record VocabularyConfig(String table, String codelistColumn, String valueColumn) {

    public VocabularyConfig {
        InputValidator.validateIdentifier(table, "Vocabulary table");
        InputValidator.validateIdentifier(codelistColumn, "Vocabulary codelist column");
        InputValidator.validateIdentifier(valueColumn, "Vocabulary value column");
    }

    /**
     * Default layout: table CDISC_CT with columns CODELIST and SUBMISSION_VALUE.
     */
    public static VocabularyConfig defaults() {
        return new VocabularyConfig("CDISC_CT", "CODELIST", "SUBMISSION_VALUE");
    }
}
