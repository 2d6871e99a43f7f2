package com.attribute.resolution.vocabulary;

import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.attribute.resolution.store.SqlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Reads codelist values from the controlled terminology table of the data store.
 * A missing table surfaces as a {@link com.attribute.resolution.store.DataStoreException}.
 */
public class JdbcVocabularyProvider implements VocabularyProvider {
    private static final Logger log = LoggerFactory.getLogger(JdbcVocabularyProvider.class);

    private final SqlExecutor executor;
    private final VocabularyConfig config;

    public JdbcVocabularyProvider(SqlExecutor executor) {
        this(executor, VocabularyConfig.defaults());
    }

    public JdbcVocabularyProvider(SqlExecutor executor, VocabularyConfig config) {
        this.executor = executor;
        this.config = config;
    }

    @Override
    public ReferenceVocabulary lookupReferenceValues(String vocabularyName) {
        List<String> values = executor.findCodelistValues(
                        config.table(), config.codelistColumn(), config.valueColumn(), vocabularyName)
                .stream()
                .map(row -> Objects.toString(row.get("VAL"), null))
                .filter(Objects::nonNull)
                .toList();
        log.debug("Loaded {} values of codelist {}", values.size(), vocabularyName);
        return ReferenceVocabulary.of(vocabularyName, values);
    }
}
