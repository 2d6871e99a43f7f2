package com.attribute.resolution.cdi;

import com.attribute.resolution.api.StudyAttributeResolver;
import com.attribute.resolution.cache.CacheConfig;
import com.attribute.resolution.vocabulary.VocabularyConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the attribute resolution library from MicroProfile Config properties.
 *
 * <h2>Required configuration</h2>
 * <pre>
 * attribute-resolution:
 *   datastore:
 *     url: jdbc:postgresql://localhost:5432/send
 *     user: send
 *     password: secret
 * </pre>
 *
 * <p>Inject the resolver directly: {@code @Inject StudyAttributeResolver resolver;}</p>
 */
@ApplicationScoped
public class AttributeResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(AttributeResolutionProducer.class);

    // ── Data store ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribute-resolution.datastore.url")
    String datastoreUrl;

    @Inject
    @ConfigProperty(name = "attribute-resolution.datastore.user", defaultValue = "")
    String datastoreUser;

    @Inject
    @ConfigProperty(name = "attribute-resolution.datastore.password", defaultValue = "")
    String datastorePassword;

    // ── Controlled terminology ────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribute-resolution.vocabulary.table", defaultValue = "CDISC_CT")
    String vocabularyTable;

    @Inject
    @ConfigProperty(name = "attribute-resolution.vocabulary.codelist-column", defaultValue = "CODELIST")
    String vocabularyCodelistColumn;

    @Inject
    @ConfigProperty(name = "attribute-resolution.vocabulary.value-column", defaultValue = "SUBMISSION_VALUE")
    String vocabularyValueColumn;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "attribute-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "attribute-resolution.cache.max-size", defaultValue = "100")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "attribute-resolution.cache.ttl-seconds", defaultValue = "3600")
    int cacheTtlSeconds;

    @Produces
    @ApplicationScoped
    public StudyAttributeResolver studyAttributeResolver() {
        log.info("Producing StudyAttributeResolver: datastore={}", datastoreUrl);

        CacheConfig cacheConfig = cacheEnabled
                ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                : CacheConfig.disabled();

        return StudyAttributeResolver.builder()
                .jdbc(datastoreUrl, datastoreUser, datastorePassword)
                .vocabularyConfig(new VocabularyConfig(
                        vocabularyTable, vocabularyCodelistColumn, vocabularyValueColumn))
                .cacheConfig(cacheConfig)
                .build();
    }

    public void closeResolver(@Disposes StudyAttributeResolver resolver) {
        log.info("Closing StudyAttributeResolver");
        resolver.close();
    }
}
