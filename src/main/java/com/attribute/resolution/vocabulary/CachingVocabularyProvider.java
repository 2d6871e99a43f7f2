package com.attribute.resolution.vocabulary;

import com.attribute.resolution.cache.CacheConfig;
import com.attribute.resolution.cache.CacheStats;
import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed decorator keeping looked-up codelists for a bounded time,
 * so repeated invocations do not re-read the terminology table.
 */
public class CachingVocabularyProvider implements VocabularyProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingVocabularyProvider.class);

    private final VocabularyProvider delegate;
    private final Cache<String, ReferenceVocabulary> cache;

    public CachingVocabularyProvider(VocabularyProvider delegate, CacheConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("CachingVocabularyProvider initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    @Override
    public ReferenceVocabulary lookupReferenceValues(String vocabularyName) {
        return cache.get(vocabularyName, delegate::lookupReferenceValues);
    }

    /**
     * Drops every cached codelist, e.g. after a terminology reload.
     */
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached codelists");
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
