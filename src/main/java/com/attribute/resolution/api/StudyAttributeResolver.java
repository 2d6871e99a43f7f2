package com.attribute.resolution.api;

import com.attribute.resolution.cache.CacheConfig;
import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.DataTable;
import com.attribute.resolution.merge.DefaultResultShaper;
import com.attribute.resolution.merge.ResultMerger;
import com.attribute.resolution.merge.ResultShaper;
import com.attribute.resolution.metrics.MetricsService;
import com.attribute.resolution.metrics.NoOpMetricsService;
import com.attribute.resolution.store.DataStoreConnection;
import com.attribute.resolution.store.JdbcDataStoreConnection;
import com.attribute.resolution.store.ObservationRepository;
import com.attribute.resolution.store.SqlExecutor;
import com.attribute.resolution.vocabulary.CachingVocabularyProvider;
import com.attribute.resolution.vocabulary.JdbcVocabularyProvider;
import com.attribute.resolution.vocabulary.VocabularyConfig;
import com.attribute.resolution.vocabulary.VocabularyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/**
 * Main entry point for resolving study attributes from a pooled SEND data store.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (StudyAttributeResolver resolver = StudyAttributeResolver.builder()
 *         .jdbc("jdbc:h2:./send", "sa", "")
 *         .build()) {
 *
 *     // Route per animal, keeping only oral animals
 *     DataTable oral = resolver.getSubjectRoute(animals, FilterOptions.of("ORAL"));
 *
 *     // Design of every study, uncertainties reported in NOT_VALID_MSG
 *     DataTable designs = resolver.getStudyDesign(null);
 * }
 * </pre>
 */
public class StudyAttributeResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StudyAttributeResolver.class);

    private final AttributeResolutionService service;
    private final DataStoreConnection connection;
    private final boolean ownsConnection;
    private final VocabularyProvider vocabularyProvider;

    private StudyAttributeResolver(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;

        SqlExecutor executor = new SqlExecutor(connection);
        ObservationRepository observationRepository = new ObservationRepository(executor);

        VocabularyProvider provider = builder.vocabularyProvider != null
                ? builder.vocabularyProvider : new JdbcVocabularyProvider(executor, builder.vocabularyConfig);
        if (builder.cacheConfig.enabled()) {
            provider = new CachingVocabularyProvider(provider, builder.cacheConfig);
        }
        this.vocabularyProvider = provider;

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        ResultShaper resultShaper = builder.resultShaper != null
                ? builder.resultShaper : new DefaultResultShaper();

        this.service = new AttributeResolutionService(
                observationRepository, vocabularyProvider, new AttributeResolutionEngine(),
                new ResultMerger(), resultShaper, metricsService);

        log.info("StudyAttributeResolver initialized: vocabulary={}, cache={}",
                vocabularyProvider.getClass().getSimpleName(), builder.cacheConfig.enabled());
    }

    // ========== Generic operations ==========

    /**
     * Resolves an attribute per animal and optionally filters the animals on it.
     *
     * @see AttributeResolutionService#resolveAndFilterEntityAttribute
     */
    public DataTable resolveAndFilterEntityAttribute(AttributeDescriptor descriptor, DataTable entityList,
                                                     FilterOptions options) {
        return service.resolveAndFilterEntityAttribute(descriptor, entityList, options);
    }

    public DataTable resolveAndFilterEntityAttribute(AttributeDescriptor descriptor, DataTable entityList) {
        return resolveAndFilterEntityAttribute(descriptor, entityList, FilterOptions.defaults());
    }

    /**
     * Resolves an attribute per study and optionally filters the studies on it.
     *
     * @param groupList caller's studies, or {@code null} for every study in the data store
     * @see AttributeResolutionService#resolveGroupAttribute
     */
    public DataTable resolveGroupAttribute(AttributeDescriptor descriptor, DataTable groupList,
                                           FilterOptions options) {
        return service.resolveGroupAttribute(descriptor, groupList, options);
    }

    public DataTable resolveGroupAttribute(AttributeDescriptor descriptor, DataTable groupList) {
        return resolveGroupAttribute(descriptor, groupList, FilterOptions.groupBuilder().build());
    }

    // ========== Route and study design ==========

    /**
     * Route of administration per animal, from EX.EXROUTE with TS ROUTE as fallback.
     */
    public DataTable getSubjectRoute(DataTable animals, FilterOptions options) {
        return resolveAndFilterEntityAttribute(AttributeDescriptor.ROUTE, animals, options);
    }

    public DataTable getSubjectRoute(DataTable animals) {
        return getSubjectRoute(animals, FilterOptions.defaults());
    }

    /**
     * Study design per study, from TS SDESIGN.
     *
     * @param studies caller's studies, or {@code null} for every study in the data store
     */
    public DataTable getStudyDesign(DataTable studies, FilterOptions options) {
        return resolveGroupAttribute(AttributeDescriptor.STUDY_DESIGN, studies, options);
    }

    public DataTable getStudyDesign(DataTable studies) {
        return getStudyDesign(studies, FilterOptions.groupBuilder().build());
    }

    // ========== Access ==========

    public boolean isConnected() {
        return connection.isConnected();
    }

    /**
     * Gets the underlying service for advanced operations.
     */
    public AttributeResolutionService getService() {
        return service;
    }

    public VocabularyProvider getVocabularyProvider() {
        return vocabularyProvider;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private DataStoreConnection connection;
        private boolean ownsConnection = false;
        private VocabularyProvider vocabularyProvider;
        private VocabularyConfig vocabularyConfig = VocabularyConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService;
        private ResultShaper resultShaper;

        /**
         * Sets the data store connection to use. The caller keeps ownership.
         */
        public Builder dataStoreConnection(DataStoreConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Connects through a caller-managed data source.
         */
        public Builder dataSource(DataSource dataSource) {
            this.connection = new JdbcDataStoreConnection(dataSource);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Creates a JDBC connection with the given parameters, closed with the resolver.
         */
        public Builder jdbc(String url, String user, String password) {
            this.connection = new JdbcDataStoreConnection(url, user, password);
            this.ownsConnection = true;
            return this;
        }

        /**
         * Sets a custom vocabulary provider.
         * Defaults to a {@link JdbcVocabularyProvider} reading the data store.
         */
        public Builder vocabularyProvider(VocabularyProvider vocabularyProvider) {
            this.vocabularyProvider = vocabularyProvider;
            return this;
        }

        /**
         * Sets the terminology table layout used by the default vocabulary provider.
         */
        public Builder vocabularyConfig(VocabularyConfig vocabularyConfig) {
            this.vocabularyConfig = vocabularyConfig;
            return this;
        }

        /**
         * Sets the codelist cache configuration. Use {@link CacheConfig#disabled()} to turn caching off.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets the result shaper. Defaults to {@link DefaultResultShaper}.
         */
        public Builder resultShaper(ResultShaper resultShaper) {
            this.resultShaper = resultShaper;
            return this;
        }

        public StudyAttributeResolver build() {
            if (connection == null) {
                throw new IllegalStateException("DataStoreConnection is required");
            }
            return new StudyAttributeResolver(this);
        }
    }
}
