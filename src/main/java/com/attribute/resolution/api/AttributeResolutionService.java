package com.attribute.resolution.api;

import com.attribute.resolution.core.model.AttributeDescriptor;
import com.attribute.resolution.core.model.CoarseObservation;
import com.attribute.resolution.core.model.ColumnNames;
import com.attribute.resolution.core.model.DataTable;
import com.attribute.resolution.core.model.EntityId;
import com.attribute.resolution.core.model.FineObservation;
import com.attribute.resolution.core.model.ReferenceVocabulary;
import com.attribute.resolution.core.model.ResolutionMode;
import com.attribute.resolution.logging.LogContext;
import com.attribute.resolution.merge.ResultMerger;
import com.attribute.resolution.merge.ResultShaper;
import com.attribute.resolution.metrics.MetricsService;
import com.attribute.resolution.store.ObservationRepository;
import com.attribute.resolution.validation.InputValidator;
import com.attribute.resolution.validation.InvalidInputException;
import com.attribute.resolution.vocabulary.VocabularyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Service facade orchestrating the resolution components.
 *
 * <p>Each invocation pulls all candidate rows up front, runs the in-memory engine and
 * joins the outcome back onto the caller's table. Validation failures are raised before
 * any query; data store failures propagate unchanged and no partial result is returned.</p>
 */
public class AttributeResolutionService {
    private static final Logger log = LoggerFactory.getLogger(AttributeResolutionService.class);

    private final ObservationRepository observationRepository;
    private final VocabularyProvider vocabularyProvider;
    private final AttributeResolutionEngine engine;
    private final ResultMerger resultMerger;
    private final ResultShaper resultShaper;
    private final MetricsService metricsService;

    public AttributeResolutionService(
            ObservationRepository observationRepository,
            VocabularyProvider vocabularyProvider,
            AttributeResolutionEngine engine,
            ResultMerger resultMerger,
            ResultShaper resultShaper,
            MetricsService metricsService) {
        this.observationRepository = observationRepository;
        this.vocabularyProvider = vocabularyProvider;
        this.engine = engine;
        this.resultMerger = resultMerger;
        this.resultShaper = resultShaper;
        this.metricsService = metricsService;
    }

    /**
     * Resolves an attribute per animal and optionally filters the animals on it.
     *
     * @param descriptor an attribute recorded at animal and study level
     * @param entityList caller's animals; must contain STUDYID and USUBJID, may contain more columns
     * @param options    target values and filter modes
     * @return the caller's rows (filtered) with the resolved column and, when requested, a message column
     * @throws InvalidInputException if the table lacks identity columns or values, or the attribute
     *                               has no animal-level source
     */
    public DataTable resolveAndFilterEntityAttribute(AttributeDescriptor descriptor, DataTable entityList,
                                                     FilterOptions options) {
        if (!descriptor.getMode().hasEntityLevelSource()) {
            throw new InvalidInputException(
                    "Attribute " + descriptor.getName() + " is not recorded per animal; resolve it per study");
        }
        InputValidator.requireColumns(entityList, "entityList", ColumnNames.STUDYID, ColumnNames.USUBJID);
        InputValidator.requireValues(entityList, "entityList", ColumnNames.STUDYID, ColumnNames.USUBJID);

        try (LogContext ignored = LogContext.forResolution(
                LogContext.generateCorrelationId(), descriptor.getName(), "entity")) {
            log.info("Resolving {} for {} animals with {}", descriptor.getName(), entityList.size(), options);
            long start = System.nanoTime();

            Set<EntityId> entities = new LinkedHashSet<>();
            for (Map<String, Object> row : entityList.getRows()) {
                entities.add(EntityId.of(DataTable.getString(row, ColumnNames.STUDYID),
                        DataTable.getString(row, ColumnNames.USUBJID)));
            }
            Set<String> studies = groupKeysOf(entities);

            List<FineObservation> fine = observationRepository.fetchFineObservations(descriptor, studies);
            List<CoarseObservation> coarse = observationRepository.fetchCoarseObservations(descriptor, studies);

            return complete(descriptor, ResolutionMode.ENTITY_AND_GROUP_LEVEL, entityList, entities,
                    fine, coarse, options, start);
        }
    }

    /**
     * Resolves an attribute per study from study-level values and optionally filters the studies on it.
     *
     * @param descriptor the attribute
     * @param groupList  caller's studies, must contain STUDYID; {@code null} processes every study in TS
     * @param options    target values and filter modes; {@code matchAll} is not supported here
     * @return the caller's rows (filtered) with the resolved column and, when requested, a message column
     * @throws InvalidInputException if the table lacks STUDYID or a STUDYID value, or {@code matchAll} is set
     */
    public DataTable resolveGroupAttribute(AttributeDescriptor descriptor, DataTable groupList,
                                           FilterOptions options) {
        if (options.isMatchAll()) {
            throw new InvalidInputException("Parameter matchAll is not supported when resolving per study");
        }
        if (groupList != null) {
            InputValidator.requireColumns(groupList, "groupList", ColumnNames.STUDYID);
            InputValidator.requireValues(groupList, "groupList", ColumnNames.STUDYID);
        }

        try (LogContext ignored = LogContext.forResolution(
                LogContext.generateCorrelationId(), descriptor.getName(), "group")) {
            long start = System.nanoTime();

            DataTable input = groupList;
            if (input == null) {
                input = DataTable.builder(ColumnNames.STUDYID)
                        .rows(observationRepository.fetchAllGroupKeys().stream()
                                .map(studyId -> Map.of(ColumnNames.STUDYID, studyId))
                                .toList())
                        .build();
            }
            log.info("Resolving {} for {} studies with {}", descriptor.getName(), input.size(), options);

            Set<EntityId> entities = new LinkedHashSet<>();
            for (String studyId : input.distinctValues(ColumnNames.STUDYID)) {
                entities.add(EntityId.ofGroup(studyId));
            }
            List<CoarseObservation> coarse =
                    observationRepository.fetchCoarseObservations(descriptor, groupKeysOf(entities));

            return complete(descriptor, ResolutionMode.GROUP_LEVEL_ONLY, input, entities,
                    List.of(), coarse, options, start);
        }
    }

    private DataTable complete(AttributeDescriptor descriptor, ResolutionMode mode, DataTable input,
                               Set<EntityId> entities, List<FineObservation> fine,
                               List<CoarseObservation> coarse, FilterOptions options, long start) {
        String messageColumn = options.messageColumn();
        ReferenceVocabulary vocabulary = messageColumn != null
                ? vocabularyProvider.lookupReferenceValues(descriptor.getCodelist()) : null;

        ResolutionOutcome outcome = engine.run(descriptor, mode, entities, fine, coarse,
                vocabulary, options.toCriteria());

        DataTable merged = resultMerger.merge(input, outcome.selected(),
                mode == ResolutionMode.GROUP_LEVEL_ONLY, descriptor.getResolvedColumn(), messageColumn);
        DataTable result = resultShaper.shape(merged, input.getColumns(), List.of(descriptor.getResolvedColumn()));

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metricsService.recordResolutionDuration(descriptor.getName(), options.isFilterActive(), duration);
        metricsService.incrementResolved(descriptor.getName(), outcome.resolvedCount());
        metricsService.incrementUnresolved(descriptor.getName(), outcome.unresolvedCount());
        metricsService.incrementUncertain(descriptor.getName(), outcome.uncertainCount());
        metricsService.recordResultSize(descriptor.getName(), result.size());

        log.info("Resolved {}: {} of {} resolved, {} uncertain, {} rows returned in {} ms",
                descriptor.getName(), outcome.resolvedCount(), outcome.resolved().size(),
                outcome.uncertainCount(), result.size(), duration.toMillis());
        return result;
    }

    private static Set<String> groupKeysOf(Set<EntityId> entities) {
        Set<String> groupKeys = new LinkedHashSet<>();
        for (EntityId id : entities) {
            groupKeys.add(id.groupKey());
        }
        return groupKeys;
    }
}
