package com.attribute.resolution.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code attribute.resolution.duration}: Timer (tags: attribute, filtered)</li>
 *   <li>{@code attribute.resolved}: Counter (tag: attribute)</li>
 *   <li>{@code attribute.unresolved}: Counter (tag: attribute)</li>
 *   <li>{@code attribute.uncertain}: Counter (tag: attribute)</li>
 *   <li>{@code attribute.result.size}: DistributionSummary (tag: attribute)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<String, DistributionSummary> summaryCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordResolutionDuration(String attribute, boolean filtered, Duration duration) {
        String key = attribute + ":" + filtered;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("attribute.resolution.duration")
                        .description("Duration of attribute resolution invocations")
                        .tag("attribute", attribute)
                        .tag("filtered", Boolean.toString(filtered))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementResolved(String attribute, int count) {
        counter("attribute.resolved", "Number of entities with a resolved value", attribute).increment(count);
    }

    @Override
    public void incrementUnresolved(String attribute, int count) {
        counter("attribute.unresolved", "Number of entities left unresolved", attribute).increment(count);
    }

    @Override
    public void incrementUncertain(String attribute, int count) {
        counter("attribute.uncertain", "Number of entities carrying an uncertainty reason", attribute)
                .increment(count);
    }

    @Override
    public void recordResultSize(String attribute, int size) {
        DistributionSummary summary = summaryCache.computeIfAbsent(attribute, k ->
                DistributionSummary.builder("attribute.result.size")
                        .description("Distribution of result table sizes")
                        .tag("attribute", attribute)
                        .register(registry));
        summary.record(size);
    }

    private Counter counter(String name, String description, String attribute) {
        return counterCache.computeIfAbsent(name + ":" + attribute, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("attribute", attribute)
                        .register(registry));
    }
}
