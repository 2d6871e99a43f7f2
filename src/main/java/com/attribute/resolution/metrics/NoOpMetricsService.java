package com.attribute.resolution.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(String attribute, boolean filtered, Duration duration) {
    }

    @Override
    public void incrementResolved(String attribute, int count) {
    }

    @Override
    public void incrementUnresolved(String attribute, int count) {
    }

    @Override
    public void incrementUncertain(String attribute, int count) {
    }

    @Override
    public void recordResultSize(String attribute, int size) {
    }
}
