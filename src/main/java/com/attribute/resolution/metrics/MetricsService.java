package com.attribute.resolution.metrics;

import java.time.Duration;

/**
 * Interface for recording attribute resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordResolutionDuration(String attribute, boolean filtered, Duration duration);

    void incrementResolved(String attribute, int count);

    void incrementUnresolved(String attribute, int count);

    void incrementUncertain(String attribute, int count);

    void recordResultSize(String attribute, int size);
}
