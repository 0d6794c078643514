package com.openapi.mockserver.metrics;

import java.time.Duration;

/**
 * Interface for recording mock server metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the server works without
 * any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordRequest(String method, int status, Duration duration);

    void incrementResourceSaved();

    void incrementResourceDeleted();

    void incrementResourceNotFound();

    void incrementSecurityRejected(String schemeTypes);
}
