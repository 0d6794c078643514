package com.openapi.mockserver.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRequest(String method, int status, Duration duration) {
    }

    @Override
    public void incrementResourceSaved() {
    }

    @Override
    public void incrementResourceDeleted() {
    }

    @Override
    public void incrementResourceNotFound() {
    }

    @Override
    public void incrementSecurityRejected(String schemeTypes) {
    }
}
