package com.openapi.mockserver.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code mock.request.duration}: Timer (tags: method, outcome)</li>
 *   <li>{@code mock.resource.saved}: Counter</li>
 *   <li>{@code mock.resource.deleted}: Counter</li>
 *   <li>{@code mock.resource.not_found}: Counter</li>
 *   <li>{@code mock.security.rejected}: Counter (tag: schemeTypes)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter savedCounter;
    private final Counter deletedCounter;
    private final Counter notFoundCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.savedCounter = Counter.builder("mock.resource.saved")
                .description("Number of resources created or updated")
                .register(registry);
        this.deletedCounter = Counter.builder("mock.resource.deleted")
                .description("Number of resources deleted")
                .register(registry);
        this.notFoundCounter = Counter.builder("mock.resource.not_found")
                .description("Number of requests for resources that do not exist")
                .register(registry);
    }

    @Override
    public void recordRequest(String method, int status, Duration duration) {
        String outcome = outcome(status);
        String key = method + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("mock.request.duration")
                        .description("Duration of mock requests")
                        .tag("method", method)
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementResourceSaved() {
        savedCounter.increment();
    }

    @Override
    public void incrementResourceDeleted() {
        deletedCounter.increment();
    }

    @Override
    public void incrementResourceNotFound() {
        notFoundCounter.increment();
    }

    @Override
    public void incrementSecurityRejected(String schemeTypes) {
        String tag = schemeTypes == null || schemeTypes.isBlank() ? "none" : schemeTypes;
        Counter counter = counterCache.computeIfAbsent("rejected:" + tag, k ->
                Counter.builder("mock.security.rejected")
                        .description("Number of requests rejected for missing credentials")
                        .tag("schemeTypes", tag)
                        .register(registry));
        counter.increment();
    }

    private static String outcome(int status) {
        if (status >= 500) return "SERVER_ERROR";
        if (status >= 400) return "CLIENT_ERROR";
        if (status >= 300) return "REDIRECTION";
        return "SUCCESS";
    }
}
