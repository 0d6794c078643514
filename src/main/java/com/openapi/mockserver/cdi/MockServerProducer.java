package com.openapi.mockserver.cdi;

import com.openapi.mockserver.core.model.RoutingOptions;
import com.openapi.mockserver.handler.MockHandler;
import com.openapi.mockserver.metrics.MetricsService;
import com.openapi.mockserver.metrics.MicrometerMetricsService;
import com.openapi.mockserver.metrics.NoOpMetricsService;
import com.openapi.mockserver.openapi.OpenApiDocument;
import com.openapi.mockserver.openapi.OpenApiParser;
import com.openapi.mockserver.openapi.OperationResolver;
import com.openapi.mockserver.openapi.ResolverConfig;
import com.openapi.mockserver.rest.OpenApiRequestFilter;
import com.openapi.mockserver.rest.security.CorsConfig;
import com.openapi.mockserver.rest.security.CorsFilter;
import com.openapi.mockserver.rest.security.SecurityConfig;
import com.openapi.mockserver.rest.security.SecurityRequirementChecker;
import com.openapi.mockserver.rest.security.SecurityRequirementFilter;
import com.openapi.mockserver.store.DataStore;
import com.openapi.mockserver.store.FileDataStore;
import com.openapi.mockserver.store.InMemoryDataStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the mock server from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it reads configuration from {@code application.yaml} and produces all the
 * necessary beans: the OpenAPI document and resolver, the data store, the mock
 * handler, and the request filters.</p>
 *
 * <h2>Required configuration</h2>
 * <pre>
 * openapi-mock:
 *   definition: /etc/mock/petstore.yaml
 * </pre>
 */
@ApplicationScoped
public class MockServerProducer {

    private static final Logger log = LoggerFactory.getLogger(MockServerProducer.class);

    // ── OpenAPI ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "openapi-mock.definition")
    String definition;

    @Inject
    @ConfigProperty(name = "openapi-mock.resolver.cache-enabled", defaultValue = "true")
    boolean resolverCacheEnabled;

    @Inject
    @ConfigProperty(name = "openapi-mock.resolver.cache-max-size", defaultValue = "1000")
    long resolverCacheMaxSize;

    @Inject
    @ConfigProperty(name = "openapi-mock.resolver.cache-ttl-seconds", defaultValue = "600")
    long resolverCacheTtlSeconds;

    // ── Routing ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "openapi-mock.routing.case-sensitive", defaultValue = "false")
    boolean caseSensitive;

    @Inject
    @ConfigProperty(name = "openapi-mock.routing.strict", defaultValue = "false")
    boolean strictRouting;

    // ── Data Store ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "openapi-mock.data-store.type", defaultValue = "memory")
    String dataStoreType;

    @Inject
    @ConfigProperty(name = "openapi-mock.data-store.directory", defaultValue = "mock-data")
    String dataStoreDirectory;

    // ── Security ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "openapi-mock.security.enabled", defaultValue = "true")
    boolean securityEnabled;

    @Inject
    @ConfigProperty(name = "openapi-mock.security.realm")
    Optional<String> securityRealm;

    // ── CORS ──────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "openapi-mock.cors.enabled", defaultValue = "true")
    boolean corsEnabled;

    @Inject
    @ConfigProperty(name = "openapi-mock.cors.allowed-origins", defaultValue = "*")
    String corsAllowedOrigins;

    @Inject
    @ConfigProperty(name = "openapi-mock.cors.allowed-methods", defaultValue = "GET,POST,PUT,PATCH,DELETE,OPTIONS")
    String corsAllowedMethods;

    @Inject
    @ConfigProperty(name = "openapi-mock.cors.allowed-headers", defaultValue = "Content-Type,Authorization")
    String corsAllowedHeaders;

    @Inject
    @ConfigProperty(name = "openapi-mock.cors.max-age", defaultValue = "86400")
    long corsMaxAge;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public OpenApiDocument openApiDocument() {
        log.info("Producing OpenApiDocument: definition={}", definition);
        return new OpenApiParser().parse(Path.of(definition));
    }

    @Produces
    @ApplicationScoped
    public RoutingOptions routingOptions() {
        return new RoutingOptions(caseSensitive, strictRouting);
    }

    @Produces
    @ApplicationScoped
    public OperationResolver operationResolver(OpenApiDocument document, RoutingOptions routing) {
        ResolverConfig config = new ResolverConfig(resolverCacheEnabled, resolverCacheMaxSize,
                Duration.ofSeconds(resolverCacheTtlSeconds));
        return new OperationResolver(document, routing, config);
    }

    @Produces
    @ApplicationScoped
    public DataStore dataStore(RoutingOptions routing) {
        if ("file".equalsIgnoreCase(dataStoreType)) {
            log.info("Data store: file directory={}", dataStoreDirectory);
            return new FileDataStore(Path.of(dataStoreDirectory), routing);
        }
        if (!"memory".equalsIgnoreCase(dataStoreType)) {
            log.warn("Unknown data store type '{}', falling back to memory", dataStoreType);
        }
        log.info("Data store: memory");
        return new InMemoryDataStore(routing);
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Metrics: micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        log.info("Metrics: disabled (no MeterRegistry bean)");
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public MockHandler mockHandler(DataStore dataStore, MetricsService metrics) {
        return new MockHandler(dataStore, metrics);
    }

    @Produces
    @ApplicationScoped
    public SecurityConfig securityConfig() {
        SecurityConfig config = SecurityConfig.builder()
                .enabled(securityEnabled)
                .realm(securityRealm.orElse(null))
                .build();
        log.info("Security config: {}", config);
        return config;
    }

    @Produces
    @ApplicationScoped
    public CorsConfig corsConfig() {
        return new CorsConfig(corsEnabled, corsAllowedOrigins, corsAllowedMethods,
                corsAllowedHeaders, corsMaxAge);
    }

    @Produces
    @ApplicationScoped
    public OpenApiRequestFilter openApiRequestFilter(OperationResolver resolver) {
        return new OpenApiRequestFilter(resolver);
    }

    @Produces
    @ApplicationScoped
    public SecurityRequirementFilter securityRequirementFilter(SecurityConfig config, MetricsService metrics) {
        return new SecurityRequirementFilter(config, new SecurityRequirementChecker(), metrics);
    }

    @Produces
    @ApplicationScoped
    public CorsFilter corsFilter(CorsConfig config) {
        return new CorsFilter(config);
    }
}
