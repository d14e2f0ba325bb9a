package com.records.resolution.cdi;

import com.records.resolution.cache.CacheConfig;
import com.records.resolution.graph.FalkorDBConnection;
import com.records.resolution.graph.GraphConnection;
import com.records.resolution.lock.DistributedLock;
import com.records.resolution.lock.GraphDistributedLock;
import com.records.resolution.lock.LocalDistributedLock;
import com.records.resolution.lock.LockConfig;
import com.records.resolution.lock.NoOpDistributedLock;
import com.records.resolution.resolution.EntityResolver;
import com.records.resolution.resolution.ResolutionOptions;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CDI producer that wires the resolver from MicroProfile Config properties.
 *
 * <p>Ingestion services running in a CDI container get an {@link EntityResolver} by injection:</p>
 * <pre>
 * records-resolution.falkordb.host=localhost
 * records-resolution.falkordb.port=6379
 * records-resolution.falkordb.graph-name=records
 * records-resolution.lock.type=graph
 * </pre>
 *
 * <p>{@code lock.type} is one of {@code local} (single process), {@code graph}
 * (lock nodes shared by every process on the same graph) or {@code none}.</p>
 */
@ApplicationScoped
public class EntityResolutionProducer {

    private static final Logger log = LoggerFactory.getLogger(EntityResolutionProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "records-resolution.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "records-resolution.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "records-resolution.falkordb.graph-name", defaultValue = "records")
    String falkordbGraphName;

    @Inject
    @ConfigProperty(name = "records-resolution.falkordb.create-indexes", defaultValue = "true")
    boolean createIndexes;

    // ── Resolution ────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.fuzzy-match-threshold", defaultValue = "0.85")
    double fuzzyMatchThreshold;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.duplicate-threshold", defaultValue = "0.85")
    double duplicateThreshold;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.identifier-match-confidence", defaultValue = "0.99")
    double identifierMatchConfidence;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.fuzzy-scan-limit", defaultValue = "500")
    int fuzzyScanLimit;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.duplicate-scan-limit", defaultValue = "1000")
    int duplicateScanLimit;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.default-importance", defaultValue = "5")
    int defaultImportance;

    @Inject
    @ConfigProperty(name = "records-resolution.resolution.source-system", defaultValue = "records-resolution")
    String sourceSystem;

    // ── Locking ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "records-resolution.lock.type", defaultValue = "local")
    String lockType;

    @Inject
    @ConfigProperty(name = "records-resolution.lock.timeout-ms", defaultValue = "5000")
    long lockTimeoutMs;

    @Inject
    @ConfigProperty(name = "records-resolution.lock.max-retries", defaultValue = "3")
    int lockMaxRetries;

    @Inject
    @ConfigProperty(name = "records-resolution.lock.retry-delay-ms", defaultValue = "100")
    long lockRetryDelayMs;

    @Inject
    @ConfigProperty(name = "records-resolution.lock.ttl-seconds", defaultValue = "30")
    int lockTtlSeconds;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "records-resolution.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "records-resolution.cache.max-size", defaultValue = "10000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "records-resolution.cache.ttl-seconds", defaultValue = "300")
    int cacheTtlSeconds;

    private GraphConnection connection;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public EntityResolver entityResolver() {
        log.info("Producing EntityResolver: falkordb={}:{}/{} lock={}",
                falkordbHost, falkordbPort, falkordbGraphName, lockType);
        connection = new FalkorDBConnection(falkordbHost, falkordbPort, falkordbGraphName);
        return createResolver(connection);
    }

    public void closeResolver(@Disposes EntityResolver resolver) {
        log.info("Closing EntityResolver");
        resolver.close();
        if (connection != null) {
            connection.close();
            connection = null;
        }
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    EntityResolver createResolver(GraphConnection graphConnection) {
        return EntityResolver.builder()
                .graphConnection(graphConnection)
                .createIndexes(createIndexes)
                .options(resolutionOptions())
                .cache(cacheConfig().createCache())
                .distributedLock(distributedLock(graphConnection))
                .build();
    }

    ResolutionOptions resolutionOptions() {
        return ResolutionOptions.builder()
                .fuzzyMatchThreshold(fuzzyMatchThreshold)
                .duplicateThreshold(duplicateThreshold)
                .identifierMatchConfidence(identifierMatchConfidence)
                .fuzzyScanLimit(fuzzyScanLimit)
                .duplicateScanLimit(duplicateScanLimit)
                .defaultImportance(defaultImportance)
                .sourceSystem(sourceSystem)
                .build();
    }

    LockConfig lockConfig() {
        return new LockConfig(lockTimeoutMs, lockMaxRetries, lockRetryDelayMs, lockTtlSeconds);
    }

    CacheConfig cacheConfig() {
        return cacheEnabled
                ? new CacheConfig(cacheMaxSize, cacheTtlSeconds, true)
                : CacheConfig.disabled();
    }

    DistributedLock distributedLock(GraphConnection graphConnection) {
        String type = lockType == null ? "local" : lockType.trim().toLowerCase();
        switch (type) {
            case "graph":
                return new GraphDistributedLock(graphConnection, lockConfig());
            case "none":
                log.warn("Name locking disabled; concurrent resolution may create duplicate entities");
                return new NoOpDistributedLock();
            case "local":
                return new LocalDistributedLock(lockConfig());
            default:
                log.warn("Unknown lock type '{}', falling back to local", lockType);
                return new LocalDistributedLock(lockConfig());
        }
    }
}
