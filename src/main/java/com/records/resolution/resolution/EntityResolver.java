package com.records.resolution.resolution;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditRepository;
import com.records.resolution.audit.AuditService;
import com.records.resolution.cache.CacheStats;
import com.records.resolution.cache.MergeListener;
import com.records.resolution.cache.NoOpResolutionCache;
import com.records.resolution.cache.ResolutionCache;
import com.records.resolution.core.model.DuplicatePair;
import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityAttributes;
import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.core.model.Relationship;
import com.records.resolution.core.model.ResolvedEntity;
import com.records.resolution.dedup.DuplicateScanner;
import com.records.resolution.graph.FalkorDBConnection;
import com.records.resolution.graph.GraphConnection;
import com.records.resolution.graph.GraphEntityStore;
import com.records.resolution.graph.InputSanitizer;
import com.records.resolution.lock.DistributedLock;
import com.records.resolution.lock.LocalDistributedLock;
import com.records.resolution.logging.LogContext;
import com.records.resolution.merge.EntityMerger;
import com.records.resolution.merge.MergeResult;
import com.records.resolution.metrics.MetricsService;
import com.records.resolution.metrics.NoOpMetricsService;
import com.records.resolution.rules.DefaultNormalizationRules;
import com.records.resolution.rules.NormalizationEngine;
import com.records.resolution.similarity.JaroWinklerSimilarity;
import com.records.resolution.similarity.NameSimilarityScorer;
import com.records.resolution.similarity.SimilarityAlgorithm;
import com.records.resolution.store.EntityStore;
import com.records.resolution.tracing.NoOpTracingService;
import com.records.resolution.tracing.Span;
import com.records.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Main entry point for public-records entity resolution.
 *
 * <p>Producers call {@link #resolveEntity(EntityCandidate)} once per observation. The resolver
 * holds a per-name lock (keyed by the normalized name) around the whole resolution cascade,
 * so concurrent observations of the same new name yield a single entity.</p>
 *
 * <pre>
 * try (EntityResolver resolver = EntityResolver.builder()
 *         .falkorDB("localhost", 6379, "records")
 *         .build()) {
 *
 *     ResolvedEntity committee = resolver.resolveEntity(EntityCandidate.builder()
 *             .name("Friends of Jane Smith")
 *             .type(CandidateType.COMMITTEE)
 *             .source("fec")
 *             .identifier(IdentifierKind.FEC_ID, "C00123456")
 *             .build());
 *
 *     List&lt;DuplicatePair&gt; pairs = resolver.findDuplicates(0.9);
 *     resolver.mergeEntities(pairs.get(0).firstEntityId(), pairs.get(0).secondEntityId());
 * }
 * </pre>
 */
public class EntityResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EntityResolver.class);

    private final EntityStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final ResolutionOptions options;
    private final NormalizationEngine normalizationEngine;
    private final ResolutionCascade cascade;
    private final DuplicateScanner duplicateScanner;
    private final EntityMerger entityMerger;
    private final DistributedLock lock;
    private final ResolutionCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private EntityResolver(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.store = builder.store != null ? builder.store : new GraphEntityStore(connection);
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.normalizationEngine = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        this.lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();
        this.cache = builder.resolutionCache != null
                ? builder.resolutionCache : new NoOpResolutionCache();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        NameSimilarityScorer scorer = new NameSimilarityScorer(normalizationEngine,
                builder.similarityAlgorithm != null ? builder.similarityAlgorithm : new JaroWinklerSimilarity());
        String actorId = options.getSourceSystem();

        AttributeMerger attributeMerger = new AttributeMerger(store, auditService, metricsService,
                builder.clock, actorId);
        this.cascade = new ResolutionCascade(store, scorer, attributeMerger, cache, auditService,
                metricsService, options, builder.clock);
        this.duplicateScanner = new DuplicateScanner(store, scorer, auditService, metricsService,
                options.getDuplicateScanLimit(), actorId);
        this.entityMerger = new EntityMerger(store, auditService, metricsService, actorId);

        // Merged-away entities must drop out of the exact-name cache
        if (cache instanceof MergeListener mergeListener) {
            entityMerger.addMergeListener(mergeListener);
        }

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }

        log.info("EntityResolver initialized: store={} options={}", store.getClass().getSimpleName(), options);
    }

    // ========== Resolution API ==========

    /**
     * Resolves one observation to an entity id, creating the entity if nothing matches.
     *
     * @throws IllegalArgumentException if the candidate is invalid, including a name that
     *                                  is empty after normalization
     * @throws com.records.resolution.store.StorageException if the store fails
     * @throws com.records.resolution.lock.LockAcquisitionException if the name lock cannot be taken
     */
    public ResolvedEntity resolveEntity(EntityCandidate candidate) {
        InputSanitizer.validateCandidate(candidate, normalizationEngine);
        String lockKey = normalizationEngine.normalize(candidate.getName());
        long startNanos = System.nanoTime();

        try (LogContext logCtx = LogContext.forResolution(LogContext.generateCorrelationId(),
                candidate.getType().getKey(), candidate.getSource());
             Span span = tracingService.startSpan("records.resolve", Map.of(
                     "candidateType", candidate.getType().getKey(),
                     "source", candidate.getSource()))) {
            log.info("Resolving entity: '{}' (type: {}, source: {})",
                    candidate.getName(), candidate.getType().getKey(), candidate.getSource());
            try {
                ResolvedEntity result = lock.withLock(lockKey, () -> cascade.resolve(candidate));

                span.setAttribute("entityId", result.entityId());
                span.setAttribute("matchedBy", result.matchedBy().name());
                span.setAttribute("confidence", result.confidence());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.recordResolution(result.matchedBy(), Duration.ofNanos(System.nanoTime() - startNanos));
                log.info("entity.resolved entityId={} matchedBy={} confidence={} isNew={}",
                        result.entityId(), result.matchedBy(), result.confidence(), result.isNew());
                return result;
            } catch (RuntimeException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                log.error("resolve.failed name='{}' error={}", candidate.getName(), e.getMessage());
                throw e;
            }
        }
    }

    // ========== Deduplication API ==========

    /**
     * Finds likely duplicate pairs at the configured duplicate threshold.
     */
    public List<DuplicatePair> findDuplicates() {
        return findDuplicates(options.getDuplicateThreshold());
    }

    /**
     * Finds entity pairs with name similarity at least {@code threshold}, highest score first.
     */
    public List<DuplicatePair> findDuplicates(double threshold) {
        try (Span span = tracingService.startSpan("records.findDuplicates")) {
            List<DuplicatePair> pairs = duplicateScanner.findDuplicates(threshold);
            span.setAttribute("pairCount", pairs.size());
            span.setStatus(Span.SpanStatus.OK);
            return pairs;
        }
    }

    /**
     * Merges {@code duplicateId} into {@code primaryId}, re-pointing its relationships and
     * deleting it. Missing entities yield a skipped result, failures a failed one.
     */
    public MergeResult mergeEntities(String primaryId, String duplicateId) {
        InputSanitizer.validateEntityId(primaryId);
        InputSanitizer.validateEntityId(duplicateId);
        try (Span span = tracingService.startSpan("records.mergeEntities", Map.of(
                "primaryEntityId", primaryId,
                "duplicateEntityId", duplicateId))) {
            MergeResult result = entityMerger.merge(primaryId, duplicateId);
            span.setAttribute("status", result.status().name());
            span.setStatus(result.isFailure() ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
            return result;
        }
    }

    // ========== Entity and relationship API ==========

    public Optional<Entity> getEntity(String entityId) {
        InputSanitizer.validateEntityId(entityId);
        return store.findById(entityId);
    }

    public Relationship createRelationship(String sourceEntityId, String targetEntityId, String relationshipType) {
        return createRelationship(sourceEntityId, targetEntityId, relationshipType, Map.of());
    }

    /**
     * Creates a directed relationship between two existing entities.
     *
     * @throws IllegalArgumentException if the type or a property value is invalid
     * @throws com.records.resolution.store.StorageException if either entity does not exist
     */
    public Relationship createRelationship(String sourceEntityId, String targetEntityId,
                                           String relationshipType, Map<String, Object> properties) {
        InputSanitizer.validateEntityId(sourceEntityId);
        InputSanitizer.validateEntityId(targetEntityId);
        InputSanitizer.validateRelationshipType(relationshipType);
        EntityAttributes.validate(properties);

        try (Span span = tracingService.startSpan("records.createRelationship",
                Map.of("relationshipType", relationshipType))) {
            log.debug("Creating relationship {} from {} to {}", relationshipType, sourceEntityId, targetEntityId);
            Relationship created = store.createRelationship(Relationship.builder()
                    .sourceEntityId(sourceEntityId)
                    .targetEntityId(targetEntityId)
                    .relationshipType(relationshipType)
                    .properties(properties)
                    .build());
            auditService.record(AuditAction.RELATIONSHIP_CREATED, sourceEntityId, options.getSourceSystem(), Map.of(
                    "relationshipId", created.getId(),
                    "targetEntityId", targetEntityId,
                    "relationshipType", relationshipType
            ));
            span.setStatus(Span.SpanStatus.OK);
            return created;
        }
    }

    /**
     * All relationships where the entity is source or target.
     */
    public List<Relationship> getRelationships(String entityId) {
        InputSanitizer.validateEntityId(entityId);
        return store.findRelationshipsByEntity(entityId);
    }

    // ========== Service access ==========

    public AuditService getAuditService() {
        return auditService;
    }

    public EntityStore getStore() {
        return store;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
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
        private EntityStore store;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private NormalizationEngine normalizationEngine;
        private SimilarityAlgorithm similarityAlgorithm;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private boolean createIndexes = true;
        private ResolutionCache resolutionCache;
        private DistributedLock distributedLock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Clock clock = Clock.systemUTC();

        /**
         * Uses the given store directly, e.g. an {@link com.records.resolution.store.InMemoryEntityStore}.
         */
        public Builder entityStore(EntityStore store) {
            this.store = store;
            return this;
        }

        /**
         * Stores entities in the graph behind an existing connection. The caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection owned, and closed, by the resolver.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        /**
         * Replaces the Jaro-Winkler name metric.
         */
        public Builder similarityAlgorithm(SimilarityAlgorithm algorithm) {
            this.similarityAlgorithm = algorithm;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        /**
         * Sets a custom audit repository. Ignored when an audit service is set.
         */
        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Controls whether graph indexes are created on startup.
         */
        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder cache(ResolutionCache cache) {
            this.resolutionCache = cache;
            return this;
        }

        /**
         * Sets the per-name lock. Defaults to {@link LocalDistributedLock}.
         */
        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Clock used for creation and update timestamps.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public EntityResolver build() {
            if (store == null && connection == null) {
                throw new IllegalStateException("An EntityStore or a GraphConnection is required");
            }
            if (options == null || clock == null) {
                throw new IllegalStateException("options and clock must not be null");
            }
            return new EntityResolver(this);
        }
    }
}
