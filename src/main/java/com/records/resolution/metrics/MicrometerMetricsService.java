package com.records.resolution.metrics;

import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
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
 *   <li>{@code records.resolution.duration} - Timer (tag: matchedBy)</li>
 *   <li>{@code records.entity.created} - Counter (tag: entityType)</li>
 *   <li>{@code records.entity.merged} - Counter (tag: entityType)</li>
 *   <li>{@code records.entity.merge.failed} - Counter</li>
 *   <li>{@code records.similarity.score} - DistributionSummary of accepted fuzzy scores</li>
 *   <li>{@code records.duplicates.found} - DistributionSummary per scan</li>
 *   <li>{@code records.attributes.merge.failed} - Counter</li>
 *   <li>{@code records.cache.hit} / {@code records.cache.miss} - Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<MatchMethod, Timer> resolutionTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScoreSummary;
    private final DistributionSummary duplicatesFoundSummary;
    private final Counter mergeFailedCounter;
    private final Counter attributeMergeFailureCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScoreSummary = DistributionSummary.builder("records.similarity.score")
                .description("Similarity scores of accepted fuzzy matches")
                .register(registry);
        this.duplicatesFoundSummary = DistributionSummary.builder("records.duplicates.found")
                .description("Duplicate pairs reported per scan")
                .register(registry);
        this.mergeFailedCounter = Counter.builder("records.entity.merge.failed")
                .description("Entity merges rolled back after a failure")
                .register(registry);
        this.attributeMergeFailureCounter = Counter.builder("records.attributes.merge.failed")
                .description("Attribute merges that failed and were skipped")
                .register(registry);
        this.cacheHitCounter = Counter.builder("records.cache.hit")
                .description("Number of exact-name cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("records.cache.miss")
                .description("Number of exact-name cache misses")
                .register(registry);
    }

    @Override
    public void recordResolution(MatchMethod method, Duration duration) {
        Timer timer = resolutionTimers.computeIfAbsent(method, m ->
                Timer.builder("records.resolution.duration")
                        .description("Duration of candidate resolution")
                        .tag("matchedBy", m.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
        typeCounter("records.entity.created", "Number of new entities created", type).increment();
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
        typeCounter("records.entity.merged", "Number of duplicate entities merged away", type).increment();
    }

    @Override
    public void incrementMergeFailed() {
        mergeFailedCounter.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void recordDuplicatesFound(int count) {
        duplicatesFoundSummary.record(count);
    }

    @Override
    public void incrementAttributeMergeFailure() {
        attributeMergeFailureCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter typeCounter(String name, String description, EntityType type) {
        return counterCache.computeIfAbsent(name + ":" + type.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("entityType", type.name())
                        .register(registry));
    }
}
