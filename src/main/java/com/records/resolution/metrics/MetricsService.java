package com.records.resolution.metrics;

import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.MatchMethod;

import java.time.Duration;

/**
 * Interface for recording entity resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    void recordResolution(MatchMethod method, Duration duration);

    void incrementEntityCreated(EntityType type);

    void incrementEntityMerged(EntityType type);

    void incrementMergeFailed();

    void recordSimilarityScore(double score);

    void recordDuplicatesFound(int count);

    void incrementAttributeMergeFailure();

    void recordCacheHit();

    void recordCacheMiss();
}
