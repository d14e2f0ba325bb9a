package com.records.resolution.metrics;

import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.MatchMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolution(MatchMethod method, Duration duration) {
    }

    @Override
    public void incrementEntityCreated(EntityType type) {
    }

    @Override
    public void incrementEntityMerged(EntityType type) {
    }

    @Override
    public void incrementMergeFailed() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordDuplicatesFound(int count) {
    }

    @Override
    public void incrementAttributeMergeFailure() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
