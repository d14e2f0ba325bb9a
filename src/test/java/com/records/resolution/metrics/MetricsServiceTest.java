package com.records.resolution.metrics;

import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.MatchMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolution(MatchMethod.FUZZY, Duration.ofMillis(10));
                noOp.incrementEntityCreated(EntityType.PERSON);
                noOp.incrementEntityMerged(EntityType.ORGANIZATION);
                noOp.incrementMergeFailed();
                noOp.recordSimilarityScore(0.9);
                noOp.recordDuplicatesFound(3);
                noOp.incrementAttributeMergeFailure();
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Resolution durations are timed per match method")
        void recordResolution() {
            metrics.recordResolution(MatchMethod.EXACT, Duration.ofMillis(100));
            metrics.recordResolution(MatchMethod.EXACT, Duration.ofMillis(300));
            metrics.recordResolution(MatchMethod.NEW, Duration.ofMillis(50));

            Timer exact = registry.find("records.resolution.duration").tag("matchedBy", "EXACT").timer();
            assertNotNull(exact);
            assertEquals(2, exact.count());
            assertEquals(400, exact.totalTime(TimeUnit.MILLISECONDS), 1.0);

            Timer created = registry.find("records.resolution.duration").tag("matchedBy", "NEW").timer();
            assertNotNull(created);
            assertEquals(1, created.count());
        }

        @Test
        @DisplayName("Entity counters are tagged by type")
        void entityCounters() {
            metrics.incrementEntityCreated(EntityType.PERSON);
            metrics.incrementEntityCreated(EntityType.PERSON);
            metrics.incrementEntityCreated(EntityType.ORGANIZATION);
            metrics.incrementEntityMerged(EntityType.PERSON);

            assertEquals(2.0, registry.find("records.entity.created").tag("entityType", "PERSON")
                    .counter().count());
            assertEquals(1.0, registry.find("records.entity.created").tag("entityType", "ORGANIZATION")
                    .counter().count());
            assertEquals(1.0, registry.find("records.entity.merged").tag("entityType", "PERSON")
                    .counter().count());
        }

        @Test
        @DisplayName("Scores and duplicate counts are summarized")
        void summaries() {
            metrics.recordSimilarityScore(0.9);
            metrics.recordSimilarityScore(0.95);
            metrics.recordDuplicatesFound(4);

            DistributionSummary scores = registry.find("records.similarity.score").summary();
            assertNotNull(scores);
            assertEquals(2, scores.count());
            assertEquals(0.95, scores.max(), 1e-9);

            DistributionSummary duplicates = registry.find("records.duplicates.found").summary();
            assertNotNull(duplicates);
            assertEquals(4.0, duplicates.totalAmount(), 1e-9);
        }

        @Test
        @DisplayName("Failure and cache counters increment")
        void counters() {
            metrics.incrementMergeFailed();
            metrics.incrementAttributeMergeFailure();
            metrics.incrementAttributeMergeFailure();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();
            metrics.recordCacheMiss();

            assertEquals(1.0, counter("records.entity.merge.failed").count());
            assertEquals(2.0, counter("records.attributes.merge.failed").count());
            assertEquals(1.0, counter("records.cache.hit").count());
            assertEquals(2.0, counter("records.cache.miss").count());
        }

        private Counter counter(String name) {
            Counter counter = registry.find(name).counter();
            assertNotNull(counter, name);
            return counter;
        }
    }
}
