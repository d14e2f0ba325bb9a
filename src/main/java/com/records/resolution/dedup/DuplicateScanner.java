package com.records.resolution.dedup;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditService;
import com.records.resolution.core.model.DuplicatePair;
import com.records.resolution.core.model.Entity;
import com.records.resolution.logging.LogContext;
import com.records.resolution.metrics.MetricsService;
import com.records.resolution.rules.NormalizationEngine;
import com.records.resolution.similarity.NameSimilarityScorer;
import com.records.resolution.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Batch scan for likely duplicate entities.
 *
 * <p>Loads up to {@code scanLimit} entities in store order and compares every pair by name.
 * Pairs scoring at least the threshold are reported, except pairs whose normalized names
 * are identical (score 1.0). Results are sorted by score, highest first; equal scores keep
 * scan order. The scan is quadratic in the number of loaded entities.</p>
 */
public class DuplicateScanner {
    private static final Logger log = LoggerFactory.getLogger(DuplicateScanner.class);

    private final EntityStore store;
    private final NameSimilarityScorer similarityScorer;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final int scanLimit;
    private final String actorId;

    public DuplicateScanner(EntityStore store, NameSimilarityScorer similarityScorer,
                            AuditService auditService, MetricsService metricsService,
                            int scanLimit, String actorId) {
        if (scanLimit <= 0) {
            throw new IllegalArgumentException("scanLimit must be positive");
        }
        this.store = store;
        this.similarityScorer = similarityScorer;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.scanLimit = scanLimit;
        this.actorId = actorId;
    }

    /**
     * Finds pairs of entities whose name similarity is at least {@code threshold}.
     *
     * @throws IllegalArgumentException if the threshold is outside [0, 1]
     */
    public List<DuplicatePair> findDuplicates(double threshold) {
        if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }

        try (LogContext logCtx = LogContext.forDuplicateScan(LogContext.generateCorrelationId())) {
            List<Entity> entities = store.listEntities(null, scanLimit);
            log.info("duplicates.scan.starting entityCount={} threshold={}", entities.size(), threshold);

            NormalizationEngine engine = similarityScorer.getNormalizationEngine();
            List<String> normalized = new ArrayList<>(entities.size());
            for (Entity entity : entities) {
                normalized.add(engine.normalize(entity.getName()));
            }

            List<DuplicatePair> pairs = new ArrayList<>();
            for (int i = 0; i < entities.size(); i++) {
                for (int j = i + 1; j < entities.size(); j++) {
                    double score = similarityScorer.similarityOfNormalized(normalized.get(i), normalized.get(j));
                    if (score >= threshold && score < 1.0) {
                        Entity a = entities.get(i);
                        Entity b = entities.get(j);
                        pairs.add(new DuplicatePair(a.getId(), b.getId(), a.getName(), b.getName(), score));
                    }
                }
            }
            pairs.sort(Comparator.comparingDouble(DuplicatePair::score).reversed());

            metricsService.recordDuplicatesFound(pairs.size());
            if (!pairs.isEmpty()) {
                auditService.record(AuditAction.DUPLICATES_DETECTED, null, actorId, Map.of(
                        "pairCount", pairs.size(),
                        "threshold", threshold,
                        "entitiesScanned", entities.size()
                ));
            }
            log.info("duplicates.scan.completed entityCount={} pairCount={}", entities.size(), pairs.size());
            return pairs;
        }
    }
}
