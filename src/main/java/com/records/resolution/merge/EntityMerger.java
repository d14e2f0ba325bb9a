package com.records.resolution.merge;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditService;
import com.records.resolution.cache.MergeListener;
import com.records.resolution.core.model.Entity;
import com.records.resolution.logging.LogContext;
import com.records.resolution.metrics.MetricsService;
import com.records.resolution.metrics.NoOpMetricsService;
import com.records.resolution.store.EntityStore;
import com.records.resolution.store.EntityUpdate;
import com.records.resolution.store.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Folds a duplicate entity into a primary one.
 *
 * <p>Merge process:</p>
 * <ol>
 *   <li>Load both entities; skip if either is missing or they are the same entity</li>
 *   <li>Primary aliases gain the duplicate's name and aliases</li>
 *   <li>Attributes: the duplicate's as a base, the primary's on top</li>
 *   <li>Re-point every relationship of the duplicate, as source and as target, to the primary</li>
 *   <li>Check the duplicate has no relationships left, then delete it</li>
 * </ol>
 *
 * <p>The primary's name and type never change. If any step fails the primary's previous
 * aliases and attributes are restored and the duplicate is kept.</p>
 */
public class EntityMerger {
    private static final Logger log = LoggerFactory.getLogger(EntityMerger.class);

    private final EntityStore store;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final String actorId;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();

    public EntityMerger(EntityStore store, AuditService auditService) {
        this(store, auditService, new NoOpMetricsService(), "entity-merger");
    }

    public EntityMerger(EntityStore store, AuditService auditService,
                        MetricsService metricsService, String actorId) {
        this.store = store;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.actorId = actorId;
    }

    public void addMergeListener(MergeListener listener) {
        mergeListeners.add(listener);
    }

    public void removeMergeListener(MergeListener listener) {
        mergeListeners.remove(listener);
    }

    /**
     * Merges {@code duplicateId} into {@code primaryId}. Never throws for storage failures;
     * they are reported as a {@link MergeStatus#FAILED} result.
     */
    public MergeResult merge(String primaryId, String duplicateId) {
        try (LogContext logCtx = LogContext.forMerge(LogContext.generateCorrelationId(), primaryId, duplicateId)) {
            log.info("merge.starting primaryEntityId={} duplicateEntityId={}", primaryId, duplicateId);

            if (primaryId.equals(duplicateId)) {
                log.info("merge.skipped reason=same-entity entityId={}", primaryId);
                return MergeResult.skipped(primaryId, duplicateId, "Primary and duplicate are the same entity");
            }

            Optional<Entity> primaryOpt;
            Optional<Entity> duplicateOpt;
            try {
                primaryOpt = store.findById(primaryId);
                duplicateOpt = store.findById(duplicateId);
            } catch (StorageException e) {
                log.error("merge.failed primaryEntityId={} duplicateEntityId={} error={}",
                        primaryId, duplicateId, e.getMessage());
                metricsService.incrementMergeFailed();
                return MergeResult.failed(primaryId, duplicateId, "Merge failed: " + e.getMessage());
            }

            if (primaryOpt.isEmpty()) {
                log.info("merge.skipped reason=primary-not-found primaryEntityId={}", primaryId);
                return MergeResult.skipped(primaryId, duplicateId, "Primary entity not found: " + primaryId);
            }
            if (duplicateOpt.isEmpty()) {
                log.info("merge.skipped reason=duplicate-not-found duplicateEntityId={}", duplicateId);
                return MergeResult.skipped(primaryId, duplicateId, "Duplicate entity not found: " + duplicateId);
            }

            return mergeLoaded(primaryOpt.get(), duplicateOpt.get());
        }
    }

    private MergeResult mergeLoaded(Entity primary, Entity duplicate) {
        String primaryId = primary.getId();
        String duplicateId = duplicate.getId();
        Set<String> mergedAliases = mergeAliases(primary, duplicate);
        Map<String, Object> mergedAttributes = mergeAttributes(primary, duplicate);
        final int[] repointed = {0};

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("update primary aliases and attributes",
                    () -> store.updateEntity(primaryId, EntityUpdate.builder()
                            .attributes(mergedAttributes)
                            .aliases(mergedAliases)
                            .build()),
                    () -> store.updateEntity(primaryId, EntityUpdate.builder()
                            .attributes(primary.getAttributes())
                            .aliases(primary.getAliases())
                            .build())
            );

            // Moved relationships stay on the primary if a later step fails; they never dangle
            tx.executeNoCompensation("re-point relationships",
                    () -> repointed[0] = store.repointRelationships(duplicateId, primaryId));

            tx.executeNoCompensation("verify duplicate detached", () -> {
                int remaining = store.findRelationshipsByEntity(duplicateId).size();
                if (remaining > 0) {
                    throw new StorageException(remaining + " relationships still reference " + duplicateId);
                }
            });

            tx.executeNoCompensation("delete duplicate", () -> store.deleteEntity(duplicateId));

            tx.markSuccess();
        } catch (RuntimeException e) {
            log.error("merge.failed primaryEntityId={} duplicateEntityId={} error={}",
                    primaryId, duplicateId, e.getMessage());
            metricsService.incrementMergeFailed();
            auditService.record(AuditAction.ENTITY_MERGE_FAILED, primaryId, actorId, Map.of(
                    "duplicateEntityId", duplicateId,
                    "error", String.valueOf(e.getMessage())
            ));
            return MergeResult.failed(primaryId, duplicateId, "Merge failed: " + e.getMessage());
        }

        auditService.record(AuditAction.ENTITY_MERGED, primaryId, actorId, Map.of(
                "duplicateEntityId", duplicateId,
                "duplicateName", duplicate.getName(),
                "relationshipsRepointed", repointed[0]
        ));
        if (repointed[0] > 0) {
            auditService.record(AuditAction.RELATIONSHIPS_REPOINTED, primaryId, actorId, Map.of(
                    "fromEntityId", duplicateId,
                    "relationshipCount", repointed[0]
            ));
        }
        auditService.record(AuditAction.ENTITY_DELETED, duplicateId, actorId, Map.of(
                "mergedInto", primaryId
        ));
        metricsService.incrementEntityMerged(primary.getType());
        notifyMergeListeners(primaryId, duplicateId);

        log.info("merge.completed primaryEntityId={} duplicateEntityId={} relationshipsRepointed={}",
                primaryId, duplicateId, repointed[0]);
        return MergeResult.merged(primaryId, duplicateId, repointed[0]);
    }

    static Set<String> mergeAliases(Entity primary, Entity duplicate) {
        Set<String> aliases = new LinkedHashSet<>(primary.getAliases());
        aliases.add(duplicate.getName());
        aliases.addAll(duplicate.getAliases());
        return aliases;
    }

    static Map<String, Object> mergeAttributes(Entity primary, Entity duplicate) {
        Map<String, Object> attributes = new LinkedHashMap<>(duplicate.getAttributes());
        attributes.putAll(primary.getAttributes());
        return attributes;
    }

    private void notifyMergeListeners(String primaryId, String duplicateId) {
        for (MergeListener listener : mergeListeners) {
            try {
                listener.onMerge(primaryId, duplicateId);
            } catch (RuntimeException e) {
                log.warn("Merge listener failed for {} -> {}: {}", duplicateId, primaryId, e.getMessage());
            }
        }
    }
}
