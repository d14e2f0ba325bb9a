package com.records.resolution.resolution;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditService;
import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityAttributes;
import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.metrics.MetricsService;
import com.records.resolution.store.EntityStore;
import com.records.resolution.store.EntityUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Folds a repeated sighting of an entity into the stored entity.
 *
 * <p>Candidate attributes and identifiers overwrite stored values, the source joins
 * {@code sources}, {@code lastUpdated} is stamped, candidate aliases are added and
 * {@code mentionCount} goes up by one, all in a single store update.</p>
 *
 * <p>A failure here never fails the resolution that triggered it: it is logged,
 * counted and audited, and the caller carries on with the matched entity id.</p>
 */
public class AttributeMerger {
    private static final Logger log = LoggerFactory.getLogger(AttributeMerger.class);

    private final EntityStore store;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final String actorId;

    public AttributeMerger(EntityStore store, AuditService auditService, MetricsService metricsService,
                           Clock clock, String actorId) {
        this.store = store;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.actorId = actorId;
    }

    /**
     * Merges the candidate into the entity.
     *
     * @return true if the entity was updated
     */
    public boolean merge(String entityId, EntityCandidate candidate) {
        try {
            Optional<Entity> current = store.findById(entityId);
            if (current.isEmpty()) {
                log.warn("attributes.merge.skipped entityId={} reason=not-found", entityId);
                return false;
            }
            Entity entity = current.get();

            Map<String, Object> attributes = mergedAttributes(entity, candidate);
            Set<String> aliases = new LinkedHashSet<>(entity.getAliases());
            aliases.addAll(candidate.getAliases());

            store.updateEntity(entityId, EntityUpdate.builder()
                    .attributes(attributes)
                    .aliases(aliases)
                    .mentionCount(entity.getMentionCount() + 1)
                    .build());

            auditService.record(AuditAction.ATTRIBUTES_MERGED, entityId, actorId, Map.of(
                    "source", candidate.getSource(),
                    "mentionCount", entity.getMentionCount() + 1
            ));
            log.debug("attributes.merged entityId={} source={}", entityId, candidate.getSource());
            return true;
        } catch (RuntimeException e) {
            log.error("attributes.merge.failed entityId={} source={} error={}",
                    entityId, candidate.getSource(), e.getMessage(), e);
            metricsService.incrementAttributeMergeFailure();
            auditService.record(AuditAction.ATTRIBUTE_MERGE_FAILED, entityId, actorId, Map.of(
                    "source", candidate.getSource(),
                    "error", String.valueOf(e.getMessage())
            ));
            return false;
        }
    }

    private Map<String, Object> mergedAttributes(Entity entity, EntityCandidate candidate) {
        Map<String, Object> attributes = new LinkedHashMap<>(entity.getAttributes());
        attributes.putAll(candidate.getAttributes());
        for (Map.Entry<IdentifierKind, String> identifier : candidate.getIdentifiers().entrySet()) {
            attributes.put(identifier.getKey().getAttributeKey(), identifier.getValue());
        }
        attributes.put(EntityAttributes.SOURCES, EntityAttributes.unionSources(
                EntityAttributes.sources(entity.getAttributes()), candidate.getSource()));
        attributes.put(EntityAttributes.LAST_UPDATED, clock.instant().toString());
        return attributes;
    }
}
