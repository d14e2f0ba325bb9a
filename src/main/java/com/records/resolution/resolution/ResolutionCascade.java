package com.records.resolution.resolution;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditService;
import com.records.resolution.cache.ResolutionCache;
import com.records.resolution.core.model.CandidateType;
import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityAttributes;
import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.MatchMethod;
import com.records.resolution.core.model.ResolvedEntity;
import com.records.resolution.metrics.MetricsService;
import com.records.resolution.rules.NormalizationEngine;
import com.records.resolution.similarity.NameSimilarityScorer;
import com.records.resolution.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which stored entity a candidate refers to, creating one when none fits.
 *
 * <p>Stages run in order and the first hit wins:</p>
 * <ol>
 *   <li>exact, case-insensitive name match (confidence 1.0)</li>
 *   <li>strong identifier match, EIN then CIK then FEC id</li>
 *   <li>best fuzzy name or alias match strictly above the fuzzy threshold</li>
 *   <li>create a new entity</li>
 * </ol>
 *
 * <p>Any match merges the candidate's attributes into the matched entity. Storage errors
 * propagate; attribute merge errors do not. Callers serialize resolutions of the same
 * normalized name, see {@link EntityResolver}.</p>
 */
public class ResolutionCascade {
    private static final Logger log = LoggerFactory.getLogger(ResolutionCascade.class);

    private final EntityStore store;
    private final NameSimilarityScorer similarityScorer;
    private final AttributeMerger attributeMerger;
    private final ResolutionCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final ResolutionOptions options;
    private final Clock clock;

    public ResolutionCascade(EntityStore store,
                             NameSimilarityScorer similarityScorer,
                             AttributeMerger attributeMerger,
                             ResolutionCache cache,
                             AuditService auditService,
                             MetricsService metricsService,
                             ResolutionOptions options,
                             Clock clock) {
        this.store = store;
        this.similarityScorer = similarityScorer;
        this.attributeMerger = attributeMerger;
        this.cache = cache;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.options = options;
        this.clock = clock;
    }

    public ResolvedEntity resolve(EntityCandidate candidate) {
        String name = candidate.getName().trim();

        Optional<Entity> exact = findExact(name);
        if (exact.isPresent()) {
            return matched(exact.get(), candidate, MatchMethod.EXACT, 1.0);
        }

        for (IdentifierKind kind : IdentifierKind.matchOrder()) {
            String value = candidate.getIdentifier(kind);
            if (value == null) {
                continue;
            }
            Optional<Entity> byIdentifier = store.findByIdentifier(kind, value);
            if (byIdentifier.isPresent()) {
                log.debug("resolve.identifier.hit kind={} entityId={}", kind, byIdentifier.get().getId());
                return matched(byIdentifier.get(), candidate, MatchMethod.IDENTIFIER,
                        options.getIdentifierMatchConfidence());
            }
        }

        Optional<FuzzyMatch> fuzzy = findBestFuzzy(name, candidate.getType());
        if (fuzzy.isPresent() && fuzzy.get().score() > options.getFuzzyMatchThreshold()) {
            metricsService.recordSimilarityScore(fuzzy.get().score());
            return matched(fuzzy.get().entity(), candidate, MatchMethod.FUZZY, fuzzy.get().score());
        }
        fuzzy.ifPresent(best -> log.debug("resolve.fuzzy.rejected bestEntityId={} score={} threshold={}",
                best.entity().getId(), best.score(), options.getFuzzyMatchThreshold()));

        return create(name, candidate);
    }

    private Optional<Entity> findExact(String name) {
        String nameKey = name.toLowerCase(Locale.ROOT);

        Optional<String> cachedId = cache.get(nameKey);
        if (cachedId.isPresent()) {
            Optional<Entity> cached = store.findById(cachedId.get());
            if (cached.isPresent() && cached.get().getName().toLowerCase(Locale.ROOT).equals(nameKey)) {
                metricsService.recordCacheHit();
                return cached;
            }
            // Stale entry, e.g. the entity was merged away
            cache.invalidate(cachedId.get());
        }
        metricsService.recordCacheMiss();

        Optional<Entity> found = store.findByExactName(name);
        found.ifPresent(entity -> cache.put(nameKey, entity.getId()));
        return found;
    }

    private Optional<FuzzyMatch> findBestFuzzy(String name, CandidateType candidateType) {
        EntityType typeFilter = candidateType.isFuzzyTypeScoped() ? candidateType.toEntityType() : null;
        List<Entity> pool = store.listEntities(typeFilter, options.getFuzzyScanLimit());

        NormalizationEngine engine = similarityScorer.getNormalizationEngine();
        String normalizedName = engine.normalize(name);

        FuzzyMatch best = null;
        for (Entity entity : pool) {
            double score = similarityScorer.similarityOfNormalized(normalizedName, engine.normalize(entity.getName()));
            for (String alias : entity.getAliases()) {
                score = Math.max(score, similarityScorer.similarityOfNormalized(normalizedName, engine.normalize(alias)));
            }
            // Strictly greater keeps the earliest entity on ties
            if (best == null || score > best.score()) {
                best = new FuzzyMatch(entity, score);
            }
        }
        log.debug("resolve.fuzzy.scanned poolSize={} typeFilter={}", pool.size(), typeFilter);
        return Optional.ofNullable(best);
    }

    private ResolvedEntity matched(Entity entity, EntityCandidate candidate, MatchMethod method, double confidence) {
        attributeMerger.merge(entity.getId(), candidate);
        auditService.record(AuditAction.ENTITY_MATCHED, entity.getId(), options.getSourceSystem(), Map.of(
                "candidateName", candidate.getName(),
                "source", candidate.getSource(),
                "matchedBy", method.name(),
                "confidence", confidence
        ));
        return ResolvedEntity.matched(entity.getId(), method, confidence);
    }

    private ResolvedEntity create(String name, EntityCandidate candidate) {
        Instant now = clock.instant();
        EntityType type = candidate.getType().toEntityType();

        Entity entity = Entity.builder()
                .type(type)
                .name(name)
                .aliases(candidate.getAliases())
                .attributes(creationAttributes(candidate, now))
                .description("Discovered from " + candidate.getSource())
                .importance(options.getDefaultImportance())
                .mentionCount(1)
                .createdAt(now)
                .build();

        String entityId = store.insertEntity(entity);
        cache.put(name.toLowerCase(Locale.ROOT), entityId);
        metricsService.incrementEntityCreated(type);
        auditService.record(AuditAction.ENTITY_CREATED, entityId, options.getSourceSystem(), Map.of(
                "name", name,
                "type", type.name(),
                "source", candidate.getSource()
        ));
        log.info("entity.created entityId={} type={} name='{}'", entityId, type, name);
        return ResolvedEntity.created(entityId);
    }

    static Map<String, Object> creationAttributes(EntityCandidate candidate, Instant now) {
        Map<String, Object> attributes = new LinkedHashMap<>(candidate.getAttributes());
        for (Map.Entry<IdentifierKind, String> identifier : candidate.getIdentifiers().entrySet()) {
            attributes.put(identifier.getKey().getAttributeKey(), identifier.getValue());
        }
        attributes.put(EntityAttributes.SOURCES, List.of(candidate.getSource()));
        attributes.put(EntityAttributes.DISCOVERED_AT, now.toString());
        return attributes;
    }

    private record FuzzyMatch(Entity entity, double score) {}
}
