package com.records.resolution.resolution;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.audit.AuditService;
import com.records.resolution.cache.CacheConfig;
import com.records.resolution.cache.CaffeineResolutionCache;
import com.records.resolution.cache.NoOpResolutionCache;
import com.records.resolution.cache.ResolutionCache;
import com.records.resolution.core.model.CandidateType;
import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityAttributes;
import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.MatchMethod;
import com.records.resolution.core.model.ResolvedEntity;
import com.records.resolution.metrics.NoOpMetricsService;
import com.records.resolution.rules.DefaultNormalizationRules;
import com.records.resolution.similarity.NameSimilarityScorer;
import com.records.resolution.similarity.SimilarityAlgorithm;
import com.records.resolution.store.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionCascadeTest {

    private static final Instant T0 = Instant.parse("2024-06-01T09:00:00Z");

    private InMemoryEntityStore store;
    private AuditService auditService;
    private Clock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        auditService = new AuditService();
        clock = Clock.fixed(T0, ZoneOffset.UTC);
    }

    private ResolutionCascade cascade() {
        return cascade(new NameSimilarityScorer(), new NoOpResolutionCache());
    }

    private ResolutionCascade cascade(NameSimilarityScorer scorer, ResolutionCache cache) {
        ResolutionOptions options = ResolutionOptions.defaults();
        AttributeMerger merger = new AttributeMerger(store, auditService, new NoOpMetricsService(),
                clock, options.getSourceSystem());
        return new ResolutionCascade(store, scorer, merger, cache, auditService,
                new NoOpMetricsService(), options, clock);
    }

    private static EntityCandidate candidate(String name, CandidateType type, String source) {
        return EntityCandidate.builder().name(name).type(type).source(source).build();
    }

    private Entity stored(String id, String name, EntityType type, int secondsAfterT0) {
        Entity entity = Entity.builder()
                .id(id)
                .name(name)
                .type(type)
                .createdAt(T0.minusSeconds(1000).plusSeconds(secondsAfterT0))
                .build();
        store.insertEntity(entity);
        return entity;
    }

    @Nested
    @DisplayName("Creation")
    class CreationTests {

        @Test
        @DisplayName("A first sighting creates an entity with discovery metadata")
        void testCreatesEntity() {
            ResolvedEntity resolved = cascade().resolve(EntityCandidate.builder()
                    .name("Friends of Jane Smith")
                    .type(CandidateType.COMMITTEE)
                    .source("fec")
                    .identifier(IdentifierKind.FEC_ID, "C00123456")
                    .attributes(Map.of("state", "CA"))
                    .build());

            assertTrue(resolved.isNew());
            assertEquals(MatchMethod.NEW, resolved.matchedBy());
            assertEquals(1.0, resolved.confidence());

            Entity entity = store.findById(resolved.entityId()).orElseThrow();
            assertEquals("Friends of Jane Smith", entity.getName());
            assertEquals(EntityType.ORGANIZATION, entity.getType());
            assertEquals("Discovered from fec", entity.getDescription());
            assertEquals(5, entity.getImportance());
            assertEquals(1, entity.getMentionCount());
            assertEquals(T0, entity.getCreatedAt());
            assertEquals("C00123456", entity.getIdentifier(IdentifierKind.FEC_ID));
            assertEquals("CA", entity.getAttributes().get("state"));
            assertEquals(List.of("fec"), entity.getAttributes().get(EntityAttributes.SOURCES));
            assertEquals(T0.toString(), entity.getAttributes().get(EntityAttributes.DISCOVERED_AT));
            assertEquals(1, auditService.getEntriesByAction(AuditAction.ENTITY_CREATED).size());
        }

        @Test
        @DisplayName("Surrounding whitespace is trimmed from the stored name")
        void testNameTrimmed() {
            ResolvedEntity resolved = cascade().resolve(
                    candidate("  Acme Holdings  ", CandidateType.ORGANIZATION, "sec"));

            assertEquals("Acme Holdings", store.findById(resolved.entityId()).orElseThrow().getName());
        }

        @Test
        @DisplayName("Contracts and filings become events")
        void testEventMapping() {
            ResolvedEntity resolved = cascade().resolve(
                    candidate("Contract 47QTCA19D00AB", CandidateType.CONTRACT, "usaspending"));

            assertEquals(EntityType.EVENT, store.findById(resolved.entityId()).orElseThrow().getType());
        }
    }

    @Nested
    @DisplayName("Exact stage")
    class ExactTests {

        @Test
        @DisplayName("A repeated name matches exactly, ignoring case, and merges attributes")
        void testExactRepeat() {
            ResolutionCascade cascade = cascade();
            String id = cascade.resolve(candidate("Acme Holdings", CandidateType.ORGANIZATION, "sec")).entityId();

            ResolvedEntity again = cascade.resolve(candidate("ACME HOLDINGS", CandidateType.ORGANIZATION, "fec"));

            assertFalse(again.isNew());
            assertEquals(id, again.entityId());
            assertEquals(MatchMethod.EXACT, again.matchedBy());
            assertEquals(1.0, again.confidence());

            Entity entity = store.findById(id).orElseThrow();
            assertEquals(2, entity.getMentionCount());
            assertEquals(List.of("sec", "fec"), entity.getAttributes().get(EntityAttributes.SOURCES));
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("Exact matching ignores the candidate type")
        void testExactIgnoresType() {
            Entity person = stored("p-1", "Jordan Lee", EntityType.PERSON, 0);

            ResolvedEntity resolved = cascade().resolve(candidate("Jordan Lee", CandidateType.ORGANIZATION, "sec"));

            assertEquals(person.getId(), resolved.entityId());
            assertEquals(MatchMethod.EXACT, resolved.matchedBy());
        }

        @Test
        @DisplayName("Cached lookups are verified and stale entries are dropped")
        void testCache() {
            CaffeineResolutionCache cache = new CaffeineResolutionCache(CacheConfig.defaults());
            ResolutionCascade cascade = cascade(new NameSimilarityScorer(), cache);

            String first = cascade.resolve(candidate("Acme Holdings", CandidateType.ORGANIZATION, "sec")).entityId();
            assertEquals(first, cascade.resolve(candidate("acme holdings", CandidateType.ORGANIZATION, "sec")).entityId());
            assertEquals(1, cache.getStats().hitCount());

            store.deleteEntity(first);
            ResolvedEntity recreated = cascade.resolve(candidate("Acme Holdings", CandidateType.ORGANIZATION, "sec"));

            assertTrue(recreated.isNew());
            assertNotEquals(first, recreated.entityId());
        }
    }

    @Nested
    @DisplayName("Identifier stage")
    class IdentifierTests {

        @Test
        @DisplayName("A shared EIN matches despite a different name")
        void testIdentifierMatch() {
            store.insertEntity(Entity.builder()
                    .id("acme")
                    .name("Acme Holdings")
                    .type(EntityType.ORGANIZATION)
                    .attributes(Map.of("ein", "12-3456789"))
                    .createdAt(T0)
                    .build());

            ResolvedEntity resolved = cascade().resolve(EntityCandidate.builder()
                    .name("Totally Different Name")
                    .type(CandidateType.ORGANIZATION)
                    .source("irs")
                    .identifier(IdentifierKind.EIN, "12-3456789")
                    .build());

            assertEquals("acme", resolved.entityId());
            assertEquals(MatchMethod.IDENTIFIER, resolved.matchedBy());
            assertEquals(0.99, resolved.confidence());
            assertEquals("Acme Holdings", store.findById("acme").orElseThrow().getName());
        }

        @Test
        @DisplayName("EIN is consulted before CIK")
        void testIdentifierOrder() {
            store.insertEntity(Entity.builder().id("by-cik").name("Apex One").type(EntityType.ORGANIZATION)
                    .attributes(Map.of("cik", "0000320193")).createdAt(T0).build());
            store.insertEntity(Entity.builder().id("by-ein").name("Apex Two").type(EntityType.ORGANIZATION)
                    .attributes(Map.of("ein", "98-7654321")).createdAt(T0).build());

            ResolvedEntity resolved = cascade().resolve(EntityCandidate.builder()
                    .name("Zenith Partners")
                    .type(CandidateType.ORGANIZATION)
                    .source("sec")
                    .identifier(IdentifierKind.CIK, "0000320193")
                    .identifier(IdentifierKind.EIN, "98-7654321")
                    .build());

            assertEquals("by-ein", resolved.entityId());
        }

        @Test
        @DisplayName("An identifier match beats a better fuzzy name match")
        void testIdentifierBeatsFuzzy() {
            stored("acme", "Acme Holdings", EntityType.ORGANIZATION, 0);
            store.insertEntity(Entity.builder().id("zeta").name("Zeta Partners").type(EntityType.ORGANIZATION)
                    .attributes(Map.of("ein", "55-0000001")).createdAt(T0).build());

            ResolvedEntity resolved = cascade().resolve(EntityCandidate.builder()
                    .name("Acme Holding")
                    .type(CandidateType.ORGANIZATION)
                    .source("irs")
                    .identifier(IdentifierKind.EIN, "55-0000001")
                    .build());

            assertEquals("zeta", resolved.entityId());
            assertEquals(MatchMethod.IDENTIFIER, resolved.matchedBy());
        }

        @Test
        @DisplayName("Weak identifiers are stored but never matched on")
        void testWeakIdentifierNotMatched() {
            store.insertEntity(Entity.builder().id("acme").name("Acme Holdings").type(EntityType.ORGANIZATION)
                    .attributes(Map.of("duns", "123456789")).createdAt(T0).build());

            ResolvedEntity resolved = cascade().resolve(EntityCandidate.builder()
                    .name("Unrelated Widgets")
                    .type(CandidateType.ORGANIZATION)
                    .source("sam")
                    .identifier(IdentifierKind.DUNS, "123456789")
                    .build());

            assertTrue(resolved.isNew());
            assertEquals("123456789", store.findById(resolved.entityId()).orElseThrow()
                    .getAttributes().get("duns"));
        }
    }

    @Nested
    @DisplayName("Fuzzy stage")
    class FuzzyTests {

        @Test
        @DisplayName("A spelling variant matches with its similarity as confidence")
        void testFuzzyMatch() {
            stored("jane", "Jane Smith", EntityType.PERSON, 0);

            ResolvedEntity resolved = cascade().resolve(candidate("Jane Smyth", CandidateType.PERSON, "fec"));

            assertEquals("jane", resolved.entityId());
            assertEquals(MatchMethod.FUZZY, resolved.matchedBy());
            assertEquals(0.96, resolved.confidence(), 1e-9);
            assertEquals(2, store.findById("jane").orElseThrow().getMentionCount());
        }

        @Test
        @DisplayName("People never fuzzy-match organizations")
        void testTypeScoped() {
            stored("org", "Jane Smith", EntityType.ORGANIZATION, 0);

            ResolvedEntity resolved = cascade().resolve(candidate("Jane Smyth", CandidateType.PERSON, "fec"));

            assertTrue(resolved.isNew());
            assertEquals(2, store.size());
        }

        @Test
        @DisplayName("Committees fuzzy-match organizations")
        void testCommitteeMatchesOrganization() {
            stored("org", "Friends of Jane Smith", EntityType.ORGANIZATION, 0);

            ResolvedEntity resolved = cascade().resolve(
                    candidate("Friends of Jane Smyth", CandidateType.COMMITTEE, "fec"));

            assertEquals("org", resolved.entityId());
            assertEquals(MatchMethod.FUZZY, resolved.matchedBy());
        }

        @Test
        @DisplayName("Unscoped kinds are compared against every type")
        void testUnscopedKinds() {
            stored("person", "Jane Smith", EntityType.PERSON, 0);

            ResolvedEntity resolved = cascade().resolve(candidate("Jane Smyth", CandidateType.FILING, "sec"));

            assertEquals("person", resolved.entityId());
        }

        @Test
        @DisplayName("Aliases take part in fuzzy matching")
        void testAliasMatch() {
            store.insertEntity(Entity.builder()
                    .id("ibm")
                    .name("International Business Machines")
                    .type(EntityType.ORGANIZATION)
                    .aliases(Set.of("IBM Corp"))
                    .createdAt(T0)
                    .build());

            ResolvedEntity resolved = cascade().resolve(candidate("IBM", CandidateType.ORGANIZATION, "sec"));

            assertEquals("ibm", resolved.entityId());
            assertEquals(1.0, resolved.confidence());
        }

        @Test
        @DisplayName("On equal scores the oldest entity wins")
        void testTieKeepsEarliest() {
            stored("newer", "Jon Smith", EntityType.PERSON, 20);
            stored("older", "Jon Smith", EntityType.PERSON, 10);

            ResolvedEntity resolved = cascade().resolve(candidate("John Smith", CandidateType.PERSON, "fec"));

            assertEquals("older", resolved.entityId());
        }

        @Test
        @DisplayName("A score equal to the threshold is not a match")
        void testThresholdIsStrict() {
            stored("a", "Alpha Group", EntityType.ORGANIZATION, 0);

            ResolvedEntity atThreshold = cascade(scorerReturning(0.85), new NoOpResolutionCache())
                    .resolve(candidate("Beta Group", CandidateType.ORGANIZATION, "sec"));
            assertTrue(atThreshold.isNew());

            ResolvedEntity above = cascade(scorerReturning(0.86), new NoOpResolutionCache())
                    .resolve(candidate("Gamma Group", CandidateType.ORGANIZATION, "sec"));
            assertEquals(MatchMethod.FUZZY, above.matchedBy());
            assertEquals(0.86, above.confidence());
        }

        private NameSimilarityScorer scorerReturning(double score) {
            return new NameSimilarityScorer(DefaultNormalizationRules.createDefaultEngine(), new SimilarityAlgorithm() {
                @Override
                public double compute(String s1, String s2) {
                    return score;
                }

                @Override
                public String getName() {
                    return "constant";
                }
            });
        }
    }

    @Test
    @DisplayName("Creation attributes carry identifiers, sources and discovery time")
    void testCreationAttributes() {
        EntityCandidate candidate = EntityCandidate.builder()
                .name("Acme")
                .type(CandidateType.ORGANIZATION)
                .source("sec")
                .identifier(IdentifierKind.CIK, "0000320193")
                .attributes(Map.of("state", "DE"))
                .build();

        Map<String, Object> attributes = ResolutionCascade.creationAttributes(candidate, T0);

        assertEquals(Map.of(
                "state", "DE",
                "cik", "0000320193",
                EntityAttributes.SOURCES, List.of("sec"),
                EntityAttributes.DISCOVERED_AT, T0.toString()), attributes);
    }
}
