package com.records.resolution.resolution;

import com.records.resolution.audit.AuditAction;
import com.records.resolution.cache.CacheConfig;
import com.records.resolution.core.model.CandidateType;
import com.records.resolution.core.model.DuplicatePair;
import com.records.resolution.core.model.Entity;
import com.records.resolution.core.model.EntityType;
import com.records.resolution.core.model.EntityCandidate;
import com.records.resolution.core.model.IdentifierKind;
import com.records.resolution.core.model.MatchMethod;
import com.records.resolution.core.model.Relationship;
import com.records.resolution.core.model.ResolvedEntity;
import com.records.resolution.merge.MergeResult;
import com.records.resolution.store.EntityStore;
import com.records.resolution.store.InMemoryEntityStore;
import com.records.resolution.store.StorageException;
import com.records.resolution.tracing.Span;
import com.records.resolution.tracing.TracingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class EntityResolverTest {

    private InMemoryEntityStore store;
    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        resolver = EntityResolver.builder()
                .entityStore(store)
                .cache(CacheConfig.defaults().createCache())
                .build();
    }

    private static EntityCandidate candidate(String name, CandidateType type) {
        return EntityCandidate.builder().name(name).type(type).source("fec").build();
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should require a store or a graph connection")
        void testRequiresStore() {
            assertThrows(IllegalStateException.class, () -> EntityResolver.builder().build());
        }

        @Test
        @DisplayName("Defaults to the standard options")
        void testDefaultOptions() {
            assertEquals(0.85, resolver.getOptions().getFuzzyMatchThreshold());
            assertSame(store, resolver.getStore());
        }
    }

    @Nested
    @DisplayName("resolveEntity")
    class ResolveTests {

        @Test
        @DisplayName("Should reject a name that normalizes to nothing without creating anything")
        void testEmptyAfterNormalization() {
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.resolveEntity(candidate("Inc.", CandidateType.ORGANIZATION)));
            assertEquals(0, store.size());
            assertTrue(resolver.getAuditService().getAllEntries().isEmpty());
        }

        @Test
        @DisplayName("Should reject a blank source")
        void testBlankSource() {
            EntityCandidate blankSource = EntityCandidate.builder()
                    .name("Acme Holdings").type(CandidateType.ORGANIZATION).source(" ").build();
            assertThrows(IllegalArgumentException.class, () -> resolver.resolveEntity(blankSource));
        }

        @Test
        @DisplayName("Create, then exact, identifier and fuzzy matches all land on one entity")
        void testFullFlow() {
            ResolvedEntity created = resolver.resolveEntity(EntityCandidate.builder()
                    .name("Friends of Jane Smith")
                    .type(CandidateType.COMMITTEE)
                    .source("fec")
                    .identifier(IdentifierKind.FEC_ID, "C00123456")
                    .build());
            assertTrue(created.isNew());

            ResolvedEntity exact = resolver.resolveEntity(candidate("FRIENDS OF JANE SMITH", CandidateType.COMMITTEE));
            assertEquals(MatchMethod.EXACT, exact.matchedBy());
            assertEquals(1.0, exact.confidence());

            ResolvedEntity byId = resolver.resolveEntity(EntityCandidate.builder()
                    .name("Smith for Congress")
                    .type(CandidateType.COMMITTEE)
                    .source("state-sos")
                    .identifier(IdentifierKind.FEC_ID, "C00123456")
                    .build());
            assertEquals(MatchMethod.IDENTIFIER, byId.matchedBy());
            assertEquals(0.99, byId.confidence());

            ResolvedEntity fuzzy = resolver.resolveEntity(candidate("Friends of Jane Smyth", CandidateType.ORGANIZATION));
            assertEquals(MatchMethod.FUZZY, fuzzy.matchedBy());
            assertTrue(fuzzy.confidence() > 0.85);

            assertEquals(created.entityId(), exact.entityId());
            assertEquals(created.entityId(), byId.entityId());
            assertEquals(created.entityId(), fuzzy.entityId());

            Entity entity = resolver.getEntity(created.entityId()).orElseThrow();
            assertEquals(EntityType.ORGANIZATION, entity.getType());
            assertEquals(4, entity.getMentionCount());
            assertEquals(List.of("fec", "state-sos"), entity.getAttributes().get("sources"));
            assertEquals(1, store.size());
        }

        @Test
        @DisplayName("A failed resolution is recorded on the span and rethrown")
        void testSpanRecordsFailure() {
            EntityStore failing = mock(EntityStore.class);
            when(failing.findByExactName(anyString())).thenThrow(new StorageException("graph unavailable"));
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);

            EntityResolver failingResolver = EntityResolver.builder()
                    .entityStore(failing)
                    .tracingService(tracing)
                    .build();

            StorageException thrown = assertThrows(StorageException.class,
                    () -> failingResolver.resolveEntity(candidate("Acme Holdings", CandidateType.ORGANIZATION)));

            verify(span).recordException(thrown);
            verify(span).setStatus(Span.SpanStatus.ERROR);
            verify(span).close();
            verify(failing, never()).insertEntity(any());
        }
    }

    @Nested
    @DisplayName("Duplicates and merging")
    class DedupTests {

        @Test
        @DisplayName("findDuplicates without a threshold uses the configured one")
        void testDefaultThreshold() {
            EntityResolver strict = EntityResolver.builder()
                    .entityStore(store)
                    .options(ResolutionOptions.builder().fuzzyMatchThreshold(0.99).duplicateThreshold(0.97).build())
                    .build();
            strict.resolveEntity(candidate("Jane Smith", CandidateType.PERSON));
            strict.resolveEntity(candidate("Jane Smyth", CandidateType.PERSON));

            assertTrue(strict.findDuplicates().isEmpty());
            List<DuplicatePair> pairs = strict.findDuplicates(0.9);
            assertEquals(1, pairs.size());
            assertEquals(0.96, pairs.get(0).score(), 0.0001);
        }

        @Test
        @DisplayName("mergeEntities rejects blank ids")
        void testBlankIds() {
            assertThrows(IllegalArgumentException.class, () -> resolver.mergeEntities(" ", "b"));
            assertThrows(IllegalArgumentException.class, () -> resolver.mergeEntities("a", null));
        }

        @Test
        @DisplayName("A merged-away name resolves to the survivor through its alias")
        void testMergeInvalidatesCache() {
            EntityResolver strict = EntityResolver.builder()
                    .entityStore(store)
                    .cache(CacheConfig.defaults().createCache())
                    .options(ResolutionOptions.builder().fuzzyMatchThreshold(0.99).build())
                    .build();
            String smith = strict.resolveEntity(candidate("Jane Smith", CandidateType.PERSON)).entityId();
            String smyth = strict.resolveEntity(candidate("Jane Smyth", CandidateType.PERSON)).entityId();
            assertNotEquals(smith, smyth);

            MergeResult merge = strict.mergeEntities(smith, smyth);
            assertTrue(merge.isMerged());

            ResolvedEntity again = strict.resolveEntity(candidate("Jane Smyth", CandidateType.PERSON));
            assertEquals(smith, again.entityId());
            assertEquals(MatchMethod.FUZZY, again.matchedBy());
            assertEquals(1.0, again.confidence());
            assertTrue(strict.getEntity(smyth).isEmpty());
        }

        @Test
        @DisplayName("Merging an unknown entity is skipped")
        void testMergeMissing() {
            String id = resolver.resolveEntity(candidate("Acme Holdings", CandidateType.ORGANIZATION)).entityId();
            MergeResult result = resolver.mergeEntities(id, "does-not-exist");
            assertFalse(result.isMerged());
            assertFalse(result.isFailure());
        }
    }

    @Nested
    @DisplayName("Relationships")
    class RelationshipTests {

        @Test
        @DisplayName("Should create and audit a relationship")
        void testCreateRelationship() {
            String committee = resolver.resolveEntity(candidate("Friends of Jane Smith", CandidateType.COMMITTEE)).entityId();
            String person = resolver.resolveEntity(candidate("Jane Smith", CandidateType.PERSON)).entityId();

            Relationship rel = resolver.createRelationship(person, committee, "CANDIDATE_OF", Map.of("cycle", 2024));

            assertEquals("CANDIDATE_OF", rel.getRelationshipType());
            assertEquals(List.of(rel.getId()), resolver.getRelationships(committee).stream().map(Relationship::getId).toList());
            assertEquals(1, resolver.getAuditService().getEntriesByAction(AuditAction.RELATIONSHIP_CREATED).size());
        }

        @Test
        @DisplayName("Should reject relationship types outside [A-Za-z0-9_]")
        void testInvalidType() {
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.createRelationship("a", "b", "DONATED-TO"));
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.createRelationship("a", "b", "x]->(n) DELETE n //"));
        }

        @Test
        @DisplayName("Should fail for a missing endpoint")
        void testMissingEndpoint() {
            String person = resolver.resolveEntity(candidate("Jane Smith", CandidateType.PERSON)).entityId();
            assertThrows(StorageException.class,
                    () -> resolver.createRelationship(person, "ghost", "EMPLOYED_BY"));
        }
    }
}
