package com.records.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Nested
    @DisplayName("Default rules")
    class DefaultRulesTests {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "Acme Inc.|acme",
                "Acme Corp|acme",
                "ACME, LLC|acme",
                "Acme Co.|acme",
                "Smith Family Foundation|smith family",
                "Friends of Jane Smith Committee|friends of jane smith",
                "Working Families PAC|working families",
                "National Assoc. of Realtors|national of realtors",
                "'  Jane   Smith  '|jane smith"
        })
        @DisplayName("Should normalize public-records names")
        void testNormalize(String input, String expected) {
            assertEquals(expected, engine.normalize(input));
        }

        @Test
        @DisplayName("Should drop apostrophes and keep ampersands")
        void testApostrophe() {
            assertEquals("obrien & sons", engine.normalize("O'Brien & Sons, Ltd."));
        }

        @Test
        @DisplayName("Should not strip suffix words inside other words")
        void testWordBoundaries() {
            assertEquals("incorporated widgets", engine.normalize("Incorporated Widgets"));
            assertEquals("cohen", engine.normalize("Cohen"));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t\n"})
        @DisplayName("Should return empty string for null or blank input")
        void testBlank(String input) {
            assertEquals("", engine.normalize(input));
        }

        @Test
        @DisplayName("A name made only of suffixes normalizes to empty")
        void testOnlySuffixes() {
            assertEquals("", engine.normalize("Inc."));
            assertEquals("", engine.normalize("LLC, Corp."));
        }

        @Test
        @DisplayName("Normalization should be idempotent")
        void testIdempotent() {
            String once = engine.normalize("The Acme Holding Co., Inc.");
            assertEquals(once, engine.normalize(once));
        }

        @Test
        @DisplayName("Should report equivalent names")
        void testAreEquivalent() {
            assertTrue(engine.areEquivalent("Acme Inc.", "ACME CORP"));
            assertFalse(engine.areEquivalent("Acme Inc.", "Apex Inc."));
        }
    }

    @Nested
    @DisplayName("Rule management")
    class RuleManagementTests {

        @Test
        @DisplayName("Should apply rules in priority order")
        void testPriorityOrder() {
            NormalizationEngine custom = new NormalizationEngine();
            custom.addRule(NormalizationRule.builder()
                    .name("second").pattern("b").replacement("c").priority(20).build());
            custom.addRule(NormalizationRule.builder()
                    .name("first").pattern("a").replacement("b").priority(10).build());

            assertEquals("cc", custom.normalize("ab"));
            assertEquals(List.of("first", "second"),
                    custom.getRules().stream().map(NormalizationRule::getName).toList());
        }

        @Test
        @DisplayName("Should remove rules by name")
        void testRemoveRule() {
            assertTrue(engine.removeRule("strip-organization-suffixes"));
            assertEquals("acme inc", engine.normalize("Acme Inc."));
            assertFalse(engine.removeRule("missing"));
        }

        @Test
        @DisplayName("Engine without rules only lowercases and collapses whitespace")
        void testEmptyEngine() {
            assertEquals("acme, inc.", new NormalizationEngine().normalize("  ACME,   Inc. "));
        }
    }
}
