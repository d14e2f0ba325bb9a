package com.records.resolution.similarity;

import com.records.resolution.rules.DefaultNormalizationRules;
import com.records.resolution.rules.NormalizationEngine;

import java.util.Objects;

/**
 * Scores how alike two entity names are after normalization.
 *
 * <p>Both names are normalized first. Equal normalized names (including two empty ones)
 * score 1.0; an empty name against a non-empty one scores 0.0; anything else is scored
 * with the configured {@link SimilarityAlgorithm}, Jaro-Winkler by default.</p>
 */
public class NameSimilarityScorer {

    private final NormalizationEngine normalizationEngine;
    private final SimilarityAlgorithm algorithm;

    public NameSimilarityScorer() {
        this(DefaultNormalizationRules.createDefaultEngine(), new JaroWinklerSimilarity());
    }

    public NameSimilarityScorer(NormalizationEngine normalizationEngine) {
        this(normalizationEngine, new JaroWinklerSimilarity());
    }

    public NameSimilarityScorer(NormalizationEngine normalizationEngine, SimilarityAlgorithm algorithm) {
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm is required");
    }

    /**
     * Returns the similarity of two raw names, between 0.0 and 1.0.
     */
    public double similarity(String a, String b) {
        return similarityOfNormalized(normalizationEngine.normalize(a), normalizationEngine.normalize(b));
    }

    /**
     * Scores two names that have already been normalized with this scorer's engine.
     */
    public double similarityOfNormalized(String normalizedA, String normalizedB) {
        if (normalizedA.equals(normalizedB)) {
            return 1.0;
        }
        if (normalizedA.isEmpty() || normalizedB.isEmpty()) {
            return 0.0;
        }
        return algorithm.compute(normalizedA, normalizedB);
    }

    public NormalizationEngine getNormalizationEngine() {
        return normalizationEngine;
    }

    public String getAlgorithmName() {
        return algorithm.getName();
    }
}
