package com.records.resolution.resolution;

/**
 * Options for entity resolution and duplicate detection.
 * Configures thresholds, scan caps and the values given to new entities.
 */
public class ResolutionOptions {

    private static final double DEFAULT_FUZZY_MATCH_THRESHOLD = 0.85;
    private static final double DEFAULT_DUPLICATE_THRESHOLD = 0.85;
    private static final double DEFAULT_IDENTIFIER_MATCH_CONFIDENCE = 0.99;
    private static final int DEFAULT_FUZZY_SCAN_LIMIT = 500;
    private static final int DEFAULT_DUPLICATE_SCAN_LIMIT = 1000;
    private static final int DEFAULT_IMPORTANCE = 5;
    private static final String DEFAULT_SOURCE_SYSTEM = "records-resolution";

    private final double fuzzyMatchThreshold;
    private final double duplicateThreshold;
    private final double identifierMatchConfidence;
    private final int fuzzyScanLimit;
    private final int duplicateScanLimit;
    private final int defaultImportance;
    private final String sourceSystem;

    private ResolutionOptions(Builder builder) {
        this.fuzzyMatchThreshold = builder.fuzzyMatchThreshold;
        this.duplicateThreshold = builder.duplicateThreshold;
        this.identifierMatchConfidence = builder.identifierMatchConfidence;
        this.fuzzyScanLimit = builder.fuzzyScanLimit;
        this.duplicateScanLimit = builder.duplicateScanLimit;
        this.defaultImportance = builder.defaultImportance;
        this.sourceSystem = builder.sourceSystem;
    }

    /**
     * A fuzzy match is accepted only when its score is strictly above this value.
     */
    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    /**
     * Threshold used by {@code findDuplicates()} when none is given.
     */
    public double getDuplicateThreshold() {
        return duplicateThreshold;
    }

    public double getIdentifierMatchConfidence() {
        return identifierMatchConfidence;
    }

    /**
     * Maximum number of stored entities compared against one candidate.
     */
    public int getFuzzyScanLimit() {
        return fuzzyScanLimit;
    }

    /**
     * Maximum number of stored entities considered by one duplicate scan.
     */
    public int getDuplicateScanLimit() {
        return duplicateScanLimit;
    }

    public int getDefaultImportance() {
        return defaultImportance;
    }

    /**
     * Actor id recorded in audit entries.
     */
    public String getSourceSystem() {
        return sourceSystem;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double fuzzyMatchThreshold = DEFAULT_FUZZY_MATCH_THRESHOLD;
        private double duplicateThreshold = DEFAULT_DUPLICATE_THRESHOLD;
        private double identifierMatchConfidence = DEFAULT_IDENTIFIER_MATCH_CONFIDENCE;
        private int fuzzyScanLimit = DEFAULT_FUZZY_SCAN_LIMIT;
        private int duplicateScanLimit = DEFAULT_DUPLICATE_SCAN_LIMIT;
        private int defaultImportance = DEFAULT_IMPORTANCE;
        private String sourceSystem = DEFAULT_SOURCE_SYSTEM;

        public Builder fuzzyMatchThreshold(double fuzzyMatchThreshold) {
            validateThreshold(fuzzyMatchThreshold, "fuzzyMatchThreshold");
            this.fuzzyMatchThreshold = fuzzyMatchThreshold;
            return this;
        }

        public Builder duplicateThreshold(double duplicateThreshold) {
            validateThreshold(duplicateThreshold, "duplicateThreshold");
            this.duplicateThreshold = duplicateThreshold;
            return this;
        }

        public Builder identifierMatchConfidence(double identifierMatchConfidence) {
            validateThreshold(identifierMatchConfidence, "identifierMatchConfidence");
            this.identifierMatchConfidence = identifierMatchConfidence;
            return this;
        }

        public Builder fuzzyScanLimit(int fuzzyScanLimit) {
            if (fuzzyScanLimit <= 0) {
                throw new IllegalArgumentException("fuzzyScanLimit must be positive");
            }
            this.fuzzyScanLimit = fuzzyScanLimit;
            return this;
        }

        public Builder duplicateScanLimit(int duplicateScanLimit) {
            if (duplicateScanLimit <= 0) {
                throw new IllegalArgumentException("duplicateScanLimit must be positive");
            }
            this.duplicateScanLimit = duplicateScanLimit;
            return this;
        }

        public Builder defaultImportance(int defaultImportance) {
            if (defaultImportance < 0) {
                throw new IllegalArgumentException("defaultImportance must not be negative");
            }
            this.defaultImportance = defaultImportance;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem must not be blank");
            }
            this.sourceSystem = sourceSystem;
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }

        private static void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "fuzzyMatchThreshold=" + fuzzyMatchThreshold +
                ", duplicateThreshold=" + duplicateThreshold +
                ", identifierMatchConfidence=" + identifierMatchConfidence +
                ", fuzzyScanLimit=" + fuzzyScanLimit +
                ", duplicateScanLimit=" + duplicateScanLimit +
                ", defaultImportance=" + defaultImportance +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
