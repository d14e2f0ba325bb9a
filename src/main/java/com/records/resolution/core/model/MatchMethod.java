package com.records.resolution.core.model;

/**
 * How a candidate was resolved to an entity.
 */
public enum MatchMethod {
    EXACT,
    IDENTIFIER,
    FUZZY,
    NEW
}
