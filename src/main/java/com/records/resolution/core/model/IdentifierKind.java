package com.records.resolution.core.model;

import java.util.List;

/**
 * Registry identifiers a source may attach to a candidate.
 * Strong identifiers are used for matching; the others are only carried into attributes.
 */
public enum IdentifierKind {
    EIN("ein", true),
    CIK("cik", true),
    FEC_ID("fecId", true),
    DUNS("duns", false),
    UEI("uei", false);

    private static final List<IdentifierKind> MATCH_ORDER = List.of(EIN, CIK, FEC_ID);

    private final String attributeKey;
    private final boolean strong;

    IdentifierKind(String attributeKey, boolean strong) {
        this.attributeKey = attributeKey;
        this.strong = strong;
    }

    /**
     * Key under which the identifier is stored in entity attributes.
     */
    public String getAttributeKey() {
        return attributeKey;
    }

    public boolean isStrong() {
        return strong;
    }

    /**
     * Strong identifiers in the order the resolution cascade consults them.
     */
    public static List<IdentifierKind> matchOrder() {
        return MATCH_ORDER;
    }
}
