package com.records.resolution.audit;

/**
 * Types of auditable actions in the resolution engine.
 */
public enum AuditAction {
    ENTITY_CREATED,
    ENTITY_MATCHED,
    ATTRIBUTES_MERGED,
    ATTRIBUTE_MERGE_FAILED,
    DUPLICATES_DETECTED,
    ENTITY_MERGED,
    ENTITY_MERGE_FAILED,
    RELATIONSHIP_CREATED,
    RELATIONSHIPS_REPOINTED,
    ENTITY_DELETED
}
