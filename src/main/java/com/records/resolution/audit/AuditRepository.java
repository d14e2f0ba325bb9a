package com.records.resolution.audit;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for audit entry persistence.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByEntityId(String entityId);

    List<AuditEntry> findByAction(AuditAction action);

    /**
     * Entries with {@code start <= timestamp <= end}.
     */
    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
