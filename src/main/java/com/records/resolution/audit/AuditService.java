package com.records.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of resolution decisions and merges.
 * Audit failures are logged and never interrupt the audited operation.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditEntry entry) {
        try {
            repository.save(entry);
            log.debug("audit.recorded action={} entityId={} actor={}",
                    entry.action(), entry.entityId(), entry.actorId());
        } catch (RuntimeException e) {
            log.warn("audit.failed action={} entityId={} error={}",
                    entry.action(), entry.entityId(), e.getMessage());
        }
        return entry;
    }

    public AuditEntry record(AuditAction action, String entityId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .entityId(entityId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String entityId, String actorId) {
        return record(action, entityId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return repository.findByEntityId(entityId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
