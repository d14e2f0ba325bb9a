package com.records.resolution.audit;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of AuditRepository, thread-safe via CopyOnWriteArrayList.
 * This is the default when no repository is configured.
 */
public class InMemoryAuditRepository implements AuditRepository {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public AuditEntry save(AuditEntry entry) {
        entries.add(entry);
        return entry;
    }

    @Override
    public List<AuditEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public List<AuditEntry> findByEntityId(String entityId) {
        return entries.stream()
                .filter(e -> entityId.equals(e.entityId()))
                .toList();
    }

    @Override
    public List<AuditEntry> findByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    @Override
    public List<AuditEntry> findBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    @Override
    public int count() {
        return entries.size();
    }
}
