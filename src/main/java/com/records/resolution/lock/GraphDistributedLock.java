package com.records.resolution.lock;

import com.records.resolution.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * FalkorDB MERGE-based advisory lock for resolvers running in several JVMs.
 *
 * <p>Uses a {@code :ResolutionLock} node per key with atomic MERGE for check-and-set semantics.
 * The owner is this lock instance plus the calling thread, so threads sharing one instance
 * still exclude each other. Locks whose TTL has passed are reclaimed.</p>
 */
public class GraphDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(GraphDistributedLock.class);

    private final GraphConnection connection;
    private final LockConfig config;
    private final Clock clock;
    private final String instanceId;

    public GraphDistributedLock(GraphConnection connection) {
        this(connection, LockConfig.defaults());
    }

    public GraphDistributedLock(GraphConnection connection, LockConfig config) {
        this(connection, config, Clock.systemUTC());
    }

    GraphDistributedLock(GraphConnection connection, LockConfig config, Clock clock) {
        this.connection = connection;
        this.config = config;
        this.clock = clock;
        this.instanceId = ProcessHandle.current().pid() + "-" + UUID.randomUUID();
        createLockIndex();
    }

    @Override
    public boolean tryLock(String key) {
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attemptLock(key)) {
                log.debug("Lock acquired: {} (attempt {})", key, attempt + 1);
                return true;
            }

            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException(key, "Interrupted while acquiring lock for: " + key, e);
                }
            }
        }

        throw new LockAcquisitionException(key,
                "Failed to acquire lock for key '" + key + "' after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        String query = """
                MATCH (l:ResolutionLock {key: $key, owner: $owner})
                DELETE l
                """;
        try {
            connection.execute(query, Map.of("key", key, "owner", currentOwner()));
            log.debug("Lock released: {}", key);
        } catch (Exception e) {
            // The TTL reclaims the node if this delete never lands
            log.warn("Failed to release lock {}: {}", key, e.getMessage());
        }
    }

    String currentOwner() {
        return instanceId + "-" + Thread.currentThread().getId();
    }

    private boolean attemptLock(String key) {
        long now = clock.millis();
        long expiresAt = now + config.lockTtlSeconds() * 1000L;
        String owner = currentOwner();

        // Times are epoch millis so expiry comparison is numeric
        String query = """
                MERGE (l:ResolutionLock {key: $key})
                ON CREATE SET l.owner = $owner, l.acquiredAt = $now, l.expiresAt = $expiresAt
                ON MATCH SET l.owner = CASE
                    WHEN l.expiresAt < $now THEN $owner
                    ELSE l.owner
                END,
                l.acquiredAt = CASE
                    WHEN l.expiresAt < $now THEN $now
                    ELSE l.acquiredAt
                END,
                l.expiresAt = CASE
                    WHEN l.expiresAt < $now THEN $expiresAt
                    ELSE l.expiresAt
                END
                RETURN l.owner AS owner
                """;

        try {
            List<Map<String, Object>> results = connection.query(query, Map.of(
                    "key", key,
                    "owner", owner,
                    "now", now,
                    "expiresAt", expiresAt
            ));
            return !results.isEmpty() && owner.equals(results.get(0).get("owner"));
        } catch (Exception e) {
            log.warn("Lock acquisition attempt failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    private void createLockIndex() {
        try {
            connection.execute("CREATE INDEX FOR (l:ResolutionLock) ON (l.key)");
        } catch (Exception e) {
            log.debug("Lock index creation: {}", e.getMessage());
        }
    }
}
