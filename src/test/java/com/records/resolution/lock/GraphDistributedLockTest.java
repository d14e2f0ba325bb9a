package com.records.resolution.lock;

import com.records.resolution.graph.GraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

class GraphDistributedLockTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private GraphConnection connection;
    private GraphDistributedLock lock;

    @BeforeEach
    void setUp() {
        connection = mock(GraphConnection.class);
        lock = new GraphDistributedLock(connection, new LockConfig(1000, 2, 1, 30),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should create the lock index on construction")
    void testCreatesIndex() {
        verify(connection).execute("CREATE INDEX FOR (l:ResolutionLock) ON (l.key)");
    }

    @Test
    @DisplayName("Should acquire when the merged node names this owner")
    @SuppressWarnings("unchecked")
    void testAcquire() {
        when(connection.query(anyString(), anyMap())).thenAnswer(invocation -> {
            Map<String, Object> params = invocation.getArgument(1);
            return List.of(Map.of("owner", params.get("owner")));
        });

        assertTrue(lock.tryLock("jane smith"));

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).query(contains("MERGE (l:ResolutionLock {key: $key})"), params.capture());
        assertEquals("jane smith", params.getValue().get("key"));
        assertEquals(NOW.toEpochMilli(), params.getValue().get("now"));
        assertEquals(NOW.toEpochMilli() + 30_000L, params.getValue().get("expiresAt"));
        assertEquals(lock.currentOwner(), params.getValue().get("owner"));
    }

    @Test
    @DisplayName("Should retry and then fail while another owner holds the key")
    void testHeldElsewhere() {
        when(connection.query(anyString(), anyMap())).thenReturn(List.of(Map.of("owner", "someone-else")));

        LockAcquisitionException e = assertThrows(LockAcquisitionException.class,
                () -> lock.tryLock("jane smith"));

        assertEquals("jane smith", e.getKey());
        verify(connection, times(3)).query(anyString(), anyMap());
    }

    @Test
    @DisplayName("A failed attempt is retried")
    @SuppressWarnings("unchecked")
    void testRetryAfterError() {
        when(connection.query(anyString(), anyMap()))
                .thenThrow(new RuntimeException("timeout"))
                .thenAnswer(invocation -> {
                    Map<String, Object> params = invocation.getArgument(1);
                    return List.of(Map.of("owner", params.get("owner")));
                });

        assertTrue(lock.tryLock("acme"));
        verify(connection, times(2)).query(anyString(), anyMap());
    }

    @Test
    @DisplayName("Unlock deletes only this owner's node and tolerates failures")
    @SuppressWarnings("unchecked")
    void testUnlock() {
        lock.unlock("acme");

        ArgumentCaptor<Map<String, Object>> params = ArgumentCaptor.forClass(Map.class);
        verify(connection).execute(contains("DELETE l"), params.capture());
        assertEquals(Map.of("key", "acme", "owner", lock.currentOwner()), params.getValue());

        doThrow(new RuntimeException("down")).when(connection).execute(contains("DELETE l"), anyMap());
        assertDoesNotThrow(() -> lock.unlock("acme"));
    }

    @Test
    @DisplayName("Owner ids differ between threads")
    void testOwnerPerThread() throws Exception {
        String mine = lock.currentOwner();
        String[] other = new String[1];
        Thread thread = new Thread(() -> other[0] = lock.currentOwner());
        thread.start();
        thread.join();
        assertNotEquals(mine, other[0]);
    }
}
