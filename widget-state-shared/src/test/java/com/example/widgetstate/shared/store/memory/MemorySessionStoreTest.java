package com.example.widgetstate.shared.store.memory;

import com.example.widgetstate.shared.config.PermissionPolicy;
import com.example.widgetstate.shared.model.UserSession;
import com.example.widgetstate.shared.store.PermissionResolver;
import com.example.widgetstate.shared.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemorySessionStoreTest {

    private static final Map<String, Set<String>> ROLES = Map.of(
            "admin", Set.of("read", "write", "admin"),
            "editor", Set.of("read", "write"),
            "viewer", Set.of("read"));

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));

    private MemorySessionStore store(PermissionPolicy policy, Duration defaultTtl) {
        return new MemorySessionStore(clock, defaultTtl, ROLES, new PermissionResolver(policy, Set.of("admin")));
    }

    @Test
    void createdSessionCarriesRolesAndExpiry() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));

        UserSession session = store.createSession("s1", "alice", Set.of("editor"), null, Map.of("tenant", "t1")).block();

        assertEquals("alice", session.getUserId());
        assertTrue(session.hasRole("editor"));
        assertEquals(clock.instant().plus(Duration.ofHours(1)), session.getExpiresAt().orElseThrow());
        assertEquals(Duration.ofHours(1), session.originalTtl().orElseThrow());
        assertEquals("t1", store.getSession("s1").block().getMetadata().get("tenant"));
    }

    @Test
    void oneSecondSessionExpiresOnItsOwn() throws InterruptedException {
        MemorySessionStore store = new MemorySessionStore(Clock.systemUTC(), Duration.ofHours(1), ROLES,
                new PermissionResolver(PermissionPolicy.UNION, Set.of("admin")));
        store.createSession("s1", "alice", Set.of("viewer"), Duration.ofSeconds(1), null).block();
        assertTrue(store.validateSession("s1").block());

        Thread.sleep(1100);

        assertFalse(store.validateSession("s1").block());
    }

    @Test
    void expiredSessionIsAbsentEverywhere() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("s1", "alice", Set.of("admin"), Duration.ofSeconds(1), null).block();
        assertTrue(store.validateSession("s1").block());

        clock.advance(Duration.ofSeconds(2));

        assertNull(store.getSession("s1").block());
        assertFalse(store.validateSession("s1").block());
        assertFalse(store.checkPermission("s1", "widget", "abc", "read").block());
        assertFalse(store.refreshSession("s1", null).block());
        assertTrue(store.listUserSessions("alice").collectList().block().isEmpty());
    }

    @Test
    void refreshExtendsByOriginalLifetime() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("s1", "alice", Set.of("viewer"), Duration.ofMinutes(10), null).block();

        clock.advance(Duration.ofMinutes(8));
        assertTrue(store.refreshSession("s1", null).block());
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), store.getSession("s1").block().getExpiresAt().orElseThrow());

        clock.advance(Duration.ofMinutes(8));
        assertTrue(store.refreshSession("s1", null).block());
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), store.getSession("s1").block().getExpiresAt().orElseThrow());
    }

    @Test
    void refreshWithExplicitExtension() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("s1", "alice", Set.of("viewer"), Duration.ofMinutes(10), null).block();

        assertTrue(store.refreshSession("s1", Duration.ofHours(2)).block());

        assertEquals(clock.instant().plus(Duration.ofHours(2)), store.getSession("s1").block().getExpiresAt().orElseThrow());
    }

    @Test
    void zeroTtlSessionNeverExpires() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ZERO);
        UserSession session = store.createSession("s1", "alice", Set.of("viewer"), null, null).block();

        clock.advance(Duration.ofDays(365));

        assertTrue(session.getExpiresAt().isEmpty());
        assertTrue(store.validateSession("s1").block());
        assertTrue(store.refreshSession("s1", null).block());
        assertTrue(store.getSession("s1").block().getExpiresAt().isEmpty());
    }

    @Test
    void negativeTtlIsRejected() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));

        assertThrows(IllegalArgumentException.class,
                () -> store.createSession("neg", "alice", Set.of("viewer"), Duration.ofSeconds(-30), null).block());

        clock.advance(Duration.ofDays(365));
        assertFalse(store.validateSession("neg").block());
    }

    @Test
    void listUserSessionsSkipsDeletedAndExpired() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("s1", "alice", Set.of("viewer"), Duration.ofMinutes(1), null).block();
        store.createSession("s2", "alice", Set.of("viewer"), null, null).block();
        store.createSession("s3", "alice", Set.of("viewer"), null, null).block();
        store.createSession("s4", "bob", Set.of("viewer"), null, null).block();

        assertTrue(store.deleteSession("s3").block());
        assertFalse(store.deleteSession("s3").block());
        clock.advance(Duration.ofMinutes(2));

        List<String> ids = store.listUserSessions("alice").map(UserSession::getSessionId).collectList().block();
        assertEquals(List.of("s2"), ids);
    }

    @Test
    void rolePermissionsDecideWithoutResourceGrants() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("viewer", "alice", Set.of("viewer"), null, null).block();
        store.createSession("editor", "bob", Set.of("editor"), null, null).block();

        assertTrue(store.checkPermission("viewer", "widget", "abc", "read").block());
        assertFalse(store.checkPermission("viewer", "widget", "abc", "write").block());
        assertTrue(store.checkPermission("editor", "widget", "abc", "write").block());
        assertFalse(store.checkPermission("missing", "widget", "abc", "read").block());
    }

    @Test
    void unionPolicyAddsResourceGrants() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        Map<String, Object> metadata = Map.of("permissions", Map.of("widget:abc", List.of("write")));
        store.createSession("s1", "alice", Set.of("viewer"), null, metadata).block();

        assertTrue(store.checkPermission("s1", "widget", "abc", "write").block());
        assertTrue(store.checkPermission("s1", "widget", "abc", "read").block());
        assertFalse(store.checkPermission("s1", "widget", "other", "write").block());
    }

    @Test
    void resourceOverridePolicyNarrowsNonSuperusers() {
        MemorySessionStore store = store(PermissionPolicy.RESOURCE_OVERRIDES_ROLE, Duration.ofHours(1));
        Map<String, Object> metadata = Map.of("permissions", Map.of("widget:abc", List.of("read")));
        store.createSession("editor", "alice", Set.of("editor"), null, metadata).block();
        store.createSession("admin", "root", Set.of("admin"), null, metadata).block();

        assertTrue(store.checkPermission("editor", "widget", "abc", "read").block());
        assertFalse(store.checkPermission("editor", "widget", "abc", "write").block());
        assertTrue(store.checkPermission("editor", "widget", "other", "write").block());
        assertTrue(store.checkPermission("admin", "widget", "abc", "write").block());
    }

    @Test
    void rolePermissionsCanBeReplaced() {
        MemorySessionStore store = store(PermissionPolicy.UNION, Duration.ofHours(1));
        store.createSession("s1", "alice", Set.of("viewer"), null, null).block();

        store.setRolePermissions("viewer", Set.of("read", "comment")).block();

        assertEquals(Set.of("read", "comment"), store.getRolePermissions("viewer").block());
        assertTrue(store.checkPermission("s1", "widget", "abc", "comment").block());
        assertEquals(Set.of(), store.getRolePermissions("ghost").block());
    }
}
