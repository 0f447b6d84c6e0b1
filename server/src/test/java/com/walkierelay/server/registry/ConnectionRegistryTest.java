package com.walkierelay.server.registry;

import com.walkierelay.server.exception.ErrorCode;
import com.walkierelay.server.exception.SignalingException;
import com.walkierelay.server.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry =
            new ConnectionRegistry(new MutableClock(Instant.parse("2026-01-01T00:00:00Z")));

    @Test
    void registerCreatesAnonymousRecord() {
        Connection c = registry.register("c1");

        assertEquals("c1", c.getConnectionId());
        assertNull(c.getUserId());
        assertNull(c.getCurrentChannel());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), c.getConnectedAt());
        assertSame(c, registry.lookup("c1").orElseThrow());
    }

    @Test
    void duplicateRegistrationFails() {
        registry.register("c1");
        assertThrows(IllegalStateException.class, () -> registry.register("c1"));
    }

    @Test
    void identityIndexFollowsSetAndRemove() {
        registry.register("c1");
        registry.setIdentity("c1", "alice");

        assertEquals("c1", registry.lookupByUserId("alice").orElseThrow().getConnectionId());

        registry.remove("c1");
        assertTrue(registry.lookupByUserId("alice").isEmpty());
        assertTrue(registry.lookup("c1").isEmpty());
    }

    @Test
    void sharedIdentityResolvesToEarliestHolderThenFallsBack() {
        registry.register("c1");
        registry.register("c2");
        registry.setIdentity("c1", "alice");
        registry.setIdentity("c2", "alice");

        assertEquals("c1", registry.lookupByUserId("alice").orElseThrow().getConnectionId());

        registry.remove("c1");
        assertEquals("c2", registry.lookupByUserId("alice").orElseThrow().getConnectionId());
    }

    @Test
    void setIdentityIsIdempotentButRejectsADifferentIdentity() {
        registry.register("c1");
        registry.setIdentity("c1", "alice");
        registry.setIdentity("c1", "alice");

        SignalingException e = assertThrows(SignalingException.class, () -> registry.setIdentity("c1", "bob"));
        assertEquals(ErrorCode.IDENTITY_CONFLICT, e.getCode());
        assertTrue(registry.lookupByUserId("bob").isEmpty());
    }

    @Test
    void requireMemberChecksIdentityThenChannel() {
        registry.register("c1");
        assertEquals(ErrorCode.IDENTITY_NOT_SET,
                assertThrows(SignalingException.class, () -> registry.requireMember("c1", "room1")).getCode());

        registry.setIdentity("c1", "alice");
        registry.setCurrentChannel("c1", "room1");
        assertEquals(ErrorCode.NOT_IN_CHANNEL,
                assertThrows(SignalingException.class, () -> registry.requireMember("c1", "room2")).getCode());
        assertEquals("alice", registry.requireMember("c1", "room1").getUserId());
    }

    @Test
    void removeUnknownIsNoOp() {
        assertTrue(registry.remove("nope").isEmpty());
        assertEquals(0, registry.size());
    }
}
