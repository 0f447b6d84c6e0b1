package com.walkierelay.server.presence;

import com.walkierelay.server.exception.SignalingException;
import com.walkierelay.server.support.RecordingTransport;
import com.walkierelay.server.support.RelayFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceBroadcasterTest {

    private RelayFixture f;
    private RecordingTransport transport;

    @BeforeEach
    void setUp() {
        f = new RelayFixture();
        transport = f.transport;
    }

    @Test
    void joinerGetsSnapshotOfOthersAndEachMemberOneNotification() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");
        f.connectAndJoin("c", "room1", "userC");
        transport.clear();

        f.connectAndJoin("d", "room1", "userD");

        assertEquals(List.of("userA", "userB", "userC"), transport.last("d", "channel-users").data);
        for (String member : List.of("a", "b", "c")) {
            List<RecordingTransport.Delivery> joined = transport.to(member, "user-joined");
            assertEquals(1, joined.size());
            assertEquals("userD", joined.get(0).data);
        }
        assertTrue(transport.to("d", "user-joined").isEmpty());
    }

    @Test
    void snapshotIsDeliveredBeforeLaterJoinNotifications() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");

        List<RecordingTransport.Delivery> toA = transport.to("a");
        assertEquals("channel-users", toA.get(0).event);
        assertEquals(List.of(), toA.get(0).data);
        assertEquals("user-joined", toA.get(1).event);
    }

    @Test
    void joinThenLeaveRemovesChannel() {
        f.connectAndJoin("a", "room1", "userA");

        f.presence.leave("a", "room1");

        assertTrue(f.channels.find("room1").isEmpty());
        assertEquals(0, f.channels.size());
        assertNull(f.connections.lookup("a").orElseThrow().getCurrentChannel());
        assertTrue(transport.room("room1").isEmpty());
    }

    @Test
    void leaveNotifiesRemainingMembers() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");

        f.presence.leave("b", "room1");

        assertEquals("userB", transport.last("a", "user-left").data);
        assertEquals(List.of("userA"), f.channels.listMembers("room1"));
    }

    @Test
    void leavingUnknownOrForeignChannelIsNoOp() {
        f.connectAndJoin("a", "room1", "userA");
        transport.clear();

        f.presence.leave("a", "ghost");
        f.presence.leave("nobody", "room1");

        assertTrue(transport.all().isEmpty());
        assertEquals("room1", f.connections.lookup("a").orElseThrow().getCurrentChannel());
    }

    @Test
    void disconnectLeavesAndIsIdempotent() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");
        transport.clear();

        f.presence.disconnect("b");
        f.presence.disconnect("b");

        assertEquals(1, transport.to("a", "user-left").size());
        assertEquals(1, f.channels.find("room1").orElseThrow().size());
        assertTrue(f.connections.lookup("b").isEmpty());
    }

    @Test
    void disconnectOfLastMemberDeletesChannel() {
        f.connectAndJoin("a", "room1", "userA");

        f.presence.disconnect("a");

        assertTrue(f.channels.find("room1").isEmpty());
        assertEquals(0, f.connections.size());
    }

    @Test
    void disconnectWithoutChannelJustUnregisters() {
        f.connections.register("a");

        f.presence.disconnect("a");

        assertEquals(0, f.connections.size());
        assertTrue(transport.all().isEmpty());
    }

    @Test
    void joiningAnotherChannelLeavesThePreviousOne() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");

        f.presence.join("a", "room2", "userA");

        assertEquals("userA", transport.last("b", "user-left").data);
        assertEquals(List.of("userB"), f.channels.listMembers("room1"));
        assertEquals(List.of("userA"), f.channels.listMembers("room2"));
        assertEquals("room2", f.connections.lookup("a").orElseThrow().getCurrentChannel());
        assertFalse(transport.room("room1").contains("a"));
    }

    @Test
    void rejoiningSameChannelResendsSnapshotWithoutDuplicateNotification() {
        f.connectAndJoin("a", "room1", "userA");
        f.connectAndJoin("b", "room1", "userB");
        transport.clear();

        f.presence.join("b", "room1", "userB");

        assertEquals(List.of("userA"), transport.last("b", "channel-users").data);
        assertTrue(transport.to("a", "user-joined").isEmpty());
        assertEquals(2, f.channels.find("room1").orElseThrow().size());
    }

    @Test
    void joiningUnderADifferentIdentityIsRejected() {
        f.connectAndJoin("a", "room1", "userA");

        assertThrows(SignalingException.class, () -> f.presence.join("a", "room1", "impostor"));
        assertEquals(List.of("userA"), f.channels.listMembers("room1"));
    }

    @Test
    void interleavedJoinsSeeEachOther() {
        f.connections.register("a");
        f.connections.register("b");
        f.presence.join("a", "room1", "userA");
        f.presence.join("b", "room1", "userB");

        f.presence.channelUsers("a", "room1");
        f.presence.channelUsers("b", "room1");

        assertEquals(2, f.channels.find("room1").orElseThrow().size());
        assertEquals(List.of("userA", "userB"), transport.last("a", "channel-users").data);
        assertEquals(List.of("userA", "userB"), transport.last("b", "channel-users").data);
    }

    @Test
    void channelUsersForUnknownChannelIsEmptyList() {
        f.connections.register("a");

        f.presence.channelUsers("a", "ghost");

        assertEquals(List.of(), transport.last("a", "channel-users").data);
    }
}
