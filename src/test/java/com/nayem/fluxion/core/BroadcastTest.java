package com.nayem.fluxion.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BroadcastTest {

    private final DispatchToken a = new DispatchToken("ID_a");
    private final DispatchToken b = new DispatchToken("ID_b");
    private final DispatchToken c = new DispatchToken("ID_c");

    @Test
    void testBeginSnapshotsRegistrationOrder() {
        Broadcast<String> broadcast = new Broadcast<>("payload");
        broadcast.begin(List.of(a, b, c));

        assertEquals(List.of(a, b, c), broadcast.pendingSnapshot());
        assertEquals("payload", broadcast.payload());
        assertEquals(0, broadcast.openCount());
    }

    @Test
    void testPendingAmongKeepsRegistrationOrderNotRequestOrder() {
        Broadcast<String> broadcast = new Broadcast<>("payload");
        broadcast.begin(List.of(a, b, c));

        assertEquals(List.of(a, c), broadcast.pendingAmong(Set.of(c, a)));
    }

    @Test
    void testEnterAndExitMaintainOpenAndPendingSets() {
        Broadcast<String> broadcast = new Broadcast<>("payload");
        broadcast.begin(List.of(a, b));

        broadcast.enter(a);
        assertTrue(broadcast.isOpen(a));
        assertTrue(broadcast.isPending(a));
        assertEquals(a, broadcast.dispatchingToken());

        broadcast.exit(a);
        assertFalse(broadcast.isOpen(a));
        assertFalse(broadcast.isPending(a));
        assertEquals(1, broadcast.pendingCount());
    }

    @Test
    void testExitWithNullTokenIsIgnored() {
        Broadcast<String> broadcast = new Broadcast<>("payload");
        broadcast.begin(List.of(a));

        broadcast.exit(null);

        assertTrue(broadcast.isPending(a));
    }

    @Test
    void testBeginClearsStateOfEarlierCycle() {
        Broadcast<String> broadcast = new Broadcast<>("payload");
        broadcast.begin(List.of(a));
        broadcast.enter(a);

        broadcast.begin(List.of(b));

        assertFalse(broadcast.isOpen(a));
        assertEquals(List.of(b), broadcast.pendingSnapshot());
    }
}
