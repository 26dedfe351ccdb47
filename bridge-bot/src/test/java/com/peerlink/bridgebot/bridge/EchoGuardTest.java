package com.peerlink.bridgebot.bridge;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EchoGuardTest {
    private static final String BRIDGE_DID = "did:key:zBridge";
    private static final String ALICE_DID = "did:key:zAlice";

    private VirtualTimeScheduler scheduler;
    private EchoGuard guard;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        guard = new EchoGuard(scheduler);
        guard.setBridgeDid(BRIDGE_DID);
    }

    @AfterEach
    void tearDown() {
        guard.destroy();
        scheduler.dispose();
    }

    // ========== Filtering ==========

    @Test
    @DisplayName("Messages authored by the bridge are never bridged back")
    void testOwnMessagesBlocked() {
        assertFalse(guard.shouldBridgeToDiscord(BRIDGE_DID, "m-1"));
        assertFalse(guard.shouldBridgeToDiscord(BRIDGE_DID, "m-never-seen"));
    }

    @Test
    @DisplayName("A recorded message ID is blocked, others pass")
    void testRecordedIdBlocked() {
        assertTrue(guard.shouldBridgeToDiscord(ALICE_DID, "m-1"));

        guard.recordBridged("m-1");

        assertFalse(guard.shouldBridgeToDiscord(ALICE_DID, "m-1"));
        assertTrue(guard.shouldBridgeToDiscord(ALICE_DID, "m-2"));
        assertTrue(guard.wasBridged("m-1"));
    }

    // ========== Periodic Clear ==========

    @Test
    @DisplayName("The recent set is cleared wholesale every five minutes")
    void testPeriodicClear() {
        guard.start();
        guard.recordBridged("m-1");

        scheduler.advanceTimeBy(Duration.ofMinutes(4));
        assertTrue(guard.wasBridged("m-1"));

        scheduler.advanceTimeBy(Duration.ofMinutes(1));
        assertFalse(guard.wasBridged("m-1"));
        assertTrue(guard.shouldBridgeToDiscord(ALICE_DID, "m-1"));
    }

    @Test
    @DisplayName("No clear happens after destroy")
    void testDestroyStopsTimer() {
        guard.start();
        guard.destroy();
        guard.recordBridged("m-1");

        scheduler.advanceTimeBy(EchoGuard.CLEAR_INTERVAL.multipliedBy(3));

        assertTrue(guard.wasBridged("m-1"));
    }
}
