package com.peerlink.relay.offline;

import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.support.InMemoryRedisService;
import com.peerlink.relay.support.MutableClock;
import com.peerlink.relay.support.RelayFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OfflineQueueServiceTest {
    private static final String BOB = "did:key:zBob";

    private InMemoryRedisService redis;
    private MutableClock clock;
    private OfflineQueueService queue;

    @BeforeEach
    void setUp() {
        RelayConfig config = new RelayFixture().config.toBuilder()
            .offlineMaxPerDid(3)
            .offlineTtlSec(3600)
            .build();
        redis = new InMemoryRedisService();
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        queue = new OfflineQueueService(redis, config, new MetricsService(new SimpleMeterRegistry(), config), clock);
    }

    @Test
    @DisplayName("Should hand out queued messages oldest first and remove them")
    void testDrainOrderAndRemoval() {
        Flux.range(1, 3)
            .concatMap(i -> queue.enqueue(BOB, "did:key:zAlice", "m" + i, i))
            .blockLast();

        StepVerifier.create(queue.drain(BOB).map(OfflineMessage::getPayload))
            .expectNext("m1", "m2", "m3")
            .verifyComplete();

        StepVerifier.create(queue.drain(BOB))
            .verifyComplete();
    }

    @Test
    @DisplayName("Should drop the oldest messages beyond the per-DID cap")
    void testCapDropsOldest() {
        Flux.range(1, 5)
            .concatMap(i -> queue.enqueue(BOB, "did:key:zAlice", "m" + i, i))
            .blockLast();

        StepVerifier.create(queue.drain(BOB).map(OfflineMessage::getPayload))
            .expectNext("m3", "m4", "m5")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should never hand out messages older than the TTL")
    void testExpiredMessagesAreNotDelivered() {
        // Given: one message queued two hours ago, one just now
        queue.enqueue(BOB, "did:key:zAlice", "old", 1).block();
        clock.advance(Duration.ofHours(2));
        queue.enqueue(BOB, "did:key:zAlice", "fresh", 2).block();

        // When / Then
        StepVerifier.create(queue.drain(BOB).map(OfflineMessage::getPayload))
            .expectNext("fresh")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should skip unreadable entries instead of failing the drain")
    void testUnreadableEntrySkipped() {
        redis.appendOffline(BOB, "{not json", 10, Duration.ofHours(1)).block();
        queue.enqueue(BOB, "did:key:zAlice", "ok", 1).block();

        StepVerifier.create(queue.drain(BOB).map(OfflineMessage::getPayload))
            .expectNext("ok")
            .verifyComplete();
    }

    @Test
    @DisplayName("Should keep the original id and timestamps when re-queueing")
    void testRequeuePreservesMessage() {
        OfflineMessage original = queue.enqueue(BOB, "did:key:zAlice", "again", 42).block();
        assertNotNull(original);
        queue.drain(BOB).blockLast();

        queue.enqueue(BOB, original).block();

        StepVerifier.create(queue.drain(BOB))
            .assertNext(message -> {
                assertEquals(original.getId(), message.getId());
                assertEquals(42, message.getTimestamp());
                assertEquals(original.getQueuedAt(), message.getQueuedAt());
            })
            .verifyComplete();
    }
}
