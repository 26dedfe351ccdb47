package com.peerlink.relay.offline;

import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import com.peerlink.relay.config.RelayConfig;
import com.peerlink.relay.metrics.MetricsService;
import com.peerlink.relay.redis.IRedisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Per-DID offline queue on top of Redis streams.
 * <p>
 * Each DID keeps at most {@code offlineMaxPerDid} messages; appending beyond that drops the
 * oldest. Messages older than {@code offlineTtlSec} are never handed out.
 * </p>
 */
public class OfflineQueueService {
    private static final Logger log = LoggerFactory.getLogger(OfflineQueueService.class);

    private final IRedisService redisService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final int maxPerDid;
    private final Duration ttl;

    public OfflineQueueService(IRedisService redisService, RelayConfig config, MetricsService metricsService) {
        this(redisService, config, metricsService, Clock.systemUTC());
    }

    public OfflineQueueService(IRedisService redisService, RelayConfig config, MetricsService metricsService, Clock clock) {
        this.redisService = redisService;
        this.metricsService = metricsService;
        this.clock = clock;
        this.maxPerDid = config.getOfflineMaxPerDid();
        this.ttl = Duration.ofSeconds(config.getOfflineTtlSec());
    }

    public Mono<OfflineMessage> enqueue(String toDid, String fromDid, String payload, long timestamp) {
        OfflineMessage message = OfflineMessage.builder()
            .id(UUID.randomUUID().toString())
            .fromDid(fromDid)
            .payload(payload)
            .timestamp(timestamp)
            .queuedAt(clock.millis())
            .build();
        return enqueue(toDid, message);
    }

    /**
     * Puts an already-built message (back) into the queue, e.g. one drained for a socket that
     * went away before it could take it.
     */
    public Mono<OfflineMessage> enqueue(String toDid, OfflineMessage message) {
        return Mono.defer(() -> redisService.appendOffline(toDid, JsonUtils.writeValueAsString(message), maxPerDid, ttl))
            .doOnSuccess(v -> {
                metricsService.recordOfflineEnqueued();
                log.debug("Queued message {} from {} for {}", message.getId(), message.getFromDid(), toDid);
            })
            .thenReturn(message);
    }

    /**
     * Returns and removes everything queued for {@code did}, oldest first.
     */
    public Flux<OfflineMessage> drain(String did) {
        long oldestAllowed = clock.millis() - ttl.toMillis();
        return redisService.drainOffline(did, maxPerDid, ttl)
            .concatMap(json -> {
                try {
                    return Mono.just(JsonUtils.readValue(json, OfflineMessage.class));
                } catch (JsonCodecException e) {
                    log.warn("Skipping unreadable offline entry for {}: {}", did, e.getMessage());
                    return Mono.empty();
                }
            })
            .filter(message -> message.getQueuedAt() >= oldestAllowed);
    }
}
