package com.peerlink.relay.redis;

import com.peerlink.core.redis.Keys;
import com.peerlink.relay.config.RelayConfig;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XTrimArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Reactive Redis service for presence and offline queues.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API.
 * </p>
 */
public class RedisService implements IRedisService {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private static final String FIELD_RELAY_ID = "relayId";
    private static final String FIELD_LAST_SEEN = "lastSeen";
    private static final String FIELD_MSG = "msg";

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;
    private final RelayConfig config;

    public RedisService(RelayConfig config) {
        this.config = config;
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    @Override
    public Mono<Void> savePresence(String did, String relayId) {
        String key = Keys.sess(did);
        Map<String, String> presence = new HashMap<>();
        presence.put(FIELD_RELAY_ID, relayId);
        presence.put(FIELD_LAST_SEEN, String.valueOf(System.currentTimeMillis()));

        return commands.hset(key, presence)
            .then(commands.expire(key, config.getPresenceTtlSec()))
            .then()
            .doOnError(err -> log.error("Failed to save presence for {}", did, err));
    }

    @Override
    public Mono<String> getPresenceRelayId(String did) {
        return commands.hget(Keys.sess(did), FIELD_RELAY_ID)
            .doOnError(err -> log.error("Failed to read presence for {}", did, err));
    }

    @Override
    public Mono<Void> deletePresence(String did, String relayId) {
        String key = Keys.sess(did);
        return commands.hget(key, FIELD_RELAY_ID)
            .filter(relayId::equals)
            .flatMap(owner -> commands.del(key))
            .then()
            .doOnError(err -> log.error("Failed to delete presence for {}", did, err));
    }

    /**
     * Appends with XADD MAXLEN (exact, so the cap is a hard bound) and then trims by MINID, since
     * stream IDs start with the append time in millis.
     */
    @Override
    public Mono<Void> appendOffline(String did, String json, int maxLen, Duration ttl) {
        String streamKey = Keys.offline(did);
        String minId = minIdFor(ttl);

        XAddArgs args = XAddArgs.Builder.maxlen(maxLen);

        return commands.xadd(streamKey, args, Map.of(FIELD_MSG, json))
            .then(commands.xtrim(streamKey, XTrimArgs.Builder.minId(minId)))
            .then(commands.expire(streamKey, ttl.getSeconds()))
            .then()
            .doOnSuccess(v -> log.debug("Queued offline message for {}", did))
            .doOnError(err -> log.error("Failed to append offline message for {}", did, err));
    }

    /**
     * Reads with XRANGE from the TTL boundary and deletes exactly the IDs that were read. Entries
     * appended between the two calls stay in the stream for the next drain.
     */
    @Override
    public Flux<String> drainOffline(String did, int maxCount, Duration ttl) {
        String streamKey = Keys.offline(did);
        String minId = minIdFor(ttl);

        return commands.xrange(streamKey, Range.<String>unbounded().gte(minId), Limit.from(maxCount))
            .collectList()
            .flatMapMany(messages -> {
                if (messages.isEmpty()) {
                    return Flux.empty();
                }

                String[] messageIds = messages.stream()
                    .map(StreamMessage::getId)
                    .toArray(String[]::new);

                return commands.xdel(streamKey, messageIds)
                    .thenMany(Flux.fromIterable(messages))
                    .mapNotNull(message -> message.getBody().get(FIELD_MSG));
            })
            .doOnError(err -> log.error("Failed to drain offline messages for {}", did, err));
    }

    private static String minIdFor(Duration ttl) {
        // Redis Stream ID format: <timestamp>-<sequence>
        return (System.currentTimeMillis() - ttl.toMillis()) + "-0";
    }

    @Override
    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
