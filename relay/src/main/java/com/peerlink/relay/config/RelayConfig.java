package com.peerlink.relay.config;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * Configuration for a relay instance, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class RelayConfig {

    String relayId;
    int httpPort;
    String kafkaBootstrap;
    String redisUrl;

    /**
     * Root of the bridge config store; {@code null} keeps configs in memory only.
     */
    @Nullable
    String dataDir;

    boolean federationEnabled;
    int offlineMaxPerDid;
    long offlineTtlSec;
    int presenceTtlSec;
    int perConnBufferSize;
    int pingInterval;
    int idleTimeout;

    public static RelayConfig fromEnv() {
        return RelayConfig.builder()
                .relayId(getEnv("RELAY_ID", "relay-1"))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8080")))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .dataDir(System.getenv("DATA_DIR"))
                .federationEnabled(Boolean.parseBoolean(getEnv("FEDERATION_ENABLED", "true")))
                .offlineMaxPerDid(Integer.parseInt(getEnv("OFFLINE_MAX_PER_DID", "1000")))
                .offlineTtlSec(Long.parseLong(getEnv("OFFLINE_TTL_SEC", String.valueOf(7 * 24 * 3600))))
                .presenceTtlSec(Integer.parseInt(getEnv("PRESENCE_TTL_SEC", "120")))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "256")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "30")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "90")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
