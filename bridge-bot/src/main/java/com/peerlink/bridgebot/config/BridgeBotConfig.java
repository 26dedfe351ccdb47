package com.peerlink.bridgebot.config;

import com.peerlink.client.relay.RelayConnectionOptions;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the bridge bot process, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class BridgeBotConfig {

    @ToString.Exclude
    String discordBotToken;

    /**
     * Relay WebSocket endpoint.
     */
    String relayUrl;

    /**
     * Relay REST base URL, serving {@code /api/bridge/*}.
     */
    String relayApiUrl;

    /**
     * Shared, read-only data directory of the relay deployment.
     */
    @Nullable
    String dataDir;

    /**
     * Writable directory holding {@code bridge-identity.json}.
     */
    String bridgeDataDir;

    Duration configPollInterval;
    Duration keepaliveInterval;
    Duration maxReconnectDelay;

    String discordApiUrl;
    String discordGatewayUrl;

    public static BridgeBotConfig fromEnv() {
        return fromMap(System.getenv());
    }

    /**
     * @throws IllegalStateException if {@code DISCORD_BOT_TOKEN} is missing
     */
    static BridgeBotConfig fromMap(Map<String, String> env) {
        String token = env.get("DISCORD_BOT_TOKEN");
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("DISCORD_BOT_TOKEN is required");
        }

        String dataDir = env.get("DATA_DIR");
        return BridgeBotConfig.builder()
                .discordBotToken(token)
                .relayUrl(getEnv(env, "RELAY_URL", "ws://localhost:8080/ws"))
                .relayApiUrl(getEnv(env, "RELAY_API_URL", "http://localhost:8080"))
                .dataDir(dataDir)
                .bridgeDataDir(getEnv(env, "BRIDGE_DATA_DIR", dataDir != null ? dataDir : "./data"))
                .configPollInterval(Duration.ofMillis(Long.parseLong(getEnv(env, "CONFIG_POLL_INTERVAL", "30000"))))
                .keepaliveInterval(Duration.ofMillis(Long.parseLong(getEnv(env, "KEEPALIVE_INTERVAL", "30000"))))
                .maxReconnectDelay(Duration.ofMillis(Long.parseLong(getEnv(env, "MAX_RECONNECT_DELAY", "30000"))))
                .discordApiUrl(getEnv(env, "DISCORD_API_URL", "https://discord.com/api/v10"))
                .discordGatewayUrl(getEnv(env, "DISCORD_GATEWAY_URL", "wss://gateway.discord.gg/?v=10&encoding=json"))
                .build();
    }

    public RelayConnectionOptions relayConnectionOptions(String did) {
        return RelayConnectionOptions.builder()
                .url(relayUrl)
                .did(did)
                .keepaliveInterval(keepaliveInterval)
                .maxReconnectDelay(maxReconnectDelay)
                .build();
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env.get(key);
        return value != null ? value : defaultValue;
    }
}
