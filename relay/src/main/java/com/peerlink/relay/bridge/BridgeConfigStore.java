package com.peerlink.relay.bridge;

import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * File-backed bridge config store with an in-memory cache.
 * <p>
 * Each config lives in {@code {dataDir}/bridges/{communityId}.json} and is written atomically
 * (temp file, then move). Without a data dir the store is memory-only.
 * </p>
 */
public class BridgeConfigStore {
    private static final Logger log = LoggerFactory.getLogger(BridgeConfigStore.class);

    private static final String TMP_SUFFIX = ".json.tmp";

    private final Map<String, BridgeConfig> configs = new ConcurrentHashMap<>();
    @Nullable
    private final Path bridgesDir;
    private final Clock clock;

    public BridgeConfigStore(@Nullable Path dataDir) {
        this(dataDir, Clock.systemUTC());
    }

    public BridgeConfigStore(@Nullable Path dataDir, Clock clock) {
        this.bridgesDir = dataDir == null ? null : dataDir.resolve("bridges");
        this.clock = clock;
    }

    /**
     * Loads every config file. Unreadable files are skipped with a warning.
     *
     * @return number of configs loaded
     */
    public int loadFromDisk() {
        if (bridgesDir == null) {
            log.info("No data dir configured, bridge configs are kept in memory only");
            return 0;
        }
        if (!Files.isDirectory(bridgesDir)) {
            log.info("No bridges directory at {}, starting fresh", bridgesDir);
            return 0;
        }

        int count = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(bridgesDir, "*.json")) {
            for (Path file : files) {
                try {
                    BridgeConfig config = JsonUtils.readValue(Files.readString(file, StandardCharsets.UTF_8), BridgeConfig.class);
                    configs.put(config.getCommunityId(), config);
                    count++;
                    log.info("Loaded bridge config {} (guild {}, enabled={}, channels={})",
                        config.getCommunityId(), config.getGuildId(), config.isEnabled(), config.getChannels().size());
                } catch (IOException | JsonCodecException e) {
                    log.warn("Skipping unreadable bridge config {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list bridges directory {}", bridgesDir, e);
        }

        log.info("{} bridge configs loaded from disk", count);
        return count;
    }

    /**
     * Creates or replaces a config. On replace, {@code createdAt} of the existing config is kept.
     */
    public BridgeConfig register(BridgeConfig config) {
        long now = clock.millis();
        BridgeConfig stored = configs.compute(config.getCommunityId(), (id, existing) -> config.toBuilder()
            .createdAt(existing != null ? existing.getCreatedAt() : now)
            .updatedAt(now)
            .build());

        log.info("Registered bridge config {} (guild {}, channels={}, seats={}, members={})",
            stored.getCommunityId(), stored.getGuildId(),
            stored.getChannels().size(), stored.getSeats().size(), stored.getMemberDids().size());
        persist(stored);
        return stored;
    }

    public Optional<BridgeConfig> get(String communityId) {
        return Optional.ofNullable(configs.get(communityId));
    }

    public List<BridgeConfigSummary> list() {
        return configs.values().stream()
            .map(BridgeConfigSummary::of)
            .collect(Collectors.toList());
    }

    public boolean delete(String communityId) {
        boolean removed = configs.remove(communityId) != null;
        if (removed) {
            removeFile(communityId);
            log.info("Bridge config {} deleted", communityId);
        }
        return removed;
    }

    public Optional<BridgeConfig> updateMembers(String communityId, List<String> memberDids) {
        return update(communityId, config -> config.withMemberDids(List.copyOf(memberDids)))
            .map(updated -> {
                log.info("Updated member list of {} ({} members)", communityId, updated.getMemberDids().size());
                return updated;
            });
    }

    public Optional<BridgeConfig> setEnabled(String communityId, boolean enabled) {
        return update(communityId, config -> config.withEnabled(enabled))
            .map(updated -> {
                log.info("Bridge {} {}", communityId, enabled ? "enabled" : "disabled");
                return updated;
            });
    }

    /**
     * Community IDs double as file names, so they must not contain path separators.
     */
    public static boolean isValidCommunityId(@Nullable String communityId) {
        return communityId != null && !communityId.isBlank()
            && communityId.indexOf('/') < 0 && communityId.indexOf('\\') < 0
            && !communityId.startsWith(".");
    }

    public int count() {
        return configs.size();
    }

    public long enabledCount() {
        return configs.values().stream().filter(BridgeConfig::isEnabled).count();
    }

    private Optional<BridgeConfig> update(String communityId, UnaryOperator<BridgeConfig> change) {
        long now = clock.millis();
        BridgeConfig updated = configs.computeIfPresent(communityId,
            (id, existing) -> change.apply(existing).withUpdatedAt(now));
        if (updated != null) {
            persist(updated);
        }
        return Optional.ofNullable(updated);
    }

    private void persist(BridgeConfig config) {
        if (bridgesDir == null) {
            return;
        }
        Path file = fileFor(config.getCommunityId());
        Path tmp = bridgesDir.resolve(config.getCommunityId() + TMP_SUFFIX);
        try {
            Files.createDirectories(bridgesDir);
            Files.writeString(tmp, JsonUtils.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(config),
                StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            // The in-memory copy stays authoritative until the next successful write
            log.error("Failed to persist bridge config {} to {}", config.getCommunityId(), file, e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                log.warn("Failed to remove temp file {}", tmp, cleanup);
            }
        }
    }

    private void removeFile(String communityId) {
        if (bridgesDir == null) {
            return;
        }
        Path file = fileFor(communityId);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Failed to remove bridge config file {}", file, e);
        }
    }

    private Path fileFor(String communityId) {
        return bridgesDir.resolve(communityId + ".json");
    }
}
