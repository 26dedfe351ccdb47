package com.peerlink.bridgebot.controller;

import com.peerlink.bridgebot.relay.IRelayApiClient;
import com.peerlink.bridgebot.relay.RelayApiException;
import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.model.RegisterBridgeRequest;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Relay bridge API backed by a map. Writes bump {@code updatedAt} like the real relay does.
 */
class ScriptedRelayApi implements IRelayApiClient {
    final Map<String, BridgeConfig> configs = new LinkedHashMap<>();
    final Set<String> failingGets = new HashSet<>();
    final List<RegisterBridgeRequest> registrations = new ArrayList<>();
    final List<List<String>> memberUpdates = new ArrayList<>();
    boolean failList;
    int listCalls;
    int getCalls;

    void put(BridgeConfig config) {
        configs.put(config.getCommunityId(), config);
    }

    @Override
    public Mono<List<BridgeConfigSummary>> listBridges() {
        return Mono.defer(() -> {
            listCalls++;
            if (failList) {
                return Mono.error(new RelayApiException(503, "relay unavailable"));
            }
            return Mono.just(configs.values().stream().map(BridgeConfigSummary::of).collect(Collectors.toList()));
        });
    }

    @Override
    public Mono<BridgeConfig> getBridge(String communityId) {
        return Mono.defer(() -> {
            getCalls++;
            if (failingGets.contains(communityId)) {
                return Mono.error(new RelayApiException(500, "corrupt config"));
            }
            return Mono.justOrEmpty(configs.get(communityId));
        });
    }

    @Override
    public Mono<BridgeConfig> registerBridge(RegisterBridgeRequest request) {
        return Mono.fromSupplier(() -> {
            registrations.add(request);
            BridgeConfig current = configs.get(request.getCommunityId());
            BridgeConfig updated = current.toBuilder()
                .bridgeDid(request.getBridgeDid())
                .updatedAt(current.getUpdatedAt() + 1)
                .build();
            put(updated);
            return updated;
        });
    }

    @Override
    public Mono<BridgeConfig> updateMembers(String communityId, List<String> memberDids) {
        return Mono.fromSupplier(() -> {
            memberUpdates.add(List.copyOf(memberDids));
            BridgeConfig current = configs.get(communityId);
            BridgeConfig updated = current.toBuilder()
                .memberDids(List.copyOf(memberDids))
                .updatedAt(current.getUpdatedAt() + 1)
                .build();
            put(updated);
            return updated;
        });
    }
}
