package com.peerlink.bridgebot.relay;

import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.model.RegisterBridgeRequest;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Client of the relay's {@code /api/bridge} endpoints.
 */
public interface IRelayApiClient {

    Mono<List<BridgeConfigSummary>> listBridges();

    /**
     * @return the config, or empty if the relay does not know the community
     */
    Mono<BridgeConfig> getBridge(String communityId);

    Mono<BridgeConfig> registerBridge(RegisterBridgeRequest request);

    Mono<BridgeConfig> updateMembers(String communityId, List<String> memberDids);
}
