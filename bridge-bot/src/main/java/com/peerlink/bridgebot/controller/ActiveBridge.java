package com.peerlink.bridgebot.controller;

import com.peerlink.bridgebot.bridge.ChannelMap;
import com.peerlink.bridgebot.bridge.SeatResolver;
import com.peerlink.core.model.BridgeConfig;
import lombok.Value;

/**
 * One loaded bridge: the config and the lookup tables built from it.
 * <p>
 * Replaced as a whole on reload, never mutated.
 * </p>
 */
@Value
public class ActiveBridge {
    BridgeConfig config;
    ChannelMap channelMap;
    SeatResolver seatResolver;

    public static ActiveBridge of(BridgeConfig config, String bridgeDid) {
        return new ActiveBridge(
            config,
            ChannelMap.load(config.getChannels()),
            SeatResolver.load(bridgeDid, config.getSeats()));
    }
}
