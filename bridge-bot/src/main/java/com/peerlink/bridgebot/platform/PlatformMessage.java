package com.peerlink.bridgebot.platform;

import lombok.Builder;
import lombok.Value;

import javax.annotation.Nullable;

/**
 * A chat message posted by a human in a platform guild channel.
 */
@Value
@Builder
public class PlatformMessage {
    String guildId;
    String discordChannelId;
    String discordMessageId;
    String discordUserId;
    String discordUsername;
    @Nullable
    String avatarUrl;
    String content;
}
