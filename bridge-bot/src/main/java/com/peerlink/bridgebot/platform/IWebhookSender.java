package com.peerlink.bridgebot.platform;

import reactor.core.publisher.Mono;

import javax.annotation.Nullable;

/**
 * Outbound side of the chat platform: posts under a chosen name and avatar.
 */
public interface IWebhookSender {

    Mono<Void> sendAsUser(String channelId, String content, String displayName, @Nullable String avatarUrl);

    /**
     * Forgets the cached webhook of a channel so the next send looks it up again.
     */
    void invalidate(String channelId);
}
