package com.peerlink.bridgebot.platform;

import reactor.core.publisher.Mono;

import java.util.function.Consumer;

/**
 * Inbound side of the chat platform.
 * <p>
 * Implementations drop messages from bots (layer 1) and from the bridge's own webhooks
 * (layer 2) before {@link #onMessage} handlers see them.
 * </p>
 */
public interface IPlatformClient {

    /**
     * Connects and completes once the platform session is ready.
     */
    Mono<Void> login();

    void onMessage(Consumer<PlatformMessage> handler);

    /**
     * Messages from this webhook are never reported to {@link #onMessage} handlers.
     */
    void registerOwnWebhook(String webhookId);

    Mono<Void> destroy();
}
