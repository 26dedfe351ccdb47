package com.peerlink.bridgebot.platform.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.peerlink.bridgebot.platform.IWebhookSender;
import com.peerlink.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Posts bridged messages through one webhook per channel, created on first use.
 */
public class DiscordWebhookManager implements IWebhookSender {
    private static final Logger log = LoggerFactory.getLogger(DiscordWebhookManager.class);

    static final String WEBHOOK_NAME = "Umbra Bridge";
    private static final int MAX_USERNAME_LENGTH = 80;

    private final HttpClient httpClient;
    private final Consumer<String> ownWebhookRegistry;
    private final Map<String, Webhook> webhooks = new ConcurrentHashMap<>();

    /**
     * @param ownWebhookRegistry told about every webhook this manager uses, so the gateway can
     *                           ignore messages it posted
     */
    public DiscordWebhookManager(String apiUrl, String botToken, Consumer<String> ownWebhookRegistry) {
        this.httpClient = HttpClient.create()
                .baseUrl(apiUrl)
                .headers(h -> h
                        .set(HttpHeaderNames.AUTHORIZATION, "Bot " + botToken)
                        .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                        .set(HttpHeaderNames.USER_AGENT, "DiscordBot (peerlink, 1.0)"))
                .responseTimeout(Duration.ofSeconds(15));
        this.ownWebhookRegistry = ownWebhookRegistry;
    }

    @Override
    public Mono<Void> sendAsUser(String channelId, String content, String displayName, @Nullable String avatarUrl) {
        ObjectNode body = JsonUtils.mapper().createObjectNode();
        body.put("content", content);
        body.put("username", displayName.length() > MAX_USERNAME_LENGTH
                ? displayName.substring(0, MAX_USERNAME_LENGTH) : displayName);
        if (avatarUrl != null) {
            body.put("avatar_url", avatarUrl);
        }
        body.putObject("allowed_mentions").putArray("parse");

        return webhookFor(channelId)
                .flatMap(webhook -> request(httpClient.post()
                        .uri("/webhooks/" + webhook.getId() + "/" + webhook.getToken() + "?wait=true")
                        .send(ByteBufFlux.fromString(Mono.just(JsonUtils.writeValueAsString(body))))))
                .doOnSuccess(response -> log.debug("Webhook message posted to channel {}", channelId))
                .then();
    }

    @Override
    public void invalidate(String channelId) {
        if (webhooks.remove(channelId) != null) {
            log.info("Invalidated cached webhook for channel {}", channelId);
        }
    }

    private Mono<Webhook> webhookFor(String channelId) {
        Webhook cached = webhooks.get(channelId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return findExisting(channelId)
                .switchIfEmpty(Mono.defer(() -> create(channelId)))
                .doOnNext(webhook -> {
                    webhooks.put(channelId, webhook);
                    ownWebhookRegistry.accept(webhook.getId());
                });
    }

    private Mono<Webhook> findExisting(String channelId) {
        return request(httpClient.get().uri("/channels/" + channelId + "/webhooks"))
                .flatMap(list -> {
                    for (JsonNode hook : list) {
                        if (WEBHOOK_NAME.equals(JsonUtils.textOrNull(hook, "name")) && hook.hasNonNull("token")) {
                            return Mono.just(toWebhook(hook));
                        }
                    }
                    return Mono.empty();
                });
    }

    private Mono<Webhook> create(String channelId) {
        ObjectNode body = JsonUtils.mapper().createObjectNode().put("name", WEBHOOK_NAME);
        return request(httpClient.post()
                .uri("/channels/" + channelId + "/webhooks")
                .send(ByteBufFlux.fromString(Mono.just(JsonUtils.writeValueAsString(body)))))
                .map(DiscordWebhookManager::toWebhook)
                .doOnNext(webhook -> log.info("Created webhook {} for channel {}", webhook.getId(), channelId));
    }

    private Mono<JsonNode> request(HttpClient.ResponseReceiver<?> request) {
        return request.responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .flatMap(body -> {
                    int status = response.status().code();
                    if (status >= 400) {
                        return Mono.error(new IllegalStateException("Discord API " + status + ": " + body));
                    }
                    return Mono.just(body.isEmpty() ? JsonUtils.mapper().createObjectNode() : JsonUtils.readTree(body));
                }));
    }

    private static Webhook toWebhook(JsonNode node) {
        return new Webhook(JsonUtils.textOrNull(node, "id"), JsonUtils.textOrNull(node, "token"));
    }

    @Value
    private static class Webhook {
        String id;
        String token;
    }
}
