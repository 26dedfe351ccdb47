package com.peerlink.relay.bridge;

import com.peerlink.core.model.ApiResponse;
import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.RegisterBridgeRequest;
import com.peerlink.core.model.SetEnabledRequest;
import com.peerlink.core.model.UpdateMembersRequest;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * REST endpoints for bridge configs under {@code /api/bridge}.
 * <p>
 * Called by community owners when they enable a bridge and by the bridge bot to discover what
 * to bridge. Every reply is an {@link ApiResponse}.
 * </p>
 */
public class BridgeApiHandler {
    private static final Logger log = LoggerFactory.getLogger(BridgeApiHandler.class);

    static final String NOT_FOUND = "Bridge config not found";

    private final BridgeConfigStore store;

    public BridgeApiHandler(BridgeConfigStore store) {
        this.store = store;
    }

    // ---------------------------------------------------------------- HTTP adapters

    public Mono<Void> handleList(HttpServerRequest req, HttpServerResponse res) {
        return respond(res, this::list);
    }

    public Mono<Void> handleGet(HttpServerRequest req, HttpServerResponse res) {
        String communityId = req.param("communityId");
        return respond(res, () -> get(communityId));
    }

    public Mono<Void> handleRegister(HttpServerRequest req, HttpServerResponse res) {
        return withBody(req, res, this::register);
    }

    public Mono<Void> handleUpdateMembers(HttpServerRequest req, HttpServerResponse res) {
        String communityId = req.param("communityId");
        return withBody(req, res, body -> updateMembers(communityId, body));
    }

    public Mono<Void> handleSetEnabled(HttpServerRequest req, HttpServerResponse res) {
        String communityId = req.param("communityId");
        return withBody(req, res, body -> setEnabled(communityId, body));
    }

    public Mono<Void> handleDelete(HttpServerRequest req, HttpServerResponse res) {
        String communityId = req.param("communityId");
        return respond(res, () -> delete(communityId));
    }

    // ---------------------------------------------------------------- operations

    Reply list() {
        return Reply.ok(store.list());
    }

    Reply get(String communityId) {
        return store.get(communityId)
            .map(Reply::ok)
            .orElseGet(() -> Reply.error(HttpResponseStatus.NOT_FOUND, NOT_FOUND));
    }

    Reply register(String body) {
        RegisterBridgeRequest request;
        try {
            request = JsonUtils.readValue(body, RegisterBridgeRequest.class);
        } catch (JsonCodecException e) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "Invalid request body");
        }

        if (isEmpty(request.getCommunityId()) || isEmpty(request.getGuildId())) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "communityId and guildId are required");
        }
        if (!BridgeConfigStore.isValidCommunityId(request.getCommunityId())) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "Invalid communityId");
        }
        if (request.getChannels() == null || request.getChannels().isEmpty()) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "At least one channel mapping is required");
        }

        BridgeConfig stored = store.register(BridgeConfig.builder()
            .communityId(request.getCommunityId())
            .guildId(request.getGuildId())
            .enabled(true)
            .bridgeDid(request.getBridgeDid())
            .channels(request.getChannels())
            .seats(request.getSeats() == null ? List.of() : request.getSeats())
            .memberDids(request.getMemberDids() == null ? List.of() : request.getMemberDids())
            .build());
        return new Reply(HttpResponseStatus.CREATED, ApiResponse.success(stored));
    }

    Reply updateMembers(String communityId, String body) {
        UpdateMembersRequest request;
        try {
            request = JsonUtils.readValue(body, UpdateMembersRequest.class);
        } catch (JsonCodecException e) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "Invalid request body");
        }
        return store.updateMembers(communityId, request.getMemberDids())
            .map(Reply::ok)
            .orElseGet(() -> Reply.error(HttpResponseStatus.NOT_FOUND, NOT_FOUND));
    }

    Reply setEnabled(String communityId, String body) {
        SetEnabledRequest request;
        try {
            request = JsonUtils.readValue(body, SetEnabledRequest.class);
        } catch (JsonCodecException e) {
            return Reply.error(HttpResponseStatus.BAD_REQUEST, "Invalid request body");
        }
        return store.setEnabled(communityId, request.isEnabled())
            .map(Reply::ok)
            .orElseGet(() -> Reply.error(HttpResponseStatus.NOT_FOUND, NOT_FOUND));
    }

    Reply delete(String communityId) {
        if (store.delete(communityId)) {
            return Reply.ok(null);
        }
        return Reply.error(HttpResponseStatus.NOT_FOUND, NOT_FOUND);
    }

    // ---------------------------------------------------------------- plumbing

    private Mono<Void> withBody(HttpServerRequest req, HttpServerResponse res, Function<String, Reply> operation) {
        return req.receive()
            .aggregate()
            .asString(StandardCharsets.UTF_8)
            .defaultIfEmpty("")
            .flatMap(body -> respond(res, () -> operation.apply(body)));
    }

    /**
     * Store operations touch the file system, so they run off the event loop.
     */
    private Mono<Void> respond(HttpServerResponse res, Supplier<Reply> operation) {
        return Mono.fromCallable(operation::get)
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorResume(err -> {
                log.error("Bridge API request failed", err);
                return Mono.just(Reply.error(HttpResponseStatus.INTERNAL_SERVER_ERROR, "Internal error"));
            })
            .flatMap(reply -> res.status(reply.getStatus())
                .header(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
                .sendString(Mono.just(JsonUtils.writeValueAsString(reply.getBody())))
                .then());
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    @Value
    static class Reply {
        HttpResponseStatus status;
        ApiResponse<?> body;

        static Reply ok(Object data) {
            return new Reply(HttpResponseStatus.OK, ApiResponse.success(data));
        }

        static Reply error(HttpResponseStatus status, String message) {
            return new Reply(status, ApiResponse.failure(message));
        }
    }
}
