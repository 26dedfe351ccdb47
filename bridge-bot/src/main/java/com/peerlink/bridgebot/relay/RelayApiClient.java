package com.peerlink.bridgebot.relay;

import com.fasterxml.jackson.core.type.TypeReference;
import com.peerlink.core.model.ApiResponse;
import com.peerlink.core.model.BridgeConfig;
import com.peerlink.core.model.BridgeConfigSummary;
import com.peerlink.core.model.RegisterBridgeRequest;
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
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;

import javax.annotation.Nullable;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * {@link IRelayApiClient} over reactor-netty {@link HttpClient}.
 */
public class RelayApiClient implements IRelayApiClient {
    private static final Logger log = LoggerFactory.getLogger(RelayApiClient.class);

    private static final TypeReference<ApiResponse<List<BridgeConfigSummary>>> SUMMARIES = new TypeReference<>() {
    };
    private static final TypeReference<ApiResponse<BridgeConfig>> CONFIG = new TypeReference<>() {
    };

    private final HttpClient httpClient;

    /**
     * @param relayApiUrl base URL, e.g. {@code http://relay:8080}
     */
    public RelayApiClient(String relayApiUrl) {
        this.httpClient = HttpClient.create()
                .baseUrl(relayApiUrl)
                .headers(h -> h.set(HttpHeaderNames.ACCEPT, HttpHeaderValues.APPLICATION_JSON))
                .responseTimeout(Duration.ofSeconds(30));

        log.info("RelayApiClient initialized with {}", relayApiUrl);
    }

    @Override
    public Mono<List<BridgeConfigSummary>> listBridges() {
        return exchange(httpClient.get().uri("/api/bridge/list"))
                .map(response -> {
                    List<BridgeConfigSummary> summaries = unwrap(response, SUMMARIES);
                    return summaries == null ? List.<BridgeConfigSummary>of() : summaries;
                });
    }

    @Override
    public Mono<BridgeConfig> getBridge(String communityId) {
        return exchange(httpClient.get().uri("/api/bridge/" + encode(communityId)))
                .flatMap(response -> {
                    if (response.getStatus() == HttpResponseStatus.NOT_FOUND.code()) {
                        log.debug("Relay has no bridge config for {}", communityId);
                        return Mono.empty();
                    }
                    return Mono.justOrEmpty(unwrap(response, CONFIG));
                });
    }

    @Override
    public Mono<BridgeConfig> registerBridge(RegisterBridgeRequest request) {
        String body = JsonUtils.writeValueAsString(request);
        return exchange(httpClient
                .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .post()
                .uri("/api/bridge/register")
                .send(ByteBufFlux.fromString(Mono.just(body))))
                .flatMap(response -> Mono.justOrEmpty(unwrap(response, CONFIG)));
    }

    @Override
    public Mono<BridgeConfig> updateMembers(String communityId, List<String> memberDids) {
        String body = JsonUtils.writeValueAsString(new UpdateMembersRequest(memberDids));
        return exchange(httpClient
                .headers(h -> h.set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON))
                .put()
                .uri("/api/bridge/" + encode(communityId) + "/members")
                .send(ByteBufFlux.fromString(Mono.just(body))))
                .flatMap(response -> Mono.justOrEmpty(unwrap(response, CONFIG)));
    }

    private Mono<RawResponse> exchange(HttpClient.ResponseReceiver<?> request) {
        return request.responseSingle((response, content) -> content.asString(StandardCharsets.UTF_8)
                .defaultIfEmpty("")
                .map(body -> new RawResponse(response.status().code(), body)));
    }

    @Nullable
    private static <T> T unwrap(RawResponse response, TypeReference<ApiResponse<T>> type) {
        ApiResponse<T> parsed;
        try {
            parsed = JsonUtils.readValue(response.getBody(), type);
        } catch (JsonCodecException e) {
            throw new RelayApiException(response.getStatus(), "unreadable response body");
        }
        if (!parsed.isOk() || response.getStatus() >= 400) {
            throw new RelayApiException(response.getStatus(), parsed.getError() != null ? parsed.getError() : "request failed");
        }
        return parsed.getData();
    }

    private static String encode(String pathSegment) {
        return URLEncoder.encode(pathSegment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    @Value
    private static class RawResponse {
        int status;
        String body;
    }
}
