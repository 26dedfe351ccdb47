package com.peerlink.client.relay;

import com.peerlink.core.event.CommunityEventEnvelope;
import com.peerlink.core.msg.RelayFrames;
import com.peerlink.core.util.JitterBackoff;
import com.peerlink.core.util.JsonCodecException;
import com.peerlink.core.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Relay client over a reactor-netty WebSocket.
 * <p>
 * Every state change runs on a single-threaded scheduler owned by the connection. Each socket
 * attempt gets a new generation number; callbacks carrying an older generation are ignored, so
 * a late close or frame from a replaced socket cannot touch the current one.
 * </p>
 * <p>
 * Reconnect delays come from a {@link JitterBackoff.Sequence}: doubling from one second with up
 * to one second of jitter, capped at {@code maxReconnectDelay}, reset on every {@code registered}.
 * </p>
 */
public class RelayConnection implements IRelayConnection {
    private static final Logger log = LoggerFactory.getLogger(RelayConnection.class);

    private final RelayConnectionOptions options;
    private final HttpClient httpClient;
    private final JitterBackoff.Sequence backoff;
    private final Scheduler eventLoop;
    private final List<RelayListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    // Touched only on the event loop
    private long generation;
    @Nullable
    private Sinks.Many<String> outbound;
    @Nullable
    private Disposable socket;
    @Nullable
    private Disposable keepalive;
    @Nullable
    private Disposable reconnectTimer;

    public RelayConnection(RelayConnectionOptions options) {
        this(options, HttpClient.create(), JitterBackoff.sequence(options.getMaxReconnectDelay()));
    }

    public RelayConnection(RelayConnectionOptions options, HttpClient httpClient, JitterBackoff.Sequence backoff) {
        this.options = options;
        this.httpClient = httpClient;
        this.backoff = backoff;
        this.eventLoop = Schedulers.newSingle("relay-connection");
    }

    @Override
    public void addListener(RelayListener listener) {
        listeners.add(listener);
    }

    @Override
    public void connect() {
        onEventLoop(this::openSocket);
    }

    @Override
    public void disconnect() {
        state = ConnectionState.STOPPED;
        onEventLoop(() -> {
            generation++;
            cancel(reconnectTimer);
            cancel(keepalive);
            closeOutbound();
            cancel(socket);
            reconnectTimer = null;
            keepalive = null;
            socket = null;
            log.info("Relay connection for {} stopped", options.getDid());
            eventLoop.dispose();
        });
    }

    @Override
    public boolean sendToDid(String toDid, String payload) {
        if (state != ConnectionState.REGISTERED) {
            log.warn("Cannot send to {}, relay connection is {}", toDid, state);
            return false;
        }
        return emit(RelayFrames.send(toDid, payload));
    }

    @Override
    public boolean isConnected() {
        return state == ConnectionState.REGISTERED;
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    // ---------------------------------------------------------------- socket lifecycle

    private void openSocket() {
        if (state == ConnectionState.STOPPED) {
            return;
        }
        cancel(socket);
        closeOutbound();

        long gen = ++generation;
        state = ConnectionState.CONNECTING;
        Sinks.Many<String> frames = Sinks.many().unicast().onBackpressureBuffer();
        outbound = frames;
        // register is the first frame on the wire once the handshake completes
        emit(RelayFrames.register(options.getDid()));

        log.info("Connecting to relay {} as {}", options.getUrl(), options.getDid());
        socket = httpClient
            .websocket(WebsocketClientSpec.builder().maxFramePayloadLength(options.getMaxFramePayloadLength()).build())
            .uri(options.getUrl())
            // the session ends when the relay closes the socket or our outbound completes
            .handle((in, out) -> Mono.firstWithSignal(
                out.sendString(frames.asFlux()).then(),
                in.aggregateFrames(options.getMaxFramePayloadLength())
                    .receive()
                    .asString()
                    .publishOn(eventLoop)
                    .doOnNext(text -> onFrame(gen, text))
                    .then()))
            .then()
            .subscribe(
                v -> {
                },
                err -> onEventLoop(() -> onClosed(gen, err)),
                () -> onEventLoop(() -> onClosed(gen, null)));
    }

    private void onFrame(long gen, String text) {
        if (gen != generation || state == ConnectionState.STOPPED) {
            return;
        }
        String type = RelayFrames.parseType(text);
        if (type == null) {
            log.warn("Dropping malformed relay frame: {}", abbreviate(text));
            return;
        }

        switch (type) {
            case RelayFrames.REGISTERED:
                state = ConnectionState.REGISTERED;
                backoff.reset();
                startKeepalive(gen);
                log.info("Registered with relay as {}", options.getDid());
                fire(RelayListener::onConnected);
                break;
            case RelayFrames.MESSAGE:
                onMessage(text);
                break;
            case RelayFrames.PONG:
                break;
            case RelayFrames.ERROR:
                String message = errorMessage(text);
                log.warn("Relay error: {}", message);
                fire(listener -> listener.onRelayError(message));
                break;
            default:
                log.debug("Ignoring relay frame of type {}", type);
        }
    }

    private void onMessage(String text) {
        RelayFrames.Message message;
        try {
            message = JsonUtils.readValue(text, RelayFrames.Message.class);
        } catch (JsonCodecException e) {
            log.warn("Dropping unreadable message frame: {}", e.getMessage());
            return;
        }
        if (message.getFromDid() == null || message.getPayload() == null) {
            log.warn("Dropping message frame without from_did or payload");
            return;
        }

        fire(listener -> listener.onRawMessage(message.getFromDid(), message.getPayload()));
        CommunityEventEnvelope.tryParse(message.getPayload()).ifPresentOrElse(
            envelope -> fire(listener -> listener.onEnvelope(envelope, message.getFromDid())),
            () -> log.debug("Non-community payload from {}, ignoring", message.getFromDid()));
    }

    private void onClosed(long gen, @Nullable Throwable error) {
        if (gen != generation) {
            return;
        }
        if (error != null) {
            log.warn("Relay socket failed: {}", error.getMessage());
        } else {
            log.info("Relay socket closed");
        }

        cancel(keepalive);
        keepalive = null;
        closeOutbound();
        socket = null;
        if (state == ConnectionState.STOPPED) {
            return;
        }
        state = ConnectionState.DISCONNECTED;
        fire(RelayListener::onDisconnected);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (state == ConnectionState.STOPPED) {
            return;
        }
        Duration delay = backoff.next();
        log.info("Reconnecting to relay in {} ms", delay.toMillis());
        cancel(reconnectTimer);
        reconnectTimer = eventLoop.schedule(() -> {
            reconnectTimer = null;
            openSocket();
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void startKeepalive(long gen) {
        cancel(keepalive);
        keepalive = Flux.interval(options.getKeepaliveInterval(), eventLoop)
            .filter(tick -> gen == generation)
            .subscribe(tick -> emit(RelayFrames.ping()));
    }

    // ---------------------------------------------------------------- helpers

    private synchronized boolean emit(String frame) {
        Sinks.Many<String> current = outbound;
        return current != null && !current.tryEmitNext(frame).isFailure();
    }

    private synchronized void closeOutbound() {
        if (outbound != null) {
            outbound.tryEmitComplete();
            outbound = null;
        }
    }

    private void fire(Consumer<RelayListener> callback) {
        for (RelayListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.error("Relay listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    private void onEventLoop(Runnable task) {
        if (eventLoop.isDisposed()) {
            log.debug("Relay connection for {} already stopped", options.getDid());
            return;
        }
        eventLoop.schedule(task);
    }

    private static void cancel(@Nullable Disposable disposable) {
        if (disposable != null) {
            disposable.dispose();
        }
    }

    @Nullable
    private static String errorMessage(String text) {
        try {
            return JsonUtils.textOrNull(JsonUtils.readTree(text), "message");
        } catch (JsonCodecException e) {
            return null;
        }
    }

    private static String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
