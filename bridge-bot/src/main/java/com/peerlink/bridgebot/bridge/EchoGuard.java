package com.peerlink.bridgebot.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;

/**
 * Keeps the bridge from re-bridging its own output.
 * <p>
 * A message is not bridged to the platform if the bridge itself authored it, or if its ID was
 * bridged recently. The recent set is cleared as a whole every {@link #CLEAR_INTERVAL}; a very
 * old duplicate may slip through, a new message is never suppressed.
 * </p>
 * <p>
 * Only touched from the controller's event loop, which also runs the clear timer.
 * </p>
 */
public class EchoGuard {
    private static final Logger log = LoggerFactory.getLogger(EchoGuard.class);

    public static final Duration CLEAR_INTERVAL = Duration.ofMinutes(5);

    private final Scheduler scheduler;
    private final Set<String> recentlyBridged = new HashSet<>();

    @Nullable
    private volatile String bridgeDid;
    @Nullable
    private Disposable clearTimer;

    public EchoGuard(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * The identity may load after construction.
     */
    public void setBridgeDid(String bridgeDid) {
        this.bridgeDid = bridgeDid;
    }

    public void start() {
        if (clearTimer != null) {
            return;
        }
        clearTimer = Flux.interval(CLEAR_INTERVAL, CLEAR_INTERVAL, scheduler)
            .subscribe(tick -> {
                log.debug("Clearing {} recently bridged message ids", recentlyBridged.size());
                recentlyBridged.clear();
            });
    }

    public boolean shouldBridgeToDiscord(String senderDid, String messageId) {
        if (senderDid != null && senderDid.equals(bridgeDid)) {
            return false;
        }
        return !recentlyBridged.contains(messageId);
    }

    /**
     * Call once the bridging of {@code messageId} completed, never before.
     */
    public void recordBridged(String messageId) {
        recentlyBridged.add(messageId);
    }

    public boolean wasBridged(String messageId) {
        return recentlyBridged.contains(messageId);
    }

    public void destroy() {
        if (clearTimer != null) {
            clearTimer.dispose();
            clearTimer = null;
        }
        recentlyBridged.clear();
    }
}
