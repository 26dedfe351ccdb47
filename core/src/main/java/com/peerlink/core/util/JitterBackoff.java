package com.peerlink.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongSupplier;

/**
 * Jittered, capped reconnect delays.
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Starts a stateful delay sequence: 1s base, 1s jitter, capped at {@code max}.
     */
    public static Sequence sequence(Duration max) {
        return new Sequence(Duration.ofSeconds(1), max, Duration.ofSeconds(1),
                () -> ThreadLocalRandom.current().nextLong(1001));
    }

    /**
     * Reconnect delay sequence owned by a single connection.
     * <p>
     * The first delay is the base. Every following delay is
     * {@code min(previous * 2 + jitter, max)}, so the sequence never decreases and never exceeds
     * {@code max}. {@link #reset()} goes back to the base after a successful registration.
     * </p>
     * <p>
     * Not thread-safe; it is only touched from the connection's event loop.
     * </p>
     */
    public static final class Sequence {
        private final long baseMs;
        private final long maxMs;
        private final long jitterMaxMs;
        private final LongSupplier jitter;
        private long currentMs;

        Sequence(Duration base, Duration max, Duration jitterMax, LongSupplier jitter) {
            if (max.compareTo(base) < 0) {
                throw new IllegalArgumentException("max delay " + max + " is below base delay " + base);
            }
            this.baseMs = base.toMillis();
            this.maxMs = max.toMillis();
            this.jitterMaxMs = jitterMax.toMillis();
            this.jitter = jitter;
            this.currentMs = baseMs;
        }

        /**
         * Creates a sequence with an explicit jitter source (milliseconds, clamped to {@code jitterMax}).
         */
        public static Sequence of(Duration base, Duration max, Duration jitterMax, LongSupplier jitter) {
            return new Sequence(base, max, jitterMax, jitter);
        }

        /**
         * Returns the delay to wait now and advances the sequence.
         */
        public Duration next() {
            long delay = currentMs;
            long jitterMs = Math.max(0, Math.min(jitter.getAsLong(), jitterMaxMs));
            long doubled = currentMs > Long.MAX_VALUE / 4 ? maxMs : currentMs * 2 + jitterMs;
            currentMs = Math.min(doubled, maxMs);
            return Duration.ofMillis(delay);
        }

        public Duration peek() {
            return Duration.ofMillis(currentMs);
        }

        public void reset() {
            currentMs = baseMs;
        }
    }
}
