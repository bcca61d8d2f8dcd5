package io.botpoll.core;

import java.time.Duration;

/**
 * How a listener receives new updates.
 *
 * <p>Long polling is the only method currently supported. The interface is sealed so listeners can
 * handle every variant, and new variants (such as webhook delivery) can be added in later releases
 * without changing how handlers consume updates.
 */
public sealed interface ListeningMethod permits ListeningMethod.LongPoll {

    /**
     * Long polling through {@code getUpdates}.
     *
     * @param timeout how long the remote side may hold each poll, or {@code null} for the default (30s).
     *                The remote side counts whole seconds, so fractions of a second are rejected.
     */
    record LongPoll(Duration timeout) implements ListeningMethod {
        public LongPoll {
            if (timeout != null && timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must not be negative");
            }
            if (timeout != null && timeout.getNano() != 0) {
                throw new IllegalArgumentException("timeout must be whole seconds: " + timeout);
            }
        }
    }

    static ListeningMethod longPoll() {
        return new LongPoll(null);
    }

    static ListeningMethod longPoll(Duration timeout) {
        return new LongPoll(timeout);
    }
}
