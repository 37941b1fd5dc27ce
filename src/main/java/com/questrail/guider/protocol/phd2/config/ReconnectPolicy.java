package com.questrail.guider.protocol.phd2.config;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Governs the automatic reconnect loop entered after an unexpected loss of
 * the session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>enabled</b>: initial value of the auto-reconnect flag. The flag
 *       can be toggled at runtime through the client; this field only seeds
 *       it.</li>
 *   <li><b>retryInterval</b>: delay before every attempt, including the
 *       first one after the loss.</li>
 *   <li><b>maxRetries</b>: attempts per loop before giving up; empty means
 *       retry until cancelled.</li>
 * </ul>
 */
public record ReconnectPolicy(
        boolean enabled,
        Duration retryInterval,
        OptionalInt maxRetries
) {
    public ReconnectPolicy {
        Objects.requireNonNull(retryInterval, "retryInterval");
        Objects.requireNonNull(maxRetries, "maxRetries");

        if (retryInterval.isNegative()) {
            throw new IllegalArgumentException("retryInterval must be non-negative");
        }
        if (maxRetries.isPresent() && maxRetries.getAsInt() < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1 when present");
        }
    }

    /**
     * Enabled, 5 s between attempts, unlimited attempts.
     */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(true, Duration.ofSeconds(5), OptionalInt.empty());
    }

    public static ReconnectPolicy disabled() {
        return new ReconnectPolicy(false, Duration.ofSeconds(5), OptionalInt.empty());
    }

    public static ReconnectPolicy bounded(Duration retryInterval, int maxRetries) {
        return new ReconnectPolicy(true, retryInterval, OptionalInt.of(maxRetries));
    }

    /**
     * @return {@code true} once {@code attempt} attempts have been made and
     *         the bound, if any, is reached
     */
    public boolean isExhausted(int attempt) {
        return maxRetries.isPresent() && attempt >= maxRetries.getAsInt();
    }
}
