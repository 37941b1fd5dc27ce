package com.questrail.guider.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * GuiderEvent
 * -----------------------------------------------------------------------------
 * Notification delivered to every live {@link Subscription}.
 *
 * <p>Two families share this type:</p>
 * <ul>
 *   <li>{@link RemoteEvent}: an unsolicited message from the controller,
 *       tagged by its {@code "Event"} field. Unknown tags are not errors.</li>
 *   <li>Connection lifecycle events generated locally by the session
 *       supervisor: {@link ConnectionLost}, {@link Reconnecting},
 *       {@link Reconnected} and {@link ReconnectFailed}. These are the only
 *       way subscribers learn about connection health; a subscription itself
 *       never breaks.</li>
 * </ul>
 */
public sealed interface GuiderEvent
        permits GuiderEvent.RemoteEvent,
                GuiderEvent.ConnectionLost,
                GuiderEvent.Reconnecting,
                GuiderEvent.Reconnected,
                GuiderEvent.ReconnectFailed
{
    /** Wall-clock time at which the event was received or generated. */
    Instant timestamp();

    /**
     * Controller notification.
     *
     * @param type    recognised tag, or {@link RemoteEventType#UNKNOWN}
     * @param name    tag exactly as received
     * @param payload the complete JSON object, including the {@code "Event"} field
     */
    record RemoteEvent(Instant timestamp, RemoteEventType type, String name, JsonNode payload)
            implements GuiderEvent
    {
        public RemoteEvent {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(payload, "payload");
        }

        /** Text field of the payload, or {@code null} when absent. */
        public String text(String field) {
            JsonNode node = payload.get(field);
            return node == null || node.isNull() ? null : node.asText();
        }

        /**
         * The payload bound to the record for this event's type. Empty for
         * notifications without fields of their own and for unknown tags.
         *
         * @throws IllegalArgumentException if a field has the wrong JSON type
         */
        public Optional<EventPayload> typedPayload() {
            return type.payloadType().<EventPayload>map(t -> EventPayloads.read(payload, t));
        }

        /**
         * The payload as {@code payloadType}, when that is the record for this
         * event's type; empty otherwise.
         *
         * @throws IllegalArgumentException if a field has the wrong JSON type
         */
        public <T extends EventPayload> Optional<T> payloadAs(Class<T> payloadType) {
            Objects.requireNonNull(payloadType, "payloadType");
            if (type.payloadType().filter(payloadType::equals).isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(EventPayloads.read(payload, payloadType));
        }
    }

    /** The live session ended. Published once per genuine loss. */
    record ConnectionLost(Instant timestamp, String reason) implements GuiderEvent
    {
        public ConnectionLost {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(reason, "reason");
        }
    }

    /**
     * A reconnect attempt is about to be made.
     *
     * @param attempt     1-based attempt number within the current loop
     * @param maxAttempts configured bound, empty when unlimited
     */
    record Reconnecting(Instant timestamp, int attempt, OptionalInt maxAttempts) implements GuiderEvent
    {
        public Reconnecting {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(maxAttempts, "maxAttempts");
        }
    }

    /** A reconnect attempt succeeded; the session is live again. */
    record Reconnected(Instant timestamp) implements GuiderEvent
    {
        public Reconnected {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** The reconnect loop ended without a session. */
    record ReconnectFailed(Instant timestamp, String reason) implements GuiderEvent
    {
        public ReconnectFailed {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(reason, "reason");
        }
    }
}
