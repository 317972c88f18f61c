package com.questrail.concord.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * CoordinationEvent
 * -----------------------------------------------------------------------------
 * Everything that enters a peer's coordination loop.
 *
 * <p>Coordinator state changes only while the loop processes one of these
 * events, one at a time and in arrival order. There are three sources:</p>
 * <ul>
 *   <li>payloads received from the transport</li>
 *   <li>commands issued through the local API</li>
 *   <li>the periodic housekeeping tick</li>
 * </ul>
 */
public sealed interface CoordinationEvent
        permits CoordinationEvent.InboundPayload,
                CoordinationEvent.LocalCommand,
                CoordinationEvent.Tick
{
    Instant timestamp();

    /**
     * An encoded message as delivered on a channel. Not yet decoded.
     */
    record InboundPayload(Instant timestamp, String channel, byte[] payload) implements CoordinationEvent
    {
        public InboundPayload {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(payload, "payload");
        }
    }

    /**
     * A local API call. The loop runs {@code action} and completes
     * {@code completion} with its result or exception.
     */
    record LocalCommand<T>(Instant timestamp,
                           String name,
                           Supplier<T> action,
                           CompletableFuture<T> completion) implements CoordinationEvent
    {
        public LocalCommand {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(action, "action");
            Objects.requireNonNull(completion, "completion");
        }

        public void run() {
            try {
                completion.complete(action.get());
            } catch (RuntimeException e) {
                completion.completeExceptionally(e);
            }
        }

        public void abandon(Throwable reason) {
            completion.completeExceptionally(reason);
        }
    }

    record Tick(Instant timestamp) implements CoordinationEvent
    {
        public Tick {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
