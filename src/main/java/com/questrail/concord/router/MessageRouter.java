package com.questrail.concord.router;

import com.questrail.concord.codec.MessageCodec;
import com.questrail.concord.codec.MessageDecodeException;
import com.questrail.concord.internal.decode.CoordinationMessageDecoder;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.message.CoordinationMessage;
import com.questrail.concord.message.Envelope;
import com.questrail.concord.message.MessageKind;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.observability.DropReason;
import com.questrail.concord.observability.MessageDroppedEvent;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MessageRouter
 * =============================================================================
 * Turns raw channel payloads into typed messages and hands each one to the
 * handler registered for its {@code (channel, kind)} pair.
 *
 * <h2>Pipeline</h2>
 * <pre>
 *   raw bytes
 *        → MessageCodec.decode            (envelope fields)
 *            → MessageKind.fromWireName   (known kind)
 *                → handler lookup         (channel, kind)
 *                    → CoordinationMessageDecoder (per-kind fields)
 *                        → MessageHandler.handle
 * </pre>
 *
 * <p>A failure at any step drops the message and reports a
 * {@link MessageDroppedEvent}. Nothing is retried, buffered or propagated to
 * the caller. Exceptions thrown by a handler are reported as errors.</p>
 *
 * <h2>Threading</h2>
 * Not thread-safe. Registration happens during wiring; dispatch happens on the
 * coordination loop thread.
 */
public final class MessageRouter
{
    private final MessageCodec codec;
    private final CoordinationMessageDecoder decoder;
    private final CoordinationObservabilitySink observabilitySink;
    private final WallClock clock;

    private final Map<String, Map<MessageKind, MessageHandler>> routes = new HashMap<>();

    public MessageRouter(MessageCodec codec,
                         CoordinationMessageDecoder decoder,
                         CoordinationObservabilitySink observabilitySink,
                         WallClock clock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Register (or replace) the handler for a kind on a channel.
     */
    public void registerHandler(String channel, MessageKind kind, MessageHandler handler) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(handler, "handler");

        routes.computeIfAbsent(channel, c -> new HashMap<>()).put(kind, handler);
    }

    public boolean hasHandler(String channel, MessageKind kind) {
        Map<MessageKind, MessageHandler> byKind = routes.get(channel);
        return byKind != null && byKind.containsKey(kind);
    }

    /**
     * Decode and deliver one raw message.
     *
     * @return {@code true} if a handler ran to completion
     */
    public boolean dispatch(String channel, byte[] raw) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(raw, "raw");

        final Envelope envelope;
        try {
            envelope = codec.decode(raw);
        } catch (MessageDecodeException e) {
            drop(channel, DropReason.MALFORMED, null, e.getMessage());
            return false;
        }

        Optional<MessageKind> kind = MessageKind.fromWireName(envelope.kind());
        if (kind.isEmpty()) {
            drop(channel, DropReason.UNKNOWN_KIND, envelope.senderId(), "kind '" + envelope.kind() + "'");
            return false;
        }

        Map<MessageKind, MessageHandler> byKind = routes.get(channel);
        MessageHandler handler = byKind == null ? null : byKind.get(kind.get());
        if (handler == null) {
            drop(channel, DropReason.NO_HANDLER, envelope.senderId(), "kind '" + envelope.kind() + "'");
            return false;
        }

        final CoordinationMessage message;
        try {
            message = decoder.decode(kind.get(), envelope);
        } catch (MessageDecodeException e) {
            drop(channel, DropReason.MALFORMED, envelope.senderId(), e.getMessage());
            return false;
        }

        try {
            handler.handle(message);
            return true;
        } catch (RuntimeException e) {
            observabilitySink.onError(new CoordinationErrorEvent(
                    clock.now(),
                    "Handler for " + kind.get().wireName() + " on " + channel + " failed",
                    e));
            return false;
        }
    }

    private void drop(String channel, DropReason reason, String senderId, String detail) {
        observabilitySink.onMessageDropped(new MessageDroppedEvent(clock.now(), channel, reason, senderId, detail));
    }
}
