package com.questrail.concord.coordination;

import com.questrail.concord.codec.MessageCodec;
import com.questrail.concord.internal.encode.CoordinationMessageEncoder;
import com.questrail.concord.internal.time.WallClock;
import com.questrail.concord.message.CoordinationMessage;
import com.questrail.concord.message.ProtocolChannel;
import com.questrail.concord.observability.CoordinationErrorEvent;
import com.questrail.concord.observability.CoordinationObservabilitySink;
import com.questrail.concord.transport.PeerTransport;

import java.util.Objects;

/**
 * Outbound half of the message pipeline:
 *
 * <pre>
 *   CoordinationMessage
 *        → CoordinationMessageEncoder
 *            → MessageCodec
 *                → PeerTransport.broadcast(channel, ...)
 * </pre>
 *
 * <p>Broadcast failures are reported to the sink and never thrown: the local
 * state change that triggered the broadcast stands.</p>
 */
public final class MessagePublisher
{
    private final PeerTransport transport;
    private final CoordinationMessageEncoder encoder;
    private final MessageCodec codec;
    private final CoordinationObservabilitySink observabilitySink;
    private final WallClock clock;

    public MessagePublisher(PeerTransport transport,
                            CoordinationMessageEncoder encoder,
                            MessageCodec codec,
                            CoordinationObservabilitySink observabilitySink,
                            WallClock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @return number of peers the message was handed to; 0 on failure
     */
    public int broadcast(ProtocolChannel channel, CoordinationMessage message) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(message, "message");

        try {
            byte[] bytes = codec.encode(encoder.encode(message));
            return transport.broadcast(channel.id(), bytes);
        } catch (RuntimeException e) {
            observabilitySink.onError(new CoordinationErrorEvent(
                    clock.now(),
                    "Broadcast of " + message.kind().wireName() + " on " + channel.id() + " failed",
                    e));
            return 0;
        }
    }

    public String localPeerId() {
        return transport.localPeerId();
    }

    /**
     * Connected peers plus the local peer.
     */
    public int totalKnownPeers() {
        return transport.connectedPeers().size() + 1;
    }
}
