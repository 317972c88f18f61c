package com.questrail.concord.codec;

import java.util.Objects;

/**
 * A datagram-sized unit carrying an encoded message on one named channel.
 *
 * @param channel channel identifier, e.g. {@code /op/vote/1.0.0}
 * @param payload encoded message bytes
 */
public record ChannelFrame(String channel, byte[] payload)
{
    public ChannelFrame {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
    }
}
