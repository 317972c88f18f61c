package com.questrail.concord.codec.impl;

import com.questrail.concord.codec.ChannelFrame;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * ChannelFraming
 * -----------------------------------------------------------------------------
 * Carries a {@link ChannelFrame} in a single datagram.
 *
 * <pre>
 *   +----------------+----------------------+------------------+
 *   | u16 length (BE)| channel id (UTF-8)   | message payload  |
 *   +----------------+----------------------+------------------+
 * </pre>
 *
 * <p>The channel id must be 1..{@value #MAX_CHANNEL_BYTES} bytes of valid UTF-8.
 * The payload runs to the end of the datagram and may be empty. Anything that
 * does not fit this shape is a transport defect and is dropped.</p>
 */
public final class ChannelFraming
{
    static final int LENGTH_BYTES = 2;
    static final int MAX_CHANNEL_BYTES = 255;

    private ChannelFraming() {}

    public static byte[] encode(ChannelFrame frame)
    {
        Objects.requireNonNull(frame, "frame");
        byte[] channel = frame.channel().getBytes(StandardCharsets.UTF_8);
        if (channel.length == 0 || channel.length > MAX_CHANNEL_BYTES) {
            throw new IllegalArgumentException("Channel id must be 1.." + MAX_CHANNEL_BYTES
                    + " UTF-8 bytes: " + frame.channel());
        }

        return ByteBuffer.allocate(LENGTH_BYTES + channel.length + frame.payload().length)
                .putShort((short) channel.length)
                .put(channel)
                .put(frame.payload())
                .array();
    }

    /**
     * @param datagram one complete datagram
     * @return the frame, or {@link Optional#empty()} if the datagram is malformed
     */
    public static Optional<ChannelFrame> decode(byte[] datagram)
    {
        try {
            return Optional.of(parse(datagram));
        }
        catch (FramingException e) {
            return Optional.empty();
        }
    }

    private static ChannelFrame parse(byte[] datagram) throws FramingException
    {
        if (datagram == null || datagram.length < LENGTH_BYTES + 1) {
            throw new FramingException("Datagram too short for a channel frame");
        }

        int channelLength = ((datagram[0] & 0xFF) << 8) | (datagram[1] & 0xFF);
        if (channelLength == 0 || channelLength > MAX_CHANNEL_BYTES) {
            throw new FramingException("Illegal channel length " + channelLength);
        }
        if (LENGTH_BYTES + channelLength > datagram.length) {
            throw new FramingException("Channel id truncated");
        }

        String channel = strictUtf8(Arrays.copyOfRange(datagram, LENGTH_BYTES, LENGTH_BYTES + channelLength));
        byte[] payload = Arrays.copyOfRange(datagram, LENGTH_BYTES + channelLength, datagram.length);
        return new ChannelFrame(channel, payload);
    }

    private static String strictUtf8(byte[] bytes) throws FramingException
    {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        }
        catch (CharacterCodingException e) {
            throw new FramingException("Channel id is not valid UTF-8");
        }
    }
}
