package com.questrail.concord.codec;

import com.questrail.concord.message.Envelope;

/**
 * MessageCodec
 * -----------------------------------------------------------------------------
 * Byte-level boundary between transport payloads and the structured
 * {@link Envelope}.
 *
 * <p>The codec is responsible only for syntax: the envelope fields must be
 * present with the right types. It does <strong>not</strong> look at the
 * kind-specific payload and does not know which kinds exist.</p>
 */
public interface MessageCodec
{
    /**
     * @param envelope structured message
     * @return encoded bytes, ready for the transport
     */
    byte[] encode(Envelope envelope);

    /**
     * Decode one complete message. Streaming or accumulation across calls is
     * not supported.
     *
     * @param payload bytes exactly as delivered by the transport
     * @return the envelope
     * @throws MessageDecodeException if the payload is not a well-formed envelope
     */
    Envelope decode(byte[] payload);
}
