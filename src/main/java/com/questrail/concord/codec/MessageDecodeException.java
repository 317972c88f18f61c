package com.questrail.concord.codec;

/**
 * Indicates that inbound bytes or an envelope could not be turned into a valid
 * coordination message.
 *
 * This typically reflects:
 * <ul>
 *   <li>bytes that are not a JSON object</li>
 *   <li>a missing or mistyped envelope field ({@code kind}, {@code senderId},
 *       {@code timestamp}, {@code payload})</li>
 *   <li>a missing or mistyped kind-specific payload field</li>
 * </ul>
 *
 * The router treats it as a malformed message: dropped, reported, never propagated.
 */
public final class MessageDecodeException extends RuntimeException
{
    public MessageDecodeException(String message) {
        super(message);
    }

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
