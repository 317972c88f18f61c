package com.questrail.concord.codec.impl;

/**
 * Datagram framing defect. Never escapes the codec package: decoders translate
 * it into an empty result.
 */
final class FramingException extends Exception
{
    FramingException(String message) {
        super(message);
    }
}
