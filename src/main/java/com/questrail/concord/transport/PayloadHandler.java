package com.questrail.concord.transport;

/**
 * Receives payloads delivered on one channel. Called on a transport thread.
 */
@FunctionalInterface
public interface PayloadHandler
{
    void onPayload(String channel, byte[] payload);
}
