package com.questrail.concord.internal.exec;

/**
 * Work the {@link CoordinationDriver} performs for inbound payloads and ticks.
 * Always invoked on the loop thread.
 */
public interface CoordinationEventHandler
{
    void onInbound(String channel, byte[] payload);

    void onTick();
}
