package com.questrail.concord.message;

/**
 * Named logical channels ("protocols") the engine listens on.
 */
public enum ProtocolChannel
{
    INTENT("/op/intent/1.0.0"),
    VOTE("/op/vote/1.0.0"),
    SESSION("/op/game/1.0.0");

    private final String id;

    ProtocolChannel(String id) {
        this.id = id;
    }

    /**
     * Channel identifier as used by the transport.
     */
    public String id() {
        return id;
    }
}
