package com.questrail.concord.observability;

public enum DropReason {
    /** Bytes, envelope or per-kind fields could not be decoded. */
    MALFORMED,
    /** Envelope kind is not one the engine understands. */
    UNKNOWN_KIND,
    /** No handler registered for the (channel, kind) pair. */
    NO_HANDLER,
    /** Message refers to an entity this peer does not know. */
    UNKNOWN_ENTITY,
    /** Target entity is no longer accepting input (finalized, ended, resolved). */
    STALE,
    /** Sender may not perform the requested action (e.g. ending a session it did not create). */
    NOT_PERMITTED,
    /** Move sequence is not the next expected one. */
    OUT_OF_ORDER
}
