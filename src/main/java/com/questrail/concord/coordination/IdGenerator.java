package com.questrail.concord.coordination;

import java.util.UUID;

/**
 * Source of fresh identifiers for locally created intents, proposals and sessions.
 */
@FunctionalInterface
public interface IdGenerator
{
    String nextId();

    static IdGenerator randomUuids() {
        return () -> UUID.randomUUID().toString();
    }
}
