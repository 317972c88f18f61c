package com.questrail.concord.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Intent
 * -----------------------------------------------------------------------------
 * A declared desire of one peer to act on a shared resource.
 *
 * <p>Every field except {@link #status()} is fixed at construction. Intents are
 * created either by a local request or on receipt from a peer, and are owned by
 * the intent coordinator's store. Only the coordinator thread mutates the status.</p>
 */
public final class Intent
{
    private final String id;
    private final String originator;
    private final String resourceKey;
    private final String actionDescriptor;
    private final long costEstimate;
    private final int priority;
    private final Instant createdAt;

    private IntentStatus status;

    public Intent(String id,
                  String originator,
                  String resourceKey,
                  String actionDescriptor,
                  long costEstimate,
                  int priority,
                  Instant createdAt)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.originator = Objects.requireNonNull(originator, "originator");
        this.resourceKey = Objects.requireNonNull(resourceKey, "resourceKey");
        this.actionDescriptor = Objects.requireNonNull(actionDescriptor, "actionDescriptor");
        this.costEstimate = costEstimate;
        this.priority = priority;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.status = IntentStatus.PENDING;
    }

    public String id() {
        return id;
    }

    public String originator() {
        return originator;
    }

    public String resourceKey() {
        return resourceKey;
    }

    public String actionDescriptor() {
        return actionDescriptor;
    }

    public long costEstimate() {
        return costEstimate;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public IntentStatus status() {
        return status;
    }

    public void status(IntentStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public boolean isPending() {
        return status == IntentStatus.PENDING;
    }

    @Override
    public String toString() {
        return "Intent{" + id
                + ", originator=" + originator
                + ", resource=" + resourceKey
                + ", priority=" + priority
                + ", createdAt=" + createdAt
                + ", status=" + status + '}';
    }
}
