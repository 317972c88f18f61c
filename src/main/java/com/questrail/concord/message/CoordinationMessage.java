package com.questrail.concord.message;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CoordinationMessage
 * -----------------------------------------------------------------------------
 * Closed, semantic taxonomy of messages exchanged between peers.
 *
 * <p>Handlers operate exclusively on these types. They never see bytes or raw
 * envelope maps, and every required field is guaranteed present: a message
 * missing one is rejected during decoding and never constructed.</p>
 *
 * <p>{@link #senderId()} is whatever the sender claimed. No signature or proof
 * is carried or checked.</p>
 */
public sealed interface CoordinationMessage
        permits CoordinationMessage.IntentAnnounced,
                CoordinationMessage.RoundProposed,
                CoordinationMessage.ProposalAnnounced,
                CoordinationMessage.VoteCast,
                CoordinationMessage.MoveMade,
                CoordinationMessage.SessionOpened,
                CoordinationMessage.SessionEnded,
                CoordinationMessage.CheckpointAnnounced
{
    MessageKind kind();

    String senderId();

    /** Sender's timestamp, second precision. */
    Instant timestamp();

    /**
     * A peer declared an intent on a resource.
     */
    record IntentAnnounced(String senderId,
                           Instant timestamp,
                           String intentId,
                           String targetResource,
                           String actionDescriptor,
                           long costEstimate,
                           int priority) implements CoordinationMessage
    {
        public IntentAnnounced {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(intentId, "intentId");
            Objects.requireNonNull(targetResource, "targetResource");
            Objects.requireNonNull(actionDescriptor, "actionDescriptor");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.INTENT;
        }
    }

    /**
     * A peer opened (or echoed) a coordination round. Receipt counts as the
     * sender's approving vote for {@code proposedIntentId}.
     */
    record RoundProposed(String senderId,
                         Instant timestamp,
                         String roundId,
                         String proposedIntentId,
                         String targetResource,
                         List<String> candidateIntentIds) implements CoordinationMessage
    {
        public RoundProposed {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(roundId, "roundId");
            Objects.requireNonNull(proposedIntentId, "proposedIntentId");
            Objects.requireNonNull(targetResource, "targetResource");
            candidateIntentIds = List.copyOf(Objects.requireNonNull(candidateIntentIds, "candidateIntentIds"));
        }

        @Override
        public MessageKind kind() {
            return MessageKind.COORDINATION;
        }
    }

    record ProposalAnnounced(String senderId,
                             Instant timestamp,
                             String proposalId,
                             String creatorId,
                             Map<String, Object> payload,
                             long votingDurationSeconds) implements CoordinationMessage
    {
        public ProposalAnnounced {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(proposalId, "proposalId");
            Objects.requireNonNull(creatorId, "creatorId");
            payload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(payload, "payload")));
        }

        @Override
        public MessageKind kind() {
            return MessageKind.PROPOSAL;
        }
    }

    record VoteCast(String senderId,
                    Instant timestamp,
                    String proposalId,
                    boolean decision,
                    long weight) implements CoordinationMessage
    {
        public VoteCast {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(proposalId, "proposalId");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.VOTE;
        }
    }

    /**
     * @param stateDigest sender's state digest after applying the move; may be {@code null}
     */
    record MoveMade(String senderId,
                    Instant timestamp,
                    String sessionId,
                    long moveSequence,
                    Map<String, Object> movePayload,
                    String stateDigest) implements CoordinationMessage
    {
        public MoveMade {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(sessionId, "sessionId");
            movePayload = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(movePayload, "movePayload")));
        }

        public Optional<String> optionalStateDigest() {
            return Optional.ofNullable(stateDigest);
        }

        @Override
        public MessageKind kind() {
            return MessageKind.MOVE;
        }
    }

    record SessionOpened(String senderId,
                         Instant timestamp,
                         String sessionId,
                         String sessionType,
                         Map<String, Object> initialState) implements CoordinationMessage
    {
        public SessionOpened {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(sessionType, "sessionType");
            initialState = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(initialState, "initialState")));
        }

        @Override
        public MessageKind kind() {
            return MessageKind.SESSION_OPENED;
        }
    }

    record SessionEnded(String senderId,
                        Instant timestamp,
                        String sessionId) implements CoordinationMessage
    {
        public SessionEnded {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(sessionId, "sessionId");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.SESSION_ENDED;
        }
    }

    record CheckpointAnnounced(String senderId,
                               Instant timestamp,
                               String sessionId,
                               long sequence,
                               String stateDigest,
                               int moveCount) implements CoordinationMessage
    {
        public CheckpointAnnounced {
            Objects.requireNonNull(senderId, "senderId");
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(sessionId, "sessionId");
            Objects.requireNonNull(stateDigest, "stateDigest");
        }

        @Override
        public MessageKind kind() {
            return MessageKind.CHECKPOINT;
        }
    }
}
