package com.questrail.concord.internal.encode;

import com.questrail.concord.message.CoordinationMessage;
import com.questrail.concord.message.CoordinationMessage.CheckpointAnnounced;
import com.questrail.concord.message.CoordinationMessage.IntentAnnounced;
import com.questrail.concord.message.CoordinationMessage.MoveMade;
import com.questrail.concord.message.CoordinationMessage.ProposalAnnounced;
import com.questrail.concord.message.CoordinationMessage.RoundProposed;
import com.questrail.concord.message.CoordinationMessage.SessionEnded;
import com.questrail.concord.message.CoordinationMessage.SessionOpened;
import com.questrail.concord.message.CoordinationMessage.VoteCast;
import com.questrail.concord.message.Envelope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * CoordinationMessageEncoder
 * ============================================================================
 * Converts a semantic {@link CoordinationMessage} into its wire
 * {@link Envelope}. The inverse of
 * {@link com.questrail.concord.internal.decode.CoordinationMessageDecoder}.
 *
 * <p>Field names are the wire contract and must not be renamed.</p>
 */
public final class CoordinationMessageEncoder
{
    public Envelope encode(CoordinationMessage message) {
        Objects.requireNonNull(message, "message");

        Map<String, Object> p = new LinkedHashMap<>();

        if (message instanceof IntentAnnounced m) {
            p.put("intentId", m.intentId());
            p.put("targetResource", m.targetResource());
            p.put("actionDescriptor", m.actionDescriptor());
            p.put("costEstimate", m.costEstimate());
            p.put("priority", m.priority());
        }
        else if (message instanceof RoundProposed m) {
            p.put("roundId", m.roundId());
            p.put("proposedIntentId", m.proposedIntentId());
            p.put("targetResource", m.targetResource());
            if (!m.candidateIntentIds().isEmpty()) {
                p.put("candidateIntentIds", m.candidateIntentIds());
            }
        }
        else if (message instanceof ProposalAnnounced m) {
            p.put("proposalId", m.proposalId());
            p.put("creatorId", m.creatorId());
            p.put("payload", m.payload());
            p.put("votingDurationSeconds", m.votingDurationSeconds());
        }
        else if (message instanceof VoteCast m) {
            p.put("proposalId", m.proposalId());
            p.put("decision", m.decision());
            p.put("weight", m.weight());
        }
        else if (message instanceof MoveMade m) {
            p.put("sessionId", m.sessionId());
            p.put("moveSequence", m.moveSequence());
            p.put("movePayload", m.movePayload());
            m.optionalStateDigest().ifPresent(d -> p.put("stateDigest", d));
        }
        else if (message instanceof SessionOpened m) {
            p.put("sessionId", m.sessionId());
            p.put("sessionType", m.sessionType());
            p.put("initialState", m.initialState());
        }
        else if (message instanceof SessionEnded m) {
            p.put("sessionId", m.sessionId());
        }
        else if (message instanceof CheckpointAnnounced m) {
            p.put("sessionId", m.sessionId());
            p.put("sequence", m.sequence());
            p.put("stateDigest", m.stateDigest());
            p.put("moveCount", m.moveCount());
        }
        else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass().getName());
        }

        return new Envelope(
                message.kind().wireName(),
                message.senderId(),
                message.timestamp().getEpochSecond(),
                p);
    }
}
