package com.questrail.concord.internal.decode;

import com.questrail.concord.codec.MessageDecodeException;
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
import com.questrail.concord.message.MessageKind;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CoordinationMessageDecoder
 * ============================================================================
 * Converts a syntactically valid {@link Envelope} into a semantic
 * {@link CoordinationMessage}.
 *
 * <h2>Architectural Role</h2>
 * This is the boundary between the wire shape (string-keyed maps, JSON number
 * types) and the typed messages the coordinators consume. Every required
 * per-kind field is checked here; coordinators never re-validate.
 *
 * <h2>Number handling</h2>
 * Integral fields accept any integral JSON number. Fractional values, strings
 * and booleans are rejected rather than coerced.
 *
 * <h2>What this decoder does NOT do</h2>
 * <ul>
 *   <li>Parse bytes (see {@code MessageCodec})</li>
 *   <li>Resolve unknown kinds (the router drops those first)</li>
 *   <li>Authenticate the sender</li>
 * </ul>
 */
public final class CoordinationMessageDecoder
{
    /**
     * @param kind     resolved message kind
     * @param envelope envelope whose {@code kind} resolved to {@code kind}
     * @return typed message
     * @throws MessageDecodeException if a required field is missing or mistyped
     */
    public CoordinationMessage decode(MessageKind kind, Envelope envelope) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(envelope, "envelope");

        final String sender = envelope.senderId();
        final Instant ts = timestamp(kind, envelope.timestamp());
        final Fields f = new Fields(kind, envelope.payload());

        return switch (kind) {
            case INTENT -> new IntentAnnounced(
                    sender, ts,
                    f.requireString("intentId"),
                    f.requireString("targetResource"),
                    f.requireString("actionDescriptor"),
                    f.requireLong("costEstimate"),
                    f.requireInt("priority"));

            case COORDINATION -> new RoundProposed(
                    sender, ts,
                    f.requireString("roundId"),
                    f.requireString("proposedIntentId"),
                    f.requireString("targetResource"),
                    f.optionalStringList("candidateIntentIds"));

            case PROPOSAL -> new ProposalAnnounced(
                    sender, ts,
                    f.requireString("proposalId"),
                    f.requireString("creatorId"),
                    f.requireMap("payload"),
                    votingDuration(kind, ts, f.requireNonNegativeLong("votingDurationSeconds")));

            case VOTE -> new VoteCast(
                    sender, ts,
                    f.requireString("proposalId"),
                    f.requireBoolean("decision"),
                    f.requireNonNegativeLong("weight"));

            case MOVE -> new MoveMade(
                    sender, ts,
                    f.requireString("sessionId"),
                    f.requireLong("moveSequence"),
                    f.requireMap("movePayload"),
                    f.optionalString("stateDigest"));

            case SESSION_OPENED -> new SessionOpened(
                    sender, ts,
                    f.requireString("sessionId"),
                    f.requireString("sessionType"),
                    f.requireMap("initialState"));

            case SESSION_ENDED -> new SessionEnded(
                    sender, ts,
                    f.requireString("sessionId"));

            case CHECKPOINT -> new CheckpointAnnounced(
                    sender, ts,
                    f.requireString("sessionId"),
                    f.requireNonNegativeLong("sequence"),
                    f.requireString("stateDigest"),
                    f.requireInt("moveCount"));
        };
    }

    private static Instant timestamp(MessageKind kind, long epochSeconds) {
        if (epochSeconds < Instant.MIN.getEpochSecond() || epochSeconds > Instant.MAX.getEpochSecond()) {
            throw new MessageDecodeException(kind.wireName() + ": timestamp " + epochSeconds + " out of range");
        }
        return Instant.ofEpochSecond(epochSeconds);
    }

    // The receiver computes its deadline as ts + duration; that sum must stay a valid Instant.
    private static long votingDuration(MessageKind kind, Instant ts, long seconds) {
        if (seconds > Instant.MAX.getEpochSecond() - ts.getEpochSecond()) {
            throw new MessageDecodeException(
                    kind.wireName() + ": field 'votingDurationSeconds' overflows the voting deadline");
        }
        return seconds;
    }

    // ------------------------------------------------------------------------
    // Field access
    // ------------------------------------------------------------------------

    private static final class Fields
    {
        private final MessageKind kind;
        private final Map<String, Object> payload;

        Fields(MessageKind kind, Map<String, Object> payload) {
            this.kind = kind;
            this.payload = payload;
        }

        String requireString(String name) {
            Object v = require(name);
            if (!(v instanceof String s)) {
                throw mistyped(name, "string");
            }
            return s;
        }

        String optionalString(String name) {
            Object v = payload.get(name);
            if (v == null) {
                return null;
            }
            if (!(v instanceof String s)) {
                throw mistyped(name, "string");
            }
            return s;
        }

        long requireLong(String name) {
            Object v = require(name);
            if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
                return ((Number) v).longValue();
            }
            if (v instanceof BigInteger big && big.bitLength() < 64) {
                return big.longValue();
            }
            throw mistyped(name, "integer");
        }

        long requireNonNegativeLong(String name) {
            long v = requireLong(name);
            if (v < 0) {
                throw new MessageDecodeException(kind.wireName() + ": field '" + name + "' must be >= 0");
            }
            return v;
        }

        int requireInt(String name) {
            long v = requireLong(name);
            if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                throw mistyped(name, "32-bit integer");
            }
            return (int) v;
        }

        boolean requireBoolean(String name) {
            Object v = require(name);
            if (!(v instanceof Boolean b)) {
                throw mistyped(name, "boolean");
            }
            return b;
        }

        Map<String, Object> requireMap(String name) {
            Object v = require(name);
            if (!(v instanceof Map<?, ?> m)) {
                throw mistyped(name, "object");
            }
            Map<String, Object> copy = new LinkedHashMap<>();
            m.forEach((k, val) -> copy.put(String.valueOf(k), val));
            return copy;
        }

        List<String> optionalStringList(String name) {
            Object v = payload.get(name);
            if (v == null) {
                return List.of();
            }
            if (!(v instanceof List<?> list)) {
                throw mistyped(name, "array");
            }
            List<String> out = new ArrayList<>(list.size());
            for (Object item : list) {
                if (!(item instanceof String s)) {
                    throw mistyped(name, "array of strings");
                }
                out.add(s);
            }
            return out;
        }

        private Object require(String name) {
            Object v = payload.get(name);
            if (v == null) {
                throw new MessageDecodeException(kind.wireName() + ": missing required field '" + name + "'");
            }
            return v;
        }

        private MessageDecodeException mistyped(String name, String expected) {
            return new MessageDecodeException(kind.wireName() + ": field '" + name + "' is not a " + expected);
        }
    }
}
