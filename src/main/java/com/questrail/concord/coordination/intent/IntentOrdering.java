package com.questrail.concord.coordination.intent;

import com.questrail.concord.model.Intent;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Deterministic precedence among conflicting intents, and the round identity
 * derived from a conflict set.
 *
 * <p>Precedence: higher priority first, then earlier creation time, then
 * lexicographically smaller intent id. Every peer holding the same candidates
 * therefore proposes the same winner.</p>
 */
public final class IntentOrdering
{
    public static final Comparator<Intent> PRECEDENCE =
            Comparator.<Intent>comparingInt(Intent::priority).reversed()
                    .thenComparing(Intent::createdAt)
                    .thenComparing(Intent::id);

    private static final String ROUND_PREFIX = "round-";

    private IntentOrdering() {}

    /**
     * @return candidates sorted by {@link #PRECEDENCE}; the first is the winner
     */
    public static List<Intent> rank(List<Intent> candidates) {
        List<Intent> sorted = new ArrayList<>(candidates);
        sorted.sort(PRECEDENCE);
        return sorted;
    }

    /**
     * Round id for a resource and a set of candidate intent ids. Independent of
     * the order the ids are given in.
     */
    public static String roundId(String resourceKey, List<String> candidateIntentIds) {
        List<String> ids = new ArrayList<>(candidateIntentIds);
        ids.sort(Comparator.naturalOrder());

        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }

        sha256.update(resourceKey.getBytes(StandardCharsets.UTF_8));
        for (String id : ids) {
            sha256.update((byte) '\n');
            sha256.update(id.getBytes(StandardCharsets.UTF_8));
        }
        return ROUND_PREFIX + HexFormat.of().formatHex(sha256.digest()).substring(0, 32);
    }
}
