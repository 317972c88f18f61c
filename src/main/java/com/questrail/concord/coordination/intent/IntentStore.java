package com.questrail.concord.coordination.intent;

import com.questrail.concord.model.CoordinationRound;
import com.questrail.concord.model.Intent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory intents and coordination rounds of one peer, owned by its
 * {@link IntentCoordinator}. Not thread-safe.
 */
public final class IntentStore
{
    private final Map<String, Intent> intents = new LinkedHashMap<>();
    private final Map<String, List<Intent>> byResource = new LinkedHashMap<>();
    private final Map<String, CoordinationRound> rounds = new LinkedHashMap<>();

    /**
     * @return {@code false} if an intent with the same id is already stored
     */
    public boolean add(Intent intent) {
        Objects.requireNonNull(intent, "intent");
        if (intents.putIfAbsent(intent.id(), intent) != null) {
            return false;
        }
        byResource.computeIfAbsent(intent.resourceKey(), k -> new ArrayList<>()).add(intent);
        return true;
    }

    public Optional<Intent> intent(String intentId) {
        return Optional.ofNullable(intents.get(intentId));
    }

    public List<Intent> intentsFor(String resourceKey) {
        return Collections.unmodifiableList(byResource.getOrDefault(resourceKey, List.of()));
    }

    public Collection<Intent> intents() {
        return Collections.unmodifiableCollection(intents.values());
    }

    public void addRound(CoordinationRound round) {
        Objects.requireNonNull(round, "round");
        if (rounds.putIfAbsent(round.id(), round) != null) {
            throw new IllegalStateException("Round already stored: " + round.id());
        }
    }

    public Optional<CoordinationRound> round(String roundId) {
        return Optional.ofNullable(rounds.get(roundId));
    }

    public Collection<CoordinationRound> rounds() {
        return Collections.unmodifiableCollection(rounds.values());
    }
}
