package com.questrail.concord.coordination.voting;

import com.questrail.concord.model.Proposal;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory proposals of one peer, owned by its {@link VotingCoordinator}.
 * Not thread-safe.
 */
public final class ProposalStore
{
    private final Map<String, Proposal> proposals = new LinkedHashMap<>();

    /**
     * @return {@code false} if a proposal with the same id is already stored
     */
    public boolean add(Proposal proposal) {
        Objects.requireNonNull(proposal, "proposal");
        return proposals.putIfAbsent(proposal.id(), proposal) == null;
    }

    public Optional<Proposal> proposal(String proposalId) {
        return Optional.ofNullable(proposals.get(proposalId));
    }

    public List<Proposal> active() {
        return proposals.values().stream().filter(Proposal::isActive).collect(Collectors.toList());
    }

    public Collection<Proposal> proposals() {
        return Collections.unmodifiableCollection(proposals.values());
    }
}
