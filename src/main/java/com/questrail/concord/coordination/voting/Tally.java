package com.questrail.concord.coordination.voting;

import com.questrail.concord.model.VoteRecord;

import java.util.Collection;

/**
 * Weighted vote totals of a proposal.
 *
 * @param voteCount   number of vote slots filled
 * @param yesWeight   sum of weights voting yes
 * @param noWeight    sum of weights voting no
 * @param totalWeight {@code yesWeight + noWeight}
 */
public record Tally(int voteCount, long yesWeight, long noWeight, long totalWeight)
{
    public static Tally of(Collection<VoteRecord> votes) {
        long yes = 0;
        long no = 0;
        for (VoteRecord vote : votes) {
            if (vote.decision()) {
                yes += vote.weight();
            } else {
                no += vote.weight();
            }
        }
        return new Tally(votes.size(), yes, no, yes + no);
    }

    /** Strict weighted majority; a tie rejects. */
    public boolean passes() {
        return yesWeight > noWeight;
    }
}
