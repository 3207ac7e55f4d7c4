package io.github.jakubt4.pmfusion.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of a membership classification: either a new assignment or an explicit refusal,
 * in which case the caller keeps its previous membership.
 */
public sealed interface MembershipOutcome permits MembershipOutcome.Updated, MembershipOutcome.NoUpdate {

    /**
     * @param members          per input point, whether it scored above the clipping threshold
     * @param logProbabilities per input point, mixture log-probability; {@code null} for points without data
     * @param rounds           recursion rounds run
     * @param converged        {@code false} if the round cap stopped the recursion
     */
    record Updated(List<Boolean> members, List<Double> logProbabilities, int rounds, boolean converged)
            implements MembershipOutcome {

        public Updated {
            members = List.copyOf(members);
            logProbabilities = Collections.unmodifiableList(new ArrayList<>(logProbabilities));
        }
    }

    record NoUpdate(String reason) implements MembershipOutcome {
    }
}
