package org.detective.recovery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.detective.detection.DetectionMode;

import java.util.ArrayList;
import java.util.List;

/**
 * All recovery suggestions for one deadlocked result.
 */
@Value
@Builder
public class RecoveryPlan {
    /** Detection mode used for every re-detection. */
    DetectionMode mode;
    /** Deadlocked set the plan was computed for, ascending. */
    @Singular("deadlocked")
    List<Integer> deadlockedProcessIds;
    /** Every minimal termination set, lexicographic by pid. */
    @Singular("termination")
    List<TerminationSuggestion> terminations;
    /** Preemption proposals ordered by donor, resource, recipient. */
    @Singular("preemption")
    List<PreemptionSuggestion> preemptions;
    /** Number of candidate subsets the termination search evaluated. */
    long evaluatedSubsets;

    /**
     * Size of the minimal termination sets, or 0 when none were found.
     */
    public int minimalTerminationSize() {
        return terminations.isEmpty() ? 0 : terminations.get(0).getProcessIds().size();
    }

    /**
     * Only the preemption suggestions proven to unblock a process.
     */
    public List<PreemptionSuggestion> verifiedPreemptions() {
        List<PreemptionSuggestion> verified = new ArrayList<>();
        for (PreemptionSuggestion suggestion : preemptions) {
            if (suggestion.isVerified()) {
                verified.add(suggestion);
            }
        }
        return List.copyOf(verified);
    }

    /**
     * Terminations first, then preemptions.
     */
    public List<RecoverySuggestion> allSuggestions() {
        List<RecoverySuggestion> all = new ArrayList<>(terminations.size() + preemptions.size());
        all.addAll(terminations);
        all.addAll(preemptions);
        return List.copyOf(all);
    }
}
