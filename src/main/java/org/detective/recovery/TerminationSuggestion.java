package org.detective.recovery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Minimal set of processes whose termination leaves the rest deadlock-free.
 */
@Value
@Builder
public class TerminationSuggestion implements RecoverySuggestion {
    /** Terminated process ids, ascending. */
    @Singular("terminated")
    List<Integer> processIds;
    /** Available vector after the terminated allocations are released. */
    @Singular("releasedAvailable")
    List<Integer> availableAfterRelease;
    /** Surviving process ids in original id space, ascending. */
    @Singular("remaining")
    List<Integer> remainingProcessIds;
    /** Safe sequence of the survivors in original id space (reachability mode only). */
    @Singular("remainderStep")
    List<Integer> remainderSequence;

    @Override
    public Kind kind() {
        return Kind.TERMINATION;
    }

    @Override
    public List<Integer> affectedProcessIds() {
        return processIds;
    }

    @Override
    public String description() {
        return "Terminate " + processIds.size() + " process(es): "
                + processIds.stream().map(pid -> "P" + pid).collect(Collectors.joining(", "));
    }
}
