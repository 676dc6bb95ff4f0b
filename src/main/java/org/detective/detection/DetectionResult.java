package org.detective.detection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one detection run.
 *
 * <p>Process and resource ids are the 0-based ids of the analyzed state, so a caller can index
 * its own display arrays with them. {@code deadlockedProcessIds} is ascending and empty exactly
 * when {@code deadlocked} is false.</p>
 */
@Value
@Builder
public class DetectionResult {
    /** Detector that produced this result. */
    DetectionMode mode;
    /** Whether any process is deadlocked. */
    boolean deadlocked;
    /** Whether the analyzed state had single-instance resources only. */
    boolean singleInstanceState;
    /** Deadlocked process ids, ascending. */
    @Singular("deadlockedProcess")
    List<Integer> deadlockedProcessIds;
    /** Ordered, replayable record of algorithm steps. */
    @Singular("step")
    List<TraceStep> trace;
    /** Wait-for edges in construction order (wait-for mode only). */
    @Singular("waitForEdge")
    List<WaitForEdge> waitForEdges;
    /** Elementary cycles in discovery order (wait-for mode only). */
    @Singular("cycle")
    List<WaitCycle> cycles;
    /** Processes in the order they finished (reachability mode only). */
    @Singular("finished")
    List<Integer> safeSequence;
    /** Work vector when the simulation stopped (reachability mode only). */
    @Singular("work")
    List<Integer> finalWork;

    /**
     * Returns whether one process is in the deadlocked set.
     */
    public boolean isDeadlocked(int pid) {
        return deadlockedProcessIds.contains(pid);
    }
}
