package org.detective.recovery;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.extern.slf4j.Slf4j;
import org.detective.core.DetectionPreconditionException;
import org.detective.core.SearchBoundException;
import org.detective.core.state.SystemState;
import org.detective.detection.DeadlockDetector;
import org.detective.detection.DetectionMode;
import org.detective.detection.DetectionResult;
import org.detective.detection.ReachabilityDetector;
import org.detective.detection.WaitForDetector;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes recovery suggestions for a deadlocked detection result.
 *
 * <p>Termination search visits subsets of the deadlocked set in increasing size and, within a
 * size, lexicographic pid order. Each subset is checked by re-running the detector of the result's
 * mode on the reduced state. Every subset of the smallest succeeding size is reported. The search
 * is bounded by {@link RecoveryConfig}; exceeding a bound throws {@link SearchBoundException}
 * rather than returning a partial answer.</p>
 *
 * <p>Preemption proposals move instances held by one deadlocked process to another deadlocked
 * process that requests them. When simulation is enabled each proposal is applied to a hypothetical
 * state and re-detected; only proposals that shrink the deadlocked set are marked verified.</p>
 */
@Slf4j
public final class RecoveryEngine {
    public static final String REASON_RESULT_REQUIRED = "RECOVERY_RESULT_REQUIRED";
    public static final String REASON_STATE_REQUIRED = "RECOVERY_STATE_REQUIRED";
    public static final String REASON_RESULT_NOT_DEADLOCKED = "RECOVERY_RESULT_NOT_DEADLOCKED";
    public static final String REASON_STATE_MISMATCH = "RECOVERY_STATE_MISMATCH";
    public static final String REASON_MODE_MISMATCH = "RECOVERY_MODE_MISMATCH";
    public static final String REASON_DEADLOCK_SET_TOO_LARGE = "RECOVERY_DEADLOCK_SET_TOO_LARGE";
    public static final String REASON_SUBSET_BUDGET_EXCEEDED = "RECOVERY_SUBSET_BUDGET_EXCEEDED";

    private final DeadlockDetector waitForDetector;
    private final DeadlockDetector reachabilityDetector;
    private final RecoveryConfig config;

    /**
     * Creates an engine with default detectors and {@link RecoveryConfig#defaults()}.
     */
    public RecoveryEngine() {
        this(new WaitForDetector(), new ReachabilityDetector(), RecoveryConfig.defaults());
    }

    /**
     * Creates an engine with default detectors and explicit configuration.
     */
    public RecoveryEngine(RecoveryConfig config) {
        this(new WaitForDetector(), new ReachabilityDetector(), config);
    }

    /**
     * Creates an engine with explicit detectors and configuration.
     *
     * @param waitForDetector detector used to re-check wait-for mode results.
     * @param reachabilityDetector detector used to re-check reachability mode results.
     * @param config search bounds and preemption behavior.
     */
    public RecoveryEngine(
            DeadlockDetector waitForDetector,
            DeadlockDetector reachabilityDetector,
            RecoveryConfig config
    ) {
        this.waitForDetector = Objects.requireNonNull(waitForDetector, "waitForDetector");
        this.reachabilityDetector = Objects.requireNonNull(reachabilityDetector, "reachabilityDetector");
        this.config = Objects.requireNonNull(config, "config");
        if (waitForDetector.mode() != DetectionMode.WAIT_FOR) {
            throw new IllegalArgumentException("waitForDetector must implement WAIT_FOR, got " + waitForDetector.mode());
        }
        if (reachabilityDetector.mode() != DetectionMode.REACHABILITY) {
            throw new IllegalArgumentException(
                    "reachabilityDetector must implement REACHABILITY, got " + reachabilityDetector.mode());
        }
    }

    public RecoveryConfig config() {
        return config;
    }

    /**
     * Computes termination and preemption suggestions.
     *
     * @param state state the result was computed on.
     * @param result deadlocked detection result.
     * @return all minimal termination sets plus preemption proposals.
     * @throws DetectionPreconditionException when the result is not deadlocked, does not fit the state,
     * or is a wait-for result for a multi-instance state.
     * @throws SearchBoundException when the termination search exceeds its configured bound.
     */
    public RecoveryPlan recover(SystemState state, DetectionResult result) {
        validateInputs(state, result);
        int[] deadlocked = toArray(result.getDeadlockedProcessIds());

        RecoveryPlan.RecoveryPlanBuilder plan = RecoveryPlan.builder()
                .mode(result.getMode())
                .deadlockedProcessIds(result.getDeadlockedProcessIds());

        long evaluated = findMinimalTerminations(state, result.getMode(), deadlocked, plan);
        plan.evaluatedSubsets(evaluated);
        suggestPreemptions(state, result, deadlocked, plan);

        RecoveryPlan built = plan.build();
        log.debug("recovery: {} minimal termination set(s) of size {}, {} preemption(s), {} subsets evaluated",
                built.getTerminations().size(),
                built.minimalTerminationSize(),
                built.getPreemptions().size(),
                evaluated);
        return built;
    }

    /**
     * Checks whether terminating one given set leaves the remaining processes deadlock-free.
     *
     * @param state analyzed state.
     * @param mode detector used for the check.
     * @param terminatedPids processes to terminate.
     * @return true when nothing remains deadlocked (or nothing remains).
     */
    public boolean canRecover(SystemState state, DetectionMode mode, int... terminatedPids) {
        if (state == null) {
            throw new DetectionPreconditionException(REASON_STATE_REQUIRED, "state must be non-null");
        }
        Objects.requireNonNull(mode, "mode");
        requireModeFits(state, mode);
        IntSortedSet terminated = new IntRBTreeSet();
        for (int pid : terminatedPids) {
            if (pid < 0 || pid >= state.processCount()) {
                throw new DetectionPreconditionException(
                        REASON_STATE_MISMATCH, "terminated pid " + pid + " is outside state with "
                        + state.processCount() + " processes");
            }
            terminated.add(pid);
        }
        ReducedState reduced = ReducedState.terminate(state, terminated.toIntArray());
        return reduced.empty() || !detectorFor(mode).detect(reduced.state()).isDeadlocked();
    }

    private long findMinimalTerminations(
            SystemState state,
            DetectionMode mode,
            int[] deadlocked,
            RecoveryPlan.RecoveryPlanBuilder plan
    ) {
        if (deadlocked.length > config.getMaxDeadlockedSetSize()) {
            throw new SearchBoundException(
                    REASON_DEADLOCK_SET_TOO_LARGE,
                    "deadlocked set too large for exhaustive minimal-set search: "
                            + deadlocked.length + " > " + config.getMaxDeadlockedSetSize()
            );
        }

        DeadlockDetector detector = detectorFor(mode);
        CombinationCursor cursor = new CombinationCursor(deadlocked.length);
        long evaluated = 0L;
        int found = 0;
        int[] subset = new int[deadlocked.length];
        do {
            while (cursor.hasNextInSize()) {
                int[] indices = cursor.nextInSize();
                evaluated++;
                if (evaluated > config.getMaxSubsetEvaluations()) {
                    throw new SearchBoundException(
                            REASON_SUBSET_BUDGET_EXCEEDED,
                            "termination search exceeded " + config.getMaxSubsetEvaluations()
                                    + " subset evaluations at size " + cursor.size()
                    );
                }
                for (int k = 0; k < indices.length; k++) {
                    subset[k] = deadlocked[indices[k]];
                }
                int[] terminated = Arrays.copyOf(subset, indices.length);
                TerminationSuggestion suggestion = tryTermination(state, detector, mode, terminated);
                if (suggestion != null) {
                    plan.termination(suggestion);
                    found++;
                }
            }
        } while (found == 0 && cursor.advanceSize());
        return evaluated;
    }

    private TerminationSuggestion tryTermination(
            SystemState state,
            DeadlockDetector detector,
            DetectionMode mode,
            int[] terminated
    ) {
        ReducedState reduced = ReducedState.terminate(state, terminated);
        TerminationSuggestion.TerminationSuggestionBuilder suggestion = TerminationSuggestion.builder();
        for (int pid : terminated) {
            suggestion.terminated(pid);
        }
        for (int value : reduced.availableAfterRelease()) {
            suggestion.releasedAvailable(value);
        }
        if (reduced.empty()) {
            return suggestion.build();
        }

        DetectionResult remainder = detector.detect(reduced.state());
        if (remainder.isDeadlocked()) {
            return null;
        }
        for (int originalPid : reduced.originalPids()) {
            suggestion.remaining(originalPid);
        }
        if (mode == DetectionMode.REACHABILITY) {
            suggestion.remainderSequence(reduced.toOriginal(remainder.getSafeSequence()));
        }
        return suggestion.build();
    }

    private void suggestPreemptions(
            SystemState state,
            DetectionResult result,
            int[] deadlocked,
            RecoveryPlan.RecoveryPlanBuilder plan
    ) {
        DeadlockDetector detector = detectorFor(result.getMode());
        for (int donor : deadlocked) {
            for (int rid = 0; rid < state.resourceCount(); rid++) {
                int held = state.allocation(donor, rid);
                if (held == 0) {
                    continue;
                }
                for (int recipient : deadlocked) {
                    if (recipient == donor || state.request(recipient, rid) == 0) {
                        continue;
                    }
                    int units = Math.min(held, state.request(recipient, rid));
                    plan.preemption(evaluatePreemption(state, result, detector, rid, donor, recipient, units));
                }
            }
        }
    }

    private PreemptionSuggestion evaluatePreemption(
            SystemState state,
            DetectionResult before,
            DeadlockDetector detector,
            int rid,
            int donor,
            int recipient,
            int units
    ) {
        PreemptionSuggestion.PreemptionSuggestionBuilder suggestion = PreemptionSuggestion.builder()
                .resourceId(rid)
                .donorProcessId(donor)
                .recipientProcessId(recipient)
                .units(units);
        if (!config.isSimulatePreemption()) {
            return suggestion.status(PreemptionStatus.SPECULATIVE).build();
        }

        DetectionResult after = detector.detect(transfer(state, rid, donor, recipient, units));
        IntArrayList unblocked = new IntArrayList();
        for (int pid : before.getDeadlockedProcessIds()) {
            if (!after.isDeadlocked(pid)) {
                unblocked.add(pid);
            }
        }
        return suggestion
                .outcome(after)
                .unblockedProcessIds(unblocked)
                .status(unblocked.isEmpty() ? PreemptionStatus.SPECULATIVE : PreemptionStatus.VERIFIED)
                .build();
    }

    /**
     * Applies one hypothetical transfer. The instances move directly between the two processes,
     * so available is unchanged and conservation still holds.
     */
    static SystemState transfer(SystemState state, int rid, int donor, int recipient, int units) {
        int[][] allocation = state.allocationMatrix();
        int[][] request = state.requestMatrix();
        allocation[donor][rid] -= units;
        allocation[recipient][rid] += units;
        request[recipient][rid] -= units;
        return SystemState.of(
                state.processes(),
                state.resourceTypes(),
                state.availableVector(),
                allocation,
                request
        );
    }

    private DeadlockDetector detectorFor(DetectionMode mode) {
        return switch (mode) {
            case WAIT_FOR -> waitForDetector;
            case REACHABILITY -> reachabilityDetector;
        };
    }

    private static void validateInputs(SystemState state, DetectionResult result) {
        if (state == null) {
            throw new DetectionPreconditionException(REASON_STATE_REQUIRED, "state must be non-null");
        }
        if (result == null) {
            throw new DetectionPreconditionException(REASON_RESULT_REQUIRED, "detection result must be non-null");
        }
        if (result.getMode() == null) {
            throw new DetectionPreconditionException(REASON_RESULT_REQUIRED, "detection result must carry its mode");
        }
        if (!result.isDeadlocked()) {
            throw new DetectionPreconditionException(
                    REASON_RESULT_NOT_DEADLOCKED, "recovery requires a deadlocked detection result");
        }
        if (result.isSingleInstanceState() != state.isSingleInstance()) {
            throw new DetectionPreconditionException(
                    REASON_MODE_MISMATCH,
                    "detection result was computed on a "
                            + (result.isSingleInstanceState() ? "single" : "multi")
                            + "-instance state but the given state is "
                            + (state.isSingleInstance() ? "single" : "multi") + "-instance"
            );
        }
        requireModeFits(state, result.getMode());
        int previous = -1;
        for (int pid : result.getDeadlockedProcessIds()) {
            if (pid < 0 || pid >= state.processCount()) {
                throw new DetectionPreconditionException(
                        REASON_STATE_MISMATCH,
                        "deadlocked pid " + pid + " is outside state with " + state.processCount() + " processes"
                );
            }
            if (pid <= previous) {
                throw new DetectionPreconditionException(
                        REASON_STATE_MISMATCH,
                        "deadlocked pids must be strictly ascending, got " + result.getDeadlockedProcessIds()
                );
            }
            previous = pid;
        }
    }

    /**
     * Rejects wait-for re-detection on a multi-instance state.
     */
    private static void requireModeFits(SystemState state, DetectionMode mode) {
        if (mode == DetectionMode.WAIT_FOR && !state.isSingleInstance()) {
            throw new DetectionPreconditionException(
                    REASON_MODE_MISMATCH,
                    "wait-for recovery requested on a multi-instance state; use " + DetectionMode.REACHABILITY
            );
        }
    }

    private static int[] toArray(List<Integer> values) {
        int[] array = new int[values.size()];
        for (int k = 0; k < array.length; k++) {
            array[k] = values.get(k);
        }
        return array;
    }
}
