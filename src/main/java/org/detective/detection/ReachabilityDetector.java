package org.detective.detection;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.detective.core.state.SystemState;

import java.util.Arrays;
import java.util.Objects;

/**
 * Work/finish reachability detector (generalized Banker's reduction).
 *
 * <p>Starting from {@code Work = Available}, the scan grants the lowest-pid unfinished process whose
 * request fits element-wise in {@code Work}, adds its allocation back to {@code Work}, and restarts
 * from pid 0. The simulation stops when a full scan grants nothing. Unfinished processes at that
 * point form the deadlocked set; otherwise the grant order is a safe sequence.</p>
 *
 * <p>Every comparison is recorded, so the trace replays the exact scan. All arithmetic is on
 * non-negative integers.</p>
 */
@Slf4j
public final class ReachabilityDetector implements DeadlockDetector {

    @Override
    public DetectionMode mode() {
        return DetectionMode.REACHABILITY;
    }

    @Override
    public DetectionResult detect(SystemState state) {
        Objects.requireNonNull(state, "state");
        int n = state.processCount();
        TraceLog trace = new TraceLog();
        trace.add(TraceKind.HEADER, "=== Matrix-Based Deadlock Detection ===");
        trace.add(TraceKind.HEADER, "System: " + n + " processes, " + state.resourceCount() + " resource types");

        int[] work = state.availableVector();
        boolean[] finish = new boolean[n];
        IntArrayList safeSequence = new IntArrayList(n);
        trace.add(TraceKind.INITIALIZE, "Step 1: Work = Available = " + Arrays.toString(work)
                + ", Finish[i] = false for all " + n + " processes");

        trace.add(TraceKind.HEADER, "Step 2: Find processes that can complete");
        int granted;
        do {
            granted = scanOnce(state, work, finish, trace);
            if (granted >= 0) {
                safeSequence.add(granted);
            }
        } while (granted >= 0);

        trace.add(TraceKind.HEADER, "Step 3: Check for Deadlock");
        DetectionResult.DetectionResultBuilder result = DetectionResult.builder()
                .mode(DetectionMode.REACHABILITY)
                .singleInstanceState(state.isSingleInstance())
                .safeSequence(safeSequence);
        for (int value : work) {
            result.work(value);
        }

        IntArrayList deadlocked = new IntArrayList();
        for (int i = 0; i < n; i++) {
            if (!finish[i]) {
                deadlocked.add(i);
                trace.add(TraceKind.BLOCKED, i, firstUnsatisfied(state.requestRow(i), work),
                        "  " + state.process(i).getName() + ": Request = " + Arrays.toString(state.requestRow(i))
                                + " > Work = " + Arrays.toString(work) + " (cannot be satisfied)");
            }
        }

        if (deadlocked.isEmpty()) {
            trace.add(TraceKind.RESULT, "  All processes finished (Finish[i] = true for all i)");
            trace.add(TraceKind.RESULT, "Result: NO DEADLOCK");
            trace.add(TraceKind.RESULT, "  Safe execution sequence: " + describeSequence(state, safeSequence));
            log.debug("reachability detection: safe sequence {}", safeSequence);
            return result.deadlocked(false).trace(trace.steps()).build();
        }

        trace.add(TraceKind.RESULT, "Result: DEADLOCK DETECTED");
        trace.add(TraceKind.RESULT, "  Deadlocked processes: " + WaitForDetector.describeSet(state, deadlocked));
        log.debug("reachability detection: deadlocked {} after finishing {}", deadlocked, safeSequence);
        return result.deadlocked(true)
                .deadlockedProcessIds(deadlocked)
                .trace(trace.steps())
                .build();
    }

    /**
     * Scans unfinished processes in ascending pid order and grants the first one that fits.
     *
     * @return granted pid, or {@code -1} when the scan made no progress.
     */
    private static int scanOnce(SystemState state, int[] work, boolean[] finish, TraceLog trace) {
        for (int i = 0; i < finish.length; i++) {
            if (finish[i]) {
                continue;
            }
            int[] request = state.requestRow(i);
            boolean fits = fitsWithin(request, work);
            trace.add(TraceKind.CHECK, i, fits ? TraceLog.NONE : firstUnsatisfied(request, work),
                    "  Check " + state.process(i).getName() + ": Request[" + i + "] = " + Arrays.toString(request)
                            + (fits ? " <= " : " not <= ") + "Work = " + Arrays.toString(work));
            if (!fits) {
                continue;
            }
            int[] allocation = state.allocationRow(i);
            String before = Arrays.toString(work);
            addInto(work, allocation);
            finish[i] = true;
            trace.add(TraceKind.GRANT, i, TraceLog.NONE,
                    "  " + state.process(i).getName() + " finishes and releases Allocation[" + i + "] = "
                            + Arrays.toString(allocation) + "; Work = " + before + " + "
                            + Arrays.toString(allocation) + " = " + Arrays.toString(work));
            return i;
        }
        return -1;
    }

    /**
     * Element-wise {@code a <= b}; one failing component fails the comparison.
     */
    static boolean fitsWithin(int[] a, int[] b) {
        for (int j = 0; j < a.length; j++) {
            if (a[j] > b[j]) {
                return false;
            }
        }
        return true;
    }

    private static int firstUnsatisfied(int[] request, int[] work) {
        for (int j = 0; j < request.length; j++) {
            if (request[j] > work[j]) {
                return j;
            }
        }
        return TraceLog.NONE;
    }

    private static void addInto(int[] target, int[] addend) {
        for (int j = 0; j < target.length; j++) {
            target[j] = Math.addExact(target[j], addend[j]);
        }
    }

    private static String describeSequence(SystemState state, IntArrayList sequence) {
        StringBuilder text = new StringBuilder();
        for (int k = 0; k < sequence.size(); k++) {
            if (k > 0) {
                text.append(" -> ");
            }
            text.append(state.process(sequence.getInt(k)).getName());
        }
        return text.toString();
    }
}
