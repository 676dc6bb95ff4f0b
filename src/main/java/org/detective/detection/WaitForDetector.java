package org.detective.detection;

import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import lombok.extern.slf4j.Slf4j;
import org.detective.core.state.SystemState;

import java.util.List;
import java.util.Objects;

/**
 * Wait-for graph detector for single-instance resource systems.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Derive the labeled wait-for relation from request and allocation.</li>
 * <li>Enumerate every elementary cycle in ascending start-pid order.</li>
 * <li>Report the union of cycle members as the deadlocked set.</li>
 * </ul>
 * <p>Only processes on a cycle are reported. A process that waits on a cycle member without being
 * on a cycle itself is blocked but not deadlocked in this mode.</p>
 *
 * <p>On a multi-instance state the detector still runs, but the trace opens with a warning: a
 * cycle there is only a possible deadlock and an acyclic relation does not prove safety.</p>
 */
@Slf4j
public final class WaitForDetector implements DeadlockDetector {
    private final DetectionBudget budget;

    /**
     * Creates a detector bounded by {@link DetectionBudget#defaults()}.
     */
    public WaitForDetector() {
        this(DetectionBudget.defaults());
    }

    /**
     * Creates a detector with an explicit cycle-enumeration budget.
     */
    public WaitForDetector(DetectionBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public DetectionMode mode() {
        return DetectionMode.WAIT_FOR;
    }

    @Override
    public DetectionResult detect(SystemState state) {
        Objects.requireNonNull(state, "state");
        TraceLog trace = new TraceLog();
        trace.add(TraceKind.HEADER, "=== Wait-For Graph Deadlock Detection ===");
        trace.add(TraceKind.HEADER,
                "System: " + state.processCount() + " processes, " + state.resourceCount() + " resource types");

        boolean singleInstance = state.isSingleInstance();
        if (!singleInstance) {
            log.warn("wait-for detection invoked on a multi-instance state ({} resource types); "
                    + "cycles only indicate possible deadlock", state.resourceCount());
            trace.add(TraceKind.WARNING, "WARNING: not all resource types have a single instance; "
                    + "wait-for cycles may over- or under-report deadlock, use reachability detection instead");
        }

        trace.add(TraceKind.HEADER, "Step 1: Building Wait-For Graph");
        WaitForGraph graph = WaitForGraph.build(state);
        DetectionResult.DetectionResultBuilder result = DetectionResult.builder()
                .mode(DetectionMode.WAIT_FOR)
                .singleInstanceState(singleInstance)
                .waitForEdges(graph.edges());

        if (graph.edges().isEmpty()) {
            trace.add(TraceKind.EDGE, "  No wait-for edges found (no process is waiting on a held resource).");
            trace.add(TraceKind.RESULT, "Result: NO DEADLOCK");
            log.debug("wait-for detection: no edges across {} processes", state.processCount());
            return result.deadlocked(false).trace(trace.steps()).build();
        }
        for (WaitForEdge edge : graph.edges()) {
            trace.add(TraceKind.EDGE, edge.getFromPid(), edge.getResourceId(), "  " + describe(state, edge));
        }

        trace.add(TraceKind.HEADER, "Step 2: Detecting Cycles using DFS");
        List<WaitCycle> cycles = new CycleEnumerator(graph, budget).enumerate();
        if (cycles.isEmpty()) {
            trace.add(TraceKind.CYCLE, "  No cycles found in wait-for graph.");
            trace.add(TraceKind.RESULT, "Result: NO DEADLOCK");
            log.debug("wait-for detection: {} edges, acyclic", graph.edges().size());
            return result.deadlocked(false).trace(trace.steps()).build();
        }

        IntSortedSet deadlocked = new IntRBTreeSet();
        for (WaitCycle cycle : cycles) {
            deadlocked.addAll(cycle.getProcessIds());
            trace.add(TraceKind.CYCLE, cycle.getProcessIds().get(0), cycle.getResourceIds().get(0),
                    "  Cycle: " + describe(state, cycle));
        }

        trace.add(TraceKind.HEADER, "Step 3: Deadlocked Processes");
        trace.add(TraceKind.RESULT, "  Processes in cycles: " + describeSet(state, deadlocked));
        trace.add(TraceKind.RESULT, "Result: DEADLOCK DETECTED");
        log.debug("wait-for detection: {} cycles, deadlocked {}", cycles.size(), deadlocked);

        return result.deadlocked(true)
                .deadlockedProcessIds(deadlocked)
                .cycles(cycles)
                .trace(trace.steps())
                .build();
    }

    private static String describe(SystemState state, WaitForEdge edge) {
        return state.process(edge.getFromPid()).getName()
                + " -> " + state.process(edge.getToPid()).getName()
                + " (" + state.resourceType(edge.getResourceId()).getName() + ")";
    }

    private static String describe(SystemState state, WaitCycle cycle) {
        StringBuilder text = new StringBuilder();
        List<Integer> closedPath = cycle.closedPath();
        for (int k = 0; k < closedPath.size(); k++) {
            if (k > 0) {
                text.append(" -> ");
            }
            text.append(state.process(closedPath.get(k)).getName());
        }
        return text.toString();
    }

    static String describeSet(SystemState state, Iterable<Integer> pids) {
        StringBuilder text = new StringBuilder("{");
        boolean first = true;
        for (int pid : pids) {
            if (!first) {
                text.append(", ");
            }
            text.append(state.process(pid).getName());
            first = false;
        }
        return text.append('}').toString();
    }
}
