package org.detective.detection;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Enumerates every elementary cycle of a wait-for graph (Johnson's circuit search).
 *
 * <p>For each start vertex {@code s} in ascending order, a depth-first search restricted to
 * vertices {@code >= s} reports each path that returns to {@code s}. Two markers are kept per
 * vertex: {@code onPath} for the current DFS stack and {@code blocked} for vertices already known
 * not to lead back to {@code s} on the current path. Successors are visited in ascending order,
 * so the cycle list is reproducible for identical inputs. The DFS runs on an explicit frame stack.</p>
 *
 * <p>Not thread-safe; create one per detection call.</p>
 */
final class CycleEnumerator {
    private final WaitForGraph graph;
    private final DetectionBudget budget;

    private final boolean[] blocked;
    private final boolean[] onPath;
    private final IntArrayList[] blockedBy;

    private final IntArrayList path = new IntArrayList();
    private final IntArrayList cursor = new IntArrayList();
    private final BooleanArrayList closedCycle = new BooleanArrayList();
    private final IntArrayList unblockStack = new IntArrayList();

    private final List<WaitCycle> cycles = new ArrayList<>();

    CycleEnumerator(WaitForGraph graph, DetectionBudget budget) {
        this.graph = graph;
        this.budget = budget;
        int n = graph.processCount();
        this.blocked = new boolean[n];
        this.onPath = new boolean[n];
        this.blockedBy = new IntArrayList[n];
        for (int v = 0; v < n; v++) {
            blockedBy[v] = new IntArrayList();
        }
    }

    /**
     * Runs the enumeration.
     *
     * @return elementary cycles grouped by ascending smallest member, DFS order within a group.
     * @throws org.detective.core.SearchBoundException when the cycle budget is exceeded.
     */
    List<WaitCycle> enumerate() {
        int n = graph.processCount();
        for (int start = 0; start < n; start++) {
            for (int v = start; v < n; v++) {
                blocked[v] = false;
                blockedBy[v].clear();
            }
            searchFrom(start);
        }
        return List.copyOf(cycles);
    }

    private void searchFrom(int start) {
        push(start);
        while (!path.isEmpty()) {
            int top = path.size() - 1;
            int v = path.getInt(top);
            int position = cursor.getInt(top);
            if (position < graph.successorEnd(v)) {
                cursor.set(top, position + 1);
                int w = graph.successorAt(position);
                if (w < start) {
                    continue;
                }
                if (w == start) {
                    recordCycle();
                    closedCycle.set(top, true);
                } else if (!blocked[w]) {
                    push(w);
                }
                continue;
            }

            boolean closed = closedCycle.getBoolean(top);
            if (closed) {
                unblock(v);
            } else {
                int end = graph.successorEnd(v);
                for (int p = graph.successorStart(v); p < end; p++) {
                    int w = graph.successorAt(p);
                    if (w >= start && !blockedBy[w].contains(v)) {
                        blockedBy[w].add(v);
                    }
                }
            }
            pop();
            if (closed && !path.isEmpty()) {
                closedCycle.set(path.size() - 1, true);
            }
        }
    }

    private void push(int v) {
        path.add(v);
        cursor.add(graph.successorStart(v));
        closedCycle.add(false);
        blocked[v] = true;
        onPath[v] = true;
    }

    private void pop() {
        int last = path.size() - 1;
        onPath[path.getInt(last)] = false;
        path.removeInt(last);
        cursor.removeInt(last);
        closedCycle.removeBoolean(last);
    }

    private void unblock(int vertex) {
        unblockStack.clear();
        unblockStack.add(vertex);
        while (!unblockStack.isEmpty()) {
            int u = unblockStack.removeInt(unblockStack.size() - 1);
            blocked[u] = false;
            IntArrayList waiting = blockedBy[u];
            for (int k = 0; k < waiting.size(); k++) {
                int w = waiting.getInt(k);
                if (blocked[w] && !onPath[w]) {
                    unblockStack.add(w);
                }
            }
            waiting.clear();
        }
    }

    private void recordCycle() {
        WaitCycle.WaitCycleBuilder builder = WaitCycle.builder();
        int length = path.size();
        for (int k = 0; k < length; k++) {
            int from = path.getInt(k);
            int to = path.getInt((k + 1) % length);
            builder.process(from);
            builder.resource(graph.label(from, to));
        }
        cycles.add(builder.build());
        budget.checkCycleCount(cycles.size());
    }

    @Override
    public String toString() {
        return "CycleEnumerator(processes=" + graph.processCount()
                + ", cyclesFound=" + cycles.size()
                + ", path=" + Arrays.toString(path.toIntArray()) + ")";
    }
}
