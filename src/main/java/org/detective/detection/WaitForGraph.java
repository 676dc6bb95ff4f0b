package org.detective.detection;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.detective.core.state.SystemState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable wait-for relation derived from one state.
 *
 * <p>Keeps the full labeled edge list in construction order (ascending waiter, then resource,
 * then holder) and a CSR adjacency over process ids where each waiter maps to a contiguous,
 * ascending, de-duplicated range of holders. The label of a compacted pair is the smallest
 * resource id that produced it.</p>
 */
final class WaitForGraph {
    private final int processCount;
    private final List<WaitForEdge> edges;
    private final int[] firstSuccessor;
    private final int[] successors;
    private final int[] successorLabels;

    private WaitForGraph(
            int processCount,
            List<WaitForEdge> edges,
            int[] firstSuccessor,
            int[] successors,
            int[] successorLabels
    ) {
        this.processCount = processCount;
        this.edges = edges;
        this.firstSuccessor = firstSuccessor;
        this.successors = successors;
        this.successorLabels = successorLabels;
    }

    /**
     * Builds the wait-for relation using the state's per-resource holder index.
     *
     * <p>For every {@code request[i][j] > 0} one edge {@code i -> k} is emitted for each holder
     * {@code k} of {@code j}. An unheld resource produces no edge. A holder equal to the waiter
     * yields a self-wait edge.</p>
     */
    static WaitForGraph build(SystemState state) {
        Objects.requireNonNull(state, "state");
        int n = state.processCount();
        int m = state.resourceCount();

        List<WaitForEdge> edges = new ArrayList<>();
        int[] firstSuccessor = new int[n + 1];
        IntArrayList successors = new IntArrayList();
        IntArrayList labels = new IntArrayList();

        int[] labelByHolder = new int[n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(labelByHolder, -1);
            for (int j = 0; j < m; j++) {
                if (state.request(i, j) == 0) {
                    continue;
                }
                for (int k : state.holdersOf(j)) {
                    edges.add(new WaitForEdge(i, k, j));
                    if (labelByHolder[k] < 0) {
                        labelByHolder[k] = j;
                    }
                }
            }

            firstSuccessor[i] = successors.size();
            for (int k = 0; k < n; k++) {
                if (labelByHolder[k] >= 0) {
                    successors.add(k);
                    labels.add(labelByHolder[k]);
                }
            }
        }
        firstSuccessor[n] = successors.size();

        return new WaitForGraph(n, List.copyOf(edges), firstSuccessor, successors.toIntArray(), labels.toIntArray());
    }

    int processCount() {
        return processCount;
    }

    List<WaitForEdge> edges() {
        return edges;
    }

    /**
     * Returns start index (inclusive) of one waiter's successor range.
     */
    int successorStart(int pid) {
        validateProcess(pid);
        return firstSuccessor[pid];
    }

    /**
     * Returns end index (exclusive) of one waiter's successor range.
     */
    int successorEnd(int pid) {
        validateProcess(pid);
        return firstSuccessor[pid + 1];
    }

    int successorAt(int position) {
        return successors[position];
    }

    int labelAt(int position) {
        return successorLabels[position];
    }

    /**
     * Returns the smallest resource label on {@code from -> to}, or {@code -1} when absent.
     */
    int label(int from, int to) {
        int end = successorEnd(from);
        for (int position = successorStart(from); position < end; position++) {
            if (successors[position] == to) {
                return successorLabels[position];
            }
        }
        return -1;
    }

    private void validateProcess(int pid) {
        if (pid < 0 || pid >= processCount) {
            throw new IndexOutOfBoundsException("pid out of bounds: " + pid);
        }
    }
}
