package org.detective.detection;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * One elementary cycle of the wait-for relation.
 *
 * <p>{@code processIds} starts at the smallest pid on the cycle and follows the wait direction.
 * {@code resourceIds.get(k)} labels the edge from {@code processIds.get(k)} to the next member,
 * the last label closing the cycle back to the first member.</p>
 */
@Value
@Builder
public class WaitCycle {
    @Singular("process")
    List<Integer> processIds;
    @Singular("resource")
    List<Integer> resourceIds;

    /** Number of distinct processes on the cycle. */
    public int length() {
        return processIds.size();
    }

    /**
     * Returns the member ids with the first id repeated at the end, for example {@code [0, 1, 2, 0]}.
     */
    public List<Integer> closedPath() {
        List<Integer> path = new ArrayList<>(processIds.size() + 1);
        path.addAll(processIds);
        if (!processIds.isEmpty()) {
            path.add(processIds.get(0));
        }
        return List.copyOf(path);
    }

    /** Cycle edges in traversal order. */
    public List<WaitForEdge> edges() {
        List<WaitForEdge> edges = new ArrayList<>(processIds.size());
        for (int k = 0; k < processIds.size(); k++) {
            int from = processIds.get(k);
            int to = processIds.get((k + 1) % processIds.size());
            edges.add(new WaitForEdge(from, to, resourceIds.get(k)));
        }
        return List.copyOf(edges);
    }
}
