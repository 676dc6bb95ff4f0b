package org.detective.recovery;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.detective.core.state.ProcessDescriptor;
import org.detective.core.state.SystemState;

import java.util.ArrayList;
import java.util.List;

/**
 * Hypothetical state with a set of processes terminated.
 *
 * <p>Terminated allocations are returned to available and the processes vanish together with
 * their requests. Survivors are renumbered densely; {@code originalPids[newPid]} maps back to the
 * analyzed state's ids. {@code state} is {@code null} when every process was terminated.</p>
 *
 * @param state reduced state, or {@code null} when nothing remains.
 * @param originalPids original pid of each surviving process, indexed by reduced pid.
 * @param availableAfterRelease available vector once the terminated allocations are released.
 */
record ReducedState(SystemState state, int[] originalPids, int[] availableAfterRelease) {

    /**
     * Builds the reduced state for one termination set.
     *
     * @param source analyzed state.
     * @param terminated terminated pids, ascending and distinct.
     */
    static ReducedState terminate(SystemState source, int[] terminated) {
        int n = source.processCount();
        boolean[] removed = new boolean[n];
        int[] available = source.availableVector();
        for (int pid : terminated) {
            removed[pid] = true;
            for (int j = 0; j < available.length; j++) {
                available[j] += source.allocation(pid, j);
            }
        }

        IntArrayList survivors = new IntArrayList(n - terminated.length);
        for (int pid = 0; pid < n; pid++) {
            if (!removed[pid]) {
                survivors.add(pid);
            }
        }
        if (survivors.isEmpty()) {
            return new ReducedState(null, new int[0], available);
        }

        List<ProcessDescriptor> processes = new ArrayList<>(survivors.size());
        int[][] allocation = new int[survivors.size()][];
        int[][] request = new int[survivors.size()][];
        for (int newPid = 0; newPid < survivors.size(); newPid++) {
            int originalPid = survivors.getInt(newPid);
            processes.add(new ProcessDescriptor(newPid, source.process(originalPid).getName()));
            allocation[newPid] = source.allocationRow(originalPid);
            request[newPid] = source.requestRow(originalPid);
        }
        SystemState reduced = SystemState.of(processes, source.resourceTypes(), available, allocation, request);
        return new ReducedState(reduced, survivors.toIntArray(), available);
    }

    /**
     * Returns whether no process survived the termination.
     */
    boolean empty() {
        return state == null;
    }

    /**
     * Maps reduced pids back to original pids.
     */
    List<Integer> toOriginal(List<Integer> reducedPids) {
        List<Integer> mapped = new ArrayList<>(reducedPids.size());
        for (int reducedPid : reducedPids) {
            mapped.add(originalPids[reducedPid]);
        }
        return List.copyOf(mapped);
    }
}
