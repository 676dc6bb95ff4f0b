package org.detective.detection;

import lombok.Value;

/**
 * Directed wait-for edge: {@code fromPid} is blocked on {@code resourceId} held by {@code toPid}.
 */
@Value
public class WaitForEdge {
    int fromPid;
    int toPid;
    int resourceId;

    /**
     * Returns whether the edge is a process waiting on more of a resource it already holds.
     */
    public boolean isSelfWait() {
        return fromPid == toPid;
    }

    @Override
    public String toString() {
        return "P" + fromPid + " -> P" + toPid + " (R" + resourceId + ")";
    }
}
