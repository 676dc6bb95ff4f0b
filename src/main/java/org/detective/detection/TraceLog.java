package org.detective.detection;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only trace buffer owned by a single detection call.
 */
final class TraceLog {
    static final int NONE = -1;

    private final List<TraceStep> steps = new ArrayList<>();

    void add(TraceKind kind, String message) {
        add(kind, NONE, NONE, message);
    }

    void add(TraceKind kind, int processId, int resourceId, String message) {
        steps.add(new TraceStep(steps.size(), kind, processId, resourceId, message));
    }

    List<TraceStep> steps() {
        return List.copyOf(steps);
    }
}
