package org.detective.detection;

import lombok.Value;

/**
 * One step of a detection trace, in the order it happened.
 */
@Value
public class TraceStep {
    /** 0-based position inside the trace. */
    int index;
    TraceKind kind;
    /** Process the step is about, or {@code -1}. */
    int processId;
    /** Resource the step is about, or {@code -1}. */
    int resourceId;
    /** Human-readable rendering of the step. */
    String message;

    @Override
    public String toString() {
        return message;
    }
}
