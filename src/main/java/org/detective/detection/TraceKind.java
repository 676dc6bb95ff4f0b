package org.detective.detection;

/**
 * Category of one recorded detection step.
 */
public enum TraceKind {
    HEADER,
    WARNING,
    EDGE,
    CYCLE,
    INITIALIZE,
    CHECK,
    GRANT,
    BLOCKED,
    RESULT
}
