package org.detective.recovery;

/**
 * Verification status of a preemption suggestion.
 */
public enum PreemptionStatus {
    /** Re-detection after the simulated transfer showed at least one process unblocked. */
    VERIFIED,
    /** Not simulated, or simulated without unblocking anyone. */
    SPECULATIVE
}
