package org.detective.detection;

import org.detective.core.state.SystemState;

/**
 * Deadlock detection strategy over one immutable state.
 *
 * <p>Implementations are stateless apart from immutable configuration; each call owns its
 * scratch vectors, so one instance may serve concurrent callers.</p>
 */
public interface DeadlockDetector {

    /**
     * Returns the mode this detector implements.
     */
    DetectionMode mode();

    /**
     * Runs detection.
     *
     * @param state validated state, never mutated.
     * @return verdict, deadlocked set and trace.
     */
    DetectionResult detect(SystemState state);
}
