package org.detective.recovery;

import java.util.List;

/**
 * One concrete way out of a detected deadlock.
 */
public interface RecoverySuggestion {

    /**
     * Suggestion variant.
     */
    enum Kind {
        TERMINATION,
        PREEMPTION
    }

    Kind kind();

    /**
     * Processes directly affected by the suggestion, ascending.
     */
    List<Integer> affectedProcessIds();

    /**
     * One-line human-readable description.
     */
    String description();
}
