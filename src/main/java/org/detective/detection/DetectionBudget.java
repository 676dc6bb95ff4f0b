package org.detective.detection;

import org.detective.core.SearchBoundException;

/**
 * Deterministic bound on wait-for cycle enumeration.
 *
 * <p>The number of elementary cycles can grow exponentially with dense wait-for relations, so
 * enumeration fails fast once the configured count is passed instead of returning a truncated
 * cycle list. Default detectors are bounded by {@link #DEFAULT_MAX_CYCLES}.</p>
 */
public final class DetectionBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;
    public static final int DEFAULT_MAX_CYCLES = 10_000;

    public static final String REASON_CYCLE_BUDGET_EXCEEDED = "DETECTION_CYCLE_BUDGET_EXCEEDED";

    static final String PROP_MAX_CYCLES = "detective.detection.maxCycles";

    private final int maxCycles;

    private DetectionBudget(int maxCycles) {
        this.maxCycles = normalizeBound(maxCycles);
    }

    /**
     * Creates a budget with an explicit cycle bound; non-positive means unbounded.
     */
    public static DetectionBudget of(int maxCycles) {
        return new DetectionBudget(maxCycles);
    }

    /**
     * Creates an unbounded budget.
     */
    public static DetectionBudget unbounded() {
        return new DetectionBudget(UNBOUNDED);
    }

    /**
     * Loads the bound from the {@code detective.detection.maxCycles} system property.
     *
     * <p>A missing, malformed or non-positive value yields {@link #DEFAULT_MAX_CYCLES}; an
     * unbounded search is only available through {@link #unbounded()}.</p>
     */
    public static DetectionBudget defaults() {
        return DetectionBudget.of(readBound(PROP_MAX_CYCLES));
    }

    public int maxCycles() {
        return maxCycles;
    }

    /**
     * Validates the number of cycles found so far against the bound.
     */
    void checkCycleCount(int cycleCount) {
        if (cycleCount > maxCycles) {
            throw new SearchBoundException(
                    REASON_CYCLE_BUDGET_EXCEEDED,
                    "wait-for cycle budget exceeded: " + cycleCount + " > " + maxCycles
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_MAX_CYCLES;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : DEFAULT_MAX_CYCLES;
        } catch (NumberFormatException ex) {
            return DEFAULT_MAX_CYCLES;
        }
    }
}
