package org.detective.recovery;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable recovery-engine configuration, bound once at construction.
 */
@Value
@Builder
public class RecoveryConfig {
    public static final int DEFAULT_MAX_DEADLOCKED_SET_SIZE = 24;
    public static final long DEFAULT_MAX_SUBSET_EVALUATIONS = 1_000_000L;

    static final String PROP_MAX_DEADLOCKED_SET_SIZE = "detective.recovery.maxDeadlockedSetSize";
    static final String PROP_MAX_SUBSET_EVALUATIONS = "detective.recovery.maxSubsetEvaluations";
    static final String PROP_SIMULATE_PREEMPTION = "detective.recovery.simulatePreemption";

    /**
     * Largest deadlocked set the termination search accepts.
     */
    @Builder.Default
    int maxDeadlockedSetSize = DEFAULT_MAX_DEADLOCKED_SET_SIZE;

    /**
     * Largest number of candidate subsets the termination search may evaluate.
     */
    @Builder.Default
    long maxSubsetEvaluations = DEFAULT_MAX_SUBSET_EVALUATIONS;

    /**
     * Whether each preemption proposal is simulated and re-detected before it is reported.
     */
    @Builder.Default
    boolean simulatePreemption = true;

    /**
     * Returns configuration built from {@code detective.recovery.*} system properties, falling back
     * to the built-in defaults for missing or malformed values.
     */
    public static RecoveryConfig defaults() {
        return RecoveryConfig.builder()
                .maxDeadlockedSetSize((int) readPositive(PROP_MAX_DEADLOCKED_SET_SIZE, DEFAULT_MAX_DEADLOCKED_SET_SIZE))
                .maxSubsetEvaluations(readPositive(PROP_MAX_SUBSET_EVALUATIONS, DEFAULT_MAX_SUBSET_EVALUATIONS))
                .simulatePreemption(readFlag(PROP_SIMULATE_PREEMPTION, true))
                .build();
    }

    private static long readPositive(String property, long fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            long value = Long.parseLong(raw.trim());
            return value > 0L ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static boolean readFlag(String property, boolean fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Boolean.parseBoolean(raw.trim());
    }
}
