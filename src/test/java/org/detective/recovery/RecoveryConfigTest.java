package org.detective.recovery;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RecoveryConfig Tests")
class RecoveryConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(RecoveryConfig.PROP_MAX_DEADLOCKED_SET_SIZE);
        System.clearProperty(RecoveryConfig.PROP_MAX_SUBSET_EVALUATIONS);
        System.clearProperty(RecoveryConfig.PROP_SIMULATE_PREEMPTION);
    }

    @Test
    @DisplayName("Builder defaults match the documented bounds")
    void testBuilderDefaults() {
        RecoveryConfig config = RecoveryConfig.builder().build();

        assertEquals(24, config.getMaxDeadlockedSetSize());
        assertEquals(1_000_000L, config.getMaxSubsetEvaluations());
        assertTrue(config.isSimulatePreemption());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testSystemPropertyOverrides() {
        System.setProperty(RecoveryConfig.PROP_MAX_DEADLOCKED_SET_SIZE, "8");
        System.setProperty(RecoveryConfig.PROP_MAX_SUBSET_EVALUATIONS, " 500 ");
        System.setProperty(RecoveryConfig.PROP_SIMULATE_PREEMPTION, "false");

        RecoveryConfig config = RecoveryConfig.defaults();

        assertEquals(8, config.getMaxDeadlockedSetSize());
        assertEquals(500L, config.getMaxSubsetEvaluations());
        assertFalse(config.isSimulatePreemption());
    }

    @Test
    @DisplayName("Malformed or non-positive properties fall back to defaults")
    void testMalformedPropertiesFallBack() {
        System.setProperty(RecoveryConfig.PROP_MAX_DEADLOCKED_SET_SIZE, "lots");
        System.setProperty(RecoveryConfig.PROP_MAX_SUBSET_EVALUATIONS, "-3");

        RecoveryConfig config = RecoveryConfig.defaults();

        assertEquals(RecoveryConfig.DEFAULT_MAX_DEADLOCKED_SET_SIZE, config.getMaxDeadlockedSetSize());
        assertEquals(RecoveryConfig.DEFAULT_MAX_SUBSET_EVALUATIONS, config.getMaxSubsetEvaluations());
        assertTrue(config.isSimulatePreemption());
    }
}
