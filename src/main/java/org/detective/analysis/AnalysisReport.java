package org.detective.analysis;

import lombok.Builder;
import lombok.Value;
import org.detective.core.state.SystemState;
import org.detective.detection.DetectionResult;
import org.detective.recovery.RecoveryPlan;

/**
 * End-to-end analysis of one state.
 *
 * <p>{@code recovery} is {@code null} when the state is not deadlocked.</p>
 */
@Value
@Builder
public class AnalysisReport {
    SystemState state;
    DetectionResult detection;
    RecoveryPlan recovery;

    public boolean hasRecovery() {
        return recovery != null;
    }
}
