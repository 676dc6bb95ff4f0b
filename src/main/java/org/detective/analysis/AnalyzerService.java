package org.detective.analysis;

import org.detective.core.state.SystemState;
import org.detective.detection.DetectionMode;
import org.detective.detection.DetectionResult;
import org.detective.recovery.RecoveryPlan;

/**
 * Public detection and recovery service contract.
 *
 * <p>Implementations validate caller input deterministically and throw reason-coded runtime
 * exceptions for contract failures.</p>
 */
public interface AnalyzerService {

    /**
     * Returns the detection mode matching a state's resource shape.
     */
    DetectionMode modeFor(SystemState state);

    /**
     * Runs one detector chosen by the caller.
     *
     * @param state validated state.
     * @param mode requested detector.
     * @return detection result.
     */
    DetectionResult detect(SystemState state, DetectionMode mode);

    /**
     * Computes recovery suggestions for a deadlocked result.
     *
     * @param state state the result was computed on.
     * @param result deadlocked detection result.
     * @return recovery plan.
     */
    RecoveryPlan recover(SystemState state, DetectionResult result);

    /**
     * Detects in the matching mode and, when deadlocked, computes recovery.
     *
     * @param state validated state.
     * @return detection plus optional recovery.
     */
    AnalysisReport analyze(SystemState state);
}
