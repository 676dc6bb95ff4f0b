package org.detective.analysis;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.detective.core.DetectionPreconditionException;
import org.detective.core.state.SystemState;
import org.detective.detection.DeadlockDetector;
import org.detective.detection.DetectionMode;
import org.detective.detection.DetectionResult;
import org.detective.detection.ReachabilityDetector;
import org.detective.detection.WaitForDetector;
import org.detective.recovery.RecoveryConfig;
import org.detective.recovery.RecoveryEngine;
import org.detective.recovery.RecoveryPlan;

/**
 * Main analysis entry point.
 *
 * <p>Owns mode bookkeeping on behalf of callers. Execution flow:</p>
 * <ul>
 * <li>Reject missing input with stable reason codes.</li>
 * <li>Refuse a wait-for request on a multi-instance state instead of silently switching
 * to the reachability detector.</li>
 * <li>Delegate to the selected detector and, for deadlocked results, the recovery engine.</li>
 * </ul>
 */
@Slf4j
public final class DeadlockAnalyzer implements AnalyzerService {
    public static final String REASON_STATE_REQUIRED = "ANALYZER_STATE_REQUIRED";
    public static final String REASON_MODE_REQUIRED = "ANALYZER_MODE_REQUIRED";
    public static final String REASON_RESULT_REQUIRED = "ANALYZER_RESULT_REQUIRED";
    public static final String REASON_WAIT_FOR_MODE_MISMATCH = "ANALYZER_WAIT_FOR_MODE_MISMATCH";

    private final DeadlockDetector waitForDetector;
    private final DeadlockDetector reachabilityDetector;
    private final RecoveryEngine recoveryEngine;

    /**
     * Creates an analyzer with default detectors and configuration.
     */
    public DeadlockAnalyzer() {
        this(null, null, null, null);
    }

    /**
     * Creates an analyzer; every argument is optional.
     *
     * @param waitForDetector wait-for detector override.
     * @param reachabilityDetector reachability detector override.
     * @param recoveryConfig recovery configuration, {@link RecoveryConfig#defaults()} when absent.
     * @param recoveryEngine recovery engine override; takes precedence over {@code recoveryConfig}.
     */
    @Builder
    public DeadlockAnalyzer(
            DeadlockDetector waitForDetector,
            DeadlockDetector reachabilityDetector,
            RecoveryConfig recoveryConfig,
            RecoveryEngine recoveryEngine
    ) {
        this.waitForDetector = waitForDetector == null ? new WaitForDetector() : waitForDetector;
        this.reachabilityDetector = reachabilityDetector == null ? new ReachabilityDetector() : reachabilityDetector;
        if (recoveryEngine != null) {
            this.recoveryEngine = recoveryEngine;
        } else {
            this.recoveryEngine = new RecoveryEngine(
                    this.waitForDetector,
                    this.reachabilityDetector,
                    recoveryConfig == null ? RecoveryConfig.defaults() : recoveryConfig
            );
        }
    }

    @Override
    public DetectionMode modeFor(SystemState state) {
        requireState(state);
        return state.isSingleInstance() ? DetectionMode.WAIT_FOR : DetectionMode.REACHABILITY;
    }

    /**
     * {@inheritDoc}
     *
     * @throws DetectionPreconditionException when input is missing or wait-for is requested on a
     * multi-instance state.
     */
    @Override
    public DetectionResult detect(SystemState state, DetectionMode mode) {
        requireState(state);
        if (mode == null) {
            throw new DetectionPreconditionException(REASON_MODE_REQUIRED, "detection mode must be specified");
        }
        if (mode == DetectionMode.WAIT_FOR && !state.isSingleInstance()) {
            throw new DetectionPreconditionException(
                    REASON_WAIT_FOR_MODE_MISMATCH,
                    "wait-for detection requested but the state has multi-instance resources; "
                            + "use " + DetectionMode.REACHABILITY
            );
        }
        DeadlockDetector detector = switch (mode) {
            case WAIT_FOR -> waitForDetector;
            case REACHABILITY -> reachabilityDetector;
        };
        return detector.detect(state);
    }

    @Override
    public RecoveryPlan recover(SystemState state, DetectionResult result) {
        requireState(state);
        if (result == null) {
            throw new DetectionPreconditionException(REASON_RESULT_REQUIRED, "detection result must be non-null");
        }
        return recoveryEngine.recover(state, result);
    }

    @Override
    public AnalysisReport analyze(SystemState state) {
        DetectionMode mode = modeFor(state);
        DetectionResult detection = detect(state, mode);
        AnalysisReport.AnalysisReportBuilder report = AnalysisReport.builder()
                .state(state)
                .detection(detection);
        if (detection.isDeadlocked()) {
            report.recovery(recover(state, detection));
        }
        log.debug("analysis in {} mode: deadlocked={}", mode, detection.isDeadlocked());
        return report.build();
    }

    /**
     * Checks whether terminating the given processes leaves the rest deadlock-free, using the mode
     * that matches the state.
     */
    public boolean canRecover(SystemState state, int... terminatedPids) {
        return recoveryEngine.canRecover(state, modeFor(state), terminatedPids);
    }

    private static void requireState(SystemState state) {
        if (state == null) {
            throw new DetectionPreconditionException(REASON_STATE_REQUIRED, "state must be non-null");
        }
    }
}
