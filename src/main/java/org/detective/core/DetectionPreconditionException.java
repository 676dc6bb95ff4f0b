package org.detective.core;

/**
 * Caller-side misuse of a detector, the recovery engine or the analysis facade.
 *
 * <p>Developer-facing: it signals a wiring mistake such as asking for recovery on a
 * non-deadlocked result, not a problem with the analyzed state.</p>
 */
public final class DetectionPreconditionException extends DeadlockEngineException {

    public DetectionPreconditionException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
