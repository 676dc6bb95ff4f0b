package org.detective.core;

/**
 * Thrown when an exhaustive search would exceed its configured bound.
 *
 * <p>Searches never return a truncated answer; hitting a bound always surfaces here.</p>
 */
public final class SearchBoundException extends DeadlockEngineException {

    public SearchBoundException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
