package org.detective.detection;

/**
 * Detection algorithm selector.
 */
public enum DetectionMode {
    /** Cycle search over the wait-for relation; exact for single-instance states. */
    WAIT_FOR,
    /** Work/finish simulation; exact for any state. */
    REACHABILITY
}
