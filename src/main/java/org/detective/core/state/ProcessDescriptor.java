package org.detective.core.state;

import lombok.Value;

/**
 * Immutable process identity.
 */
@Value
public class ProcessDescriptor {
    /** Dense 0-based process id. */
    int pid;
    /** Display name, for example {@code P0}. */
    String name;

    public ProcessDescriptor(int pid, String name) {
        if (pid < 0) {
            throw new StateValidationException(
                    SystemState.REASON_NEGATIVE_ID, "processes", pid, -1, "pid must be >= 0, got " + pid);
        }
        if (name == null || name.isBlank()) {
            throw new StateValidationException(
                    SystemState.REASON_BLANK_NAME, "processes", pid, -1, "process " + pid + " name must be non-blank");
        }
        this.pid = pid;
        this.name = name;
    }

    /**
     * Creates a process with the conventional {@code P<pid>} name.
     */
    public static ProcessDescriptor of(int pid) {
        return new ProcessDescriptor(pid, "P" + pid);
    }
}
