package org.detective.core.state;

import lombok.Value;

/**
 * Immutable resource type with its total instance count.
 */
@Value
public class ResourceType {
    /** Dense 0-based resource id. */
    int rid;
    /** Display name, for example {@code R0}. */
    String name;
    /** Total copies in existence, always at least one. */
    int instances;

    public ResourceType(int rid, String name, int instances) {
        if (rid < 0) {
            throw new StateValidationException(
                    SystemState.REASON_NEGATIVE_ID, "resourceTypes", rid, -1, "rid must be >= 0, got " + rid);
        }
        if (name == null || name.isBlank()) {
            throw new StateValidationException(
                    SystemState.REASON_BLANK_NAME, "resourceTypes", rid, -1, "resource " + rid + " name must be non-blank");
        }
        if (instances < 1) {
            throw new StateValidationException(
                    SystemState.REASON_INSTANCES_NOT_POSITIVE,
                    "resourceTypes",
                    rid,
                    -1,
                    "resource " + rid + " instances must be >= 1, got " + instances
            );
        }
        this.rid = rid;
        this.name = name;
        this.instances = instances;
    }

    /**
     * Creates a resource type with the conventional {@code R<rid>} name.
     */
    public static ResourceType of(int rid, int instances) {
        return new ResourceType(rid, "R" + rid, instances);
    }
}
