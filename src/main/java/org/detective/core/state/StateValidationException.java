package org.detective.core.state;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.detective.core.DeadlockEngineException;

/**
 * Thrown when raw input cannot form a valid {@link SystemState}.
 *
 * <p>Carries the violated rule as a reason code plus the structure and indices that failed,
 * so a caller can point at the exact table cell. Indices that do not apply are {@code -1}.</p>
 */
@Getter
@Accessors(fluent = true)
public final class StateValidationException extends DeadlockEngineException {
    private final String structure;
    private final int row;
    private final int column;

    public StateValidationException(String reasonCode, String structure, int row, int column, String message) {
        super(reasonCode, message);
        this.structure = structure;
        this.row = row;
        this.column = column;
    }
}
