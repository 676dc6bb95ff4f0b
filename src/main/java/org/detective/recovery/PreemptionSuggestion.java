package org.detective.recovery;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.detective.detection.DetectionResult;

import java.util.List;

/**
 * Proposal to move resource instances from one deadlocked process to another.
 *
 * <p>{@code outcome} is the detection result of the hypothetical post-transfer state, or
 * {@code null} when simulation was disabled. Only {@link PreemptionStatus#VERIFIED} suggestions
 * are known to unblock someone.</p>
 */
@Value
@Builder
public class PreemptionSuggestion implements RecoverySuggestion {
    int resourceId;
    int donorProcessId;
    int recipientProcessId;
    /** Instances moved from donor to recipient. */
    int units;
    PreemptionStatus status;
    DetectionResult outcome;
    /** Processes deadlocked before the transfer but not after it, ascending. */
    @Singular("unblocked")
    List<Integer> unblockedProcessIds;

    public boolean isVerified() {
        return status == PreemptionStatus.VERIFIED;
    }

    @Override
    public Kind kind() {
        return Kind.PREEMPTION;
    }

    @Override
    public List<Integer> affectedProcessIds() {
        return donorProcessId < recipientProcessId
                ? List.of(donorProcessId, recipientProcessId)
                : List.of(recipientProcessId, donorProcessId);
    }

    @Override
    public String description() {
        return "Preempt " + units + "xR" + resourceId + " from P" + donorProcessId
                + " to P" + recipientProcessId + " [" + status + "]";
    }
}
