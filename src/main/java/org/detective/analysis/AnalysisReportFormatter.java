package org.detective.analysis;

import org.detective.core.state.SystemState;
import org.detective.detection.DetectionResult;
import org.detective.detection.TraceStep;
import org.detective.recovery.PreemptionSuggestion;
import org.detective.recovery.RecoveryPlan;
import org.detective.recovery.TerminationSuggestion;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain-text rendering of analysis output.
 */
public final class AnalysisReportFormatter {
    private static final String RULE = "=".repeat(60);
    private static final String THIN_RULE = "-".repeat(60);

    private AnalysisReportFormatter() {
    }

    /**
     * Renders trace and, when present, the recovery plan.
     */
    public static String format(AnalysisReport report) {
        StringBuilder text = new StringBuilder(formatTrace(report.getDetection()));
        text.append(System.lineSeparator());
        if (report.hasRecovery()) {
            text.append(formatRecovery(report.getState(), report.getRecovery()));
        } else {
            text.append("No recovery strategies needed (no deadlock detected).").append(System.lineSeparator());
        }
        return text.toString();
    }

    /**
     * Renders the detection trace, one step per line.
     */
    public static String formatTrace(DetectionResult result) {
        StringBuilder text = new StringBuilder();
        for (TraceStep step : result.getTrace()) {
            text.append(step.getMessage()).append(System.lineSeparator());
        }
        return text.toString();
    }

    /**
     * Renders a recovery plan: termination options first, then preemption options.
     */
    public static String formatRecovery(SystemState state, RecoveryPlan plan) {
        StringBuilder text = new StringBuilder();
        line(text, RULE);
        line(text, "RECOVERY STRATEGIES (" + plan.getMode() + " mode)");
        line(text, RULE);
        line(text, "");

        if (!plan.getTerminations().isEmpty()) {
            line(text, "OPTION 1: Process Termination");
            line(text, THIN_RULE);
            line(text, "Terminate processes to release their resources.");
            line(text, "");
            int index = 1;
            for (TerminationSuggestion suggestion : plan.getTerminations()) {
                line(text, "  " + index + ". Terminate " + suggestion.getProcessIds().size() + " process(es): "
                        + names(state, suggestion.getProcessIds()));
                line(text, "     Available after release: " + suggestion.getAvailableAfterRelease());
                if (!suggestion.getRemainderSequence().isEmpty()) {
                    line(text, "     Remaining processes finish in order: "
                            + names(state, suggestion.getRemainderSequence()));
                }
                index++;
            }
            line(text, "");
        }

        if (!plan.getPreemptions().isEmpty()) {
            line(text, "OPTION 2: Resource Preemption");
            line(text, THIN_RULE);
            line(text, "Preempt resources from processes (requires rollback of the donor).");
            line(text, "");
            int index = 1;
            for (PreemptionSuggestion suggestion : plan.getPreemptions()) {
                String outcome = suggestion.getUnblockedProcessIds().isEmpty()
                        ? "unblocks nobody"
                        : "unblocks " + names(state, suggestion.getUnblockedProcessIds());
                line(text, "  " + index + ". [" + suggestion.getStatus() + "] Move " + suggestion.getUnits() + "x "
                        + state.resourceType(suggestion.getResourceId()).getName()
                        + " from " + state.process(suggestion.getDonorProcessId()).getName()
                        + " to " + state.process(suggestion.getRecipientProcessId()).getName()
                        + (suggestion.getOutcome() == null ? " (not simulated)" : " (" + outcome + ")"));
                index++;
            }
            line(text, "");
            line(text, "Note: only VERIFIED preemptions were shown to unblock a process.");
        }

        line(text, RULE);
        return text.toString();
    }

    private static String names(SystemState state, List<Integer> pids) {
        return pids.stream()
                .map(pid -> state.process(pid).getName())
                .collect(Collectors.joining(", "));
    }

    private static void line(StringBuilder text, String value) {
        text.append(value).append(System.lineSeparator());
    }
}
