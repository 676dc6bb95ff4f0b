package org.detective.detection;

import org.detective.core.SearchBoundException;
import org.detective.samples.SampleStates;
import org.detective.testutil.StateFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("WaitForDetector Tests")
class WaitForDetectorTest {

    private final WaitForDetector detector = new WaitForDetector(DetectionBudget.unbounded());

    @Test
    @DisplayName("Three-process ring is reported as one cycle with resource labels")
    void testRingDeadlock() {
        DetectionResult result = detector.detect(StateFixtures.scenarioA());

        assertEquals(DetectionMode.WAIT_FOR, result.getMode());
        assertTrue(result.isDeadlocked());
        assertTrue(result.isSingleInstanceState());
        assertEquals(List.of(0, 1, 2), result.getDeadlockedProcessIds());
        assertEquals(1, result.getCycles().size());
        WaitCycle cycle = result.getCycles().get(0);
        assertEquals(List.of(0, 1, 2, 0), cycle.closedPath());
        assertEquals(List.of(1, 2, 0), cycle.getResourceIds());
        assertEquals(
                List.of(new WaitForEdge(0, 1, 1), new WaitForEdge(1, 2, 2), new WaitForEdge(2, 0, 0)),
                cycle.edges()
        );
        assertTrue(result.getSafeSequence().isEmpty());
        assertTrue(result.getFinalWork().isEmpty());
    }

    @Test
    @DisplayName("Holders requesting nothing produce no edges and no deadlock")
    void testNoEdges() {
        DetectionResult result = detector.detect(StateFixtures.scenarioB());

        assertFalse(result.isDeadlocked());
        assertTrue(result.getWaitForEdges().isEmpty());
        assertTrue(result.getCycles().isEmpty());
        assertTrue(result.getDeadlockedProcessIds().isEmpty());
        assertEquals("Result: NO DEADLOCK", lastMessage(result));
    }

    @Test
    @DisplayName("Acyclic waiting is not a deadlock")
    void testAcyclicWaiting() {
        DetectionResult result = detector.detect(SampleStates.singleInstanceNoDeadlock());

        assertFalse(result.isDeadlocked());
        assertEquals(List.of(new WaitForEdge(0, 1, 1)), result.getWaitForEdges());
        assertTrue(result.getCycles().isEmpty());
    }

    @Test
    @DisplayName("A process waiting on a cycle without being on it is not reported")
    void testBlockedBystanderExcluded() {
        DetectionResult result = detector.detect(StateFixtures.ringWithBlockedBystander());

        assertTrue(result.isDeadlocked());
        assertEquals(List.of(0, 1, 2), result.getDeadlockedProcessIds());
        assertFalse(result.isDeadlocked(3));
        assertTrue(result.getWaitForEdges().contains(new WaitForEdge(3, 0, 0)));
    }

    @Test
    @DisplayName("Deadlocked set is the union of members of every cycle")
    void testUnionOfDisjointCycles() {
        DetectionResult result = detector.detect(StateFixtures.twoDisjointCycles());

        assertEquals(2, result.getCycles().size());
        assertEquals(List.of(0, 1), result.getCycles().get(0).getProcessIds());
        assertEquals(List.of(2, 3), result.getCycles().get(1).getProcessIds());
        assertEquals(List.of(0, 1, 2, 3), result.getDeadlockedProcessIds());
    }

    @Test
    @DisplayName("Self-wait is a deadlock of one process")
    void testSelfWait() {
        DetectionResult result = detector.detect(StateFixtures.selfWait());

        assertTrue(result.isDeadlocked());
        assertEquals(List.of(0), result.getDeadlockedProcessIds());
        assertEquals(List.of(0, 0), result.getCycles().get(0).closedPath());
    }

    @Test
    @DisplayName("Multi-instance input runs with a warning step")
    void testMultiInstanceWarning() {
        DetectionResult result = detector.detect(SampleStates.multiInstanceDeadlock());

        assertFalse(result.isSingleInstanceState());
        assertTrue(result.getTrace().stream().anyMatch(step -> step.getKind() == TraceKind.WARNING));
        assertTrue(result.isDeadlocked());
    }

    @Test
    @DisplayName("Single-instance input carries no warning step")
    void testNoWarningOnSingleInstance() {
        DetectionResult result = detector.detect(StateFixtures.scenarioA());

        assertTrue(result.getTrace().stream().noneMatch(step -> step.getKind() == TraceKind.WARNING));
    }

    @Test
    @DisplayName("Trace lists edges, cycles and a final verdict in order")
    void testTraceShape() {
        DetectionResult result = detector.detect(StateFixtures.scenarioA());
        List<TraceStep> trace = result.getTrace();

        assertEquals("=== Wait-For Graph Deadlock Detection ===", trace.get(0).getMessage());
        assertEquals(3, trace.stream().filter(step -> step.getKind() == TraceKind.EDGE).count());
        assertTrue(trace.stream().anyMatch(step -> step.getMessage().equals("  P0 -> P1 (R1)")));
        assertTrue(trace.stream().anyMatch(step -> step.getMessage().equals("  Cycle: P0 -> P1 -> P2 -> P0")));
        assertEquals("Result: DEADLOCK DETECTED", lastMessage(result));
        for (int k = 0; k < trace.size(); k++) {
            assertEquals(k, trace.get(k).getIndex());
        }
    }

    @Test
    @DisplayName("Repeated detection on the same state is identical")
    void testIdempotent() {
        assertEquals(detector.detect(StateFixtures.completeWaitForTriangle()),
                detector.detect(StateFixtures.completeWaitForTriangle()));
    }

    @Test
    @DisplayName("Cycle budget is enforced through the detector")
    void testCycleBudget() {
        WaitForDetector bounded = new WaitForDetector(DetectionBudget.of(1));

        SearchBoundException ex = assertThrows(
                SearchBoundException.class,
                () -> bounded.detect(StateFixtures.twoDisjointCycles())
        );
        assertEquals(DetectionBudget.REASON_CYCLE_BUDGET_EXCEEDED, ex.reasonCode());
    }

    @Test
    @DisplayName("Null state is rejected")
    void testNullState() {
        assertThrows(NullPointerException.class, () -> detector.detect(null));
    }

    private static String lastMessage(DetectionResult result) {
        return result.getTrace().get(result.getTrace().size() - 1).getMessage();
    }
}
