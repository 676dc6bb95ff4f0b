package org.detective.core.state;

import org.detective.samples.SampleStates;
import org.detective.testutil.StateFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SystemState Tests")
class SystemStateTest {

    @Test
    @DisplayName("Valid state exposes dimensions, vectors and names")
    void testValidStateAccessors() {
        SystemState state = StateFixtures.scenarioC();

        assertEquals(3, state.processCount());
        assertEquals(3, state.resourceCount());
        assertArrayEquals(new int[]{3, 3, 2}, state.availableVector());
        assertArrayEquals(new int[]{2, 0, 0}, state.allocationRow(1));
        assertArrayEquals(new int[]{1, 0, 2}, state.requestRow(1));
        assertEquals(8, state.totalInstances(0));
        assertEquals("P2", state.process(2).getName());
        assertEquals("R1", state.resourceType(1).getName());
        assertFalse(state.isSingleInstance());
    }

    @Test
    @DisplayName("Input arrays are copied on the way in")
    void testInputIsCopied() {
        int[] available = {0, 0, 0};
        int[][] allocation = {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};
        int[][] request = {{0, 1, 0}, {0, 0, 1}, {1, 0, 0}};
        SystemState state = StateFixtures.state(new int[]{1, 1, 1}, available, allocation, request);

        available[0] = 9;
        allocation[0][0] = 9;
        request[2][0] = 9;

        assertEquals(0, state.available(0));
        assertEquals(1, state.allocation(0, 0));
        assertEquals(1, state.request(2, 0));
    }

    @Test
    @DisplayName("Row and matrix accessors return defensive copies")
    void testAccessorsReturnCopies() {
        SystemState state = StateFixtures.scenarioA();

        int[] row = state.allocationRow(0);
        row[0] = 7;
        int[][] matrix = state.requestMatrix();
        matrix[0][1] = 7;

        assertEquals(1, state.allocation(0, 0));
        assertEquals(1, state.request(0, 1));
        assertNotSame(state.availableVector(), state.availableVector());
    }

    @Test
    @DisplayName("Holder index lists processes holding each resource in ascending pid order")
    void testHoldersOf() {
        SystemState state = SampleStates.multiInstanceDeadlock();

        assertArrayEquals(new int[]{0, 1}, state.holdersOf(0));
        assertArrayEquals(new int[]{1, 2}, state.holdersOf(1));
        assertArrayEquals(new int[]{0, 2}, state.holdersOf(2));
        assertArrayEquals(new int[0], SampleStates.emptyTemplate().holdersOf(0));
    }

    @Test
    @DisplayName("Single-instance check requires every resource to have exactly one instance")
    void testSingleInstance() {
        assertTrue(StateFixtures.scenarioA().isSingleInstance());
        assertFalse(SampleStates.multiInstanceNoDeadlock().isSingleInstance());
    }

    @Test
    @DisplayName("Equal inputs produce equal states")
    void testValueEquality() {
        assertEquals(StateFixtures.scenarioA(), StateFixtures.scenarioA());
        assertEquals(StateFixtures.scenarioA().hashCode(), StateFixtures.scenarioA().hashCode());
        assertFalse(StateFixtures.scenarioA().equals(StateFixtures.scenarioB()));
    }

    @Test
    @DisplayName("Builder validates like the factory")
    void testBuilder() {
        SystemState state = SystemState.builder()
                .processes(List.of(ProcessDescriptor.of(0)))
                .resourceTypes(List.of(ResourceType.of(0, 2)))
                .available(new int[]{1})
                .allocation(new int[][]{{1}})
                .request(new int[][]{{1}})
                .build();
        assertEquals(1, state.processCount());

        StateValidationException ex = assertThrows(StateValidationException.class, () -> SystemState.builder()
                .processes(List.of(ProcessDescriptor.of(0)))
                .resourceTypes(List.of(ResourceType.of(0, 2)))
                .available(new int[]{2})
                .allocation(new int[][]{{1}})
                .request(new int[][]{{0}})
                .build());
        assertEquals(SystemState.REASON_CONSERVATION_VIOLATED, ex.reasonCode());
    }

    @Test
    @DisplayName("Validation: null inputs are rejected")
    void testNullInputRejected() {
        StateValidationException ex = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(processes(1), resources(1), null, new int[][]{{0}}, new int[][]{{0}})
        );
        assertEquals(SystemState.REASON_NULL_INPUT, ex.reasonCode());
        assertEquals("available", ex.structure());

        List<ProcessDescriptor> withNull = new ArrayList<>();
        withNull.add(null);
        StateValidationException elementEx = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(withNull, resources(1), new int[]{1}, new int[][]{{0}}, new int[][]{{0}})
        );
        assertEquals(SystemState.REASON_NULL_INPUT, elementEx.reasonCode());
        assertEquals(0, elementEx.row());
    }

    @Test
    @DisplayName("Validation: empty process and resource lists are rejected")
    void testEmptyListsRejected() {
        StateValidationException noProcesses = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(List.of(), resources(1), new int[]{1}, new int[0][], new int[0][])
        );
        assertEquals(SystemState.REASON_EMPTY_PROCESSES, noProcesses.reasonCode());

        StateValidationException noResources = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(processes(1), List.of(), new int[0], new int[][]{{}}, new int[][]{{}})
        );
        assertEquals(SystemState.REASON_EMPTY_RESOURCES, noResources.reasonCode());
    }

    @Test
    @DisplayName("Validation: process and resource ids must be dense and 0-based")
    void testIdsMustBeDense() {
        StateValidationException pidEx = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(
                        List.of(ProcessDescriptor.of(0), ProcessDescriptor.of(2)),
                        resources(1),
                        new int[]{1},
                        new int[][]{{0}, {0}},
                        new int[][]{{0}, {0}}
                )
        );
        assertEquals(SystemState.REASON_PID_NOT_DENSE, pidEx.reasonCode());
        assertEquals(1, pidEx.row());

        StateValidationException ridEx = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(
                        processes(1),
                        List.of(ResourceType.of(1, 1)),
                        new int[]{1},
                        new int[][]{{0}},
                        new int[][]{{0}}
                )
        );
        assertEquals(SystemState.REASON_RID_NOT_DENSE, ridEx.reasonCode());
    }

    @Test
    @DisplayName("Validation: descriptors reject negative ids, blank names and non-positive instances")
    void testDescriptorValidation() {
        assertEquals(SystemState.REASON_NEGATIVE_ID,
                assertThrows(StateValidationException.class, () -> ProcessDescriptor.of(-1)).reasonCode());
        assertEquals(SystemState.REASON_BLANK_NAME,
                assertThrows(StateValidationException.class, () -> new ProcessDescriptor(0, " ")).reasonCode());
        assertEquals(SystemState.REASON_NEGATIVE_ID,
                assertThrows(StateValidationException.class, () -> ResourceType.of(-1, 1)).reasonCode());
        assertEquals(SystemState.REASON_BLANK_NAME,
                assertThrows(StateValidationException.class, () -> new ResourceType(0, null, 1)).reasonCode());
        assertEquals(SystemState.REASON_INSTANCES_NOT_POSITIVE,
                assertThrows(StateValidationException.class, () -> ResourceType.of(0, 0)).reasonCode());
    }

    @Test
    @DisplayName("Validation: vector and matrix dimensions must match n and m")
    void testDimensionMismatch() {
        StateValidationException vectorEx = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(new int[]{1, 1}, new int[]{1}, new int[][]{{0, 0}}, new int[][]{{0, 0}})
        );
        assertEquals(SystemState.REASON_DIMENSION_MISMATCH, vectorEx.reasonCode());
        assertEquals("available", vectorEx.structure());

        StateValidationException rowEx = assertThrows(
                StateValidationException.class,
                () -> SystemState.of(processes(2), resources(1), new int[]{1}, new int[][]{{0}}, new int[][]{{0}, {0}})
        );
        assertEquals(SystemState.REASON_DIMENSION_MISMATCH, rowEx.reasonCode());
        assertEquals("allocation", rowEx.structure());

        StateValidationException columnEx = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(new int[]{1}, new int[]{1}, new int[][]{{0}}, new int[][]{{0, 0}})
        );
        assertEquals(SystemState.REASON_DIMENSION_MISMATCH, columnEx.reasonCode());
        assertEquals("request", columnEx.structure());
        assertEquals(0, columnEx.row());
    }

    @Test
    @DisplayName("Validation: negative entries report the offending cell")
    void testNegativeValueRejected() {
        StateValidationException ex = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(new int[]{1}, new int[]{1}, new int[][]{{0}, {-1}}, new int[][]{{0}, {0}})
        );
        assertEquals(SystemState.REASON_NEGATIVE_VALUE, ex.reasonCode());
        assertEquals("allocation", ex.structure());
        assertEquals(1, ex.row());
        assertEquals(0, ex.column());
        assertTrue(ex.getMessage().contains("negative value at allocation[1][0]"));

        StateValidationException availableEx = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(new int[]{1}, new int[]{-1}, new int[][]{{2}}, new int[][]{{0}})
        );
        assertEquals(SystemState.REASON_NEGATIVE_VALUE, availableEx.reasonCode());
        assertEquals("available", availableEx.structure());
    }

    @Test
    @DisplayName("Validation: resource conservation names the resource and the three totals")
    void testConservationViolated() {
        StateValidationException ex = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(
                        new int[]{1, 1, 7},
                        new int[]{1, 1, 0},
                        new int[][]{{0, 0, 5}},
                        new int[][]{{0, 0, 0}}
                )
        );
        assertEquals(SystemState.REASON_CONSERVATION_VIOLATED, ex.reasonCode());
        assertEquals(2, ex.row());
        assertEquals(
                "[STATE_CONSERVATION_VIOLATED] resource conservation violated for resource 2: "
                        + "available(0)+allocated(5) != total(7)",
                ex.getMessage()
        );
    }

    @Test
    @DisplayName("Validation: a request larger than the total instances is rejected")
    void testRequestExceedsTotal() {
        StateValidationException ex = assertThrows(
                StateValidationException.class,
                () -> SampleStates.state(new int[]{2}, new int[]{2}, new int[][]{{0}}, new int[][]{{3}})
        );
        assertEquals(SystemState.REASON_REQUEST_EXCEEDS_TOTAL, ex.reasonCode());
        assertEquals(0, ex.row());
        assertEquals(0, ex.column());
    }

    @Test
    @DisplayName("toString renders vectors and matrices")
    void testToString() {
        String text = StateFixtures.scenarioB().toString();
        assertTrue(text.contains("n=2"));
        assertTrue(text.contains("allocation=" + Arrays.deepToString(new int[][]{{1, 0}, {0, 1}})));
    }

    private static List<ProcessDescriptor> processes(int n) {
        List<ProcessDescriptor> processes = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            processes.add(ProcessDescriptor.of(i));
        }
        return processes;
    }

    private static List<ResourceType> resources(int m) {
        List<ResourceType> resources = new ArrayList<>();
        for (int j = 0; j < m; j++) {
            resources.add(ResourceType.of(j, 1));
        }
        return resources;
    }
}
