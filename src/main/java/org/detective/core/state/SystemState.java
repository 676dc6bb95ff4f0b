package org.detective.core.state;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Builder;
import lombok.EqualsAndHashCode;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable resource-allocation snapshot consumed by the detectors.
 *
 * <p>Textbook notation: {@code n} processes, {@code m} resource types, the
 * {@code Available[m]} vector and the {@code Allocation[n][m]} / {@code Request[n][m]}
 * matrices. Instances are created only through {@link #of} (or its builder), which validates
 * every structural rule before anything is exposed:</p>
 * <ul>
 * <li>at least one process and one resource type, with dense 0-based ids;</li>
 * <li>vector and matrix dimensions agree with {@code n} and {@code m};</li>
 * <li>every entry is non-negative;</li>
 * <li>resource conservation: {@code available[j] + sum_i allocation[i][j] == instances[j]};</li>
 * <li>no request exceeds the total instances of its resource.</li>
 * </ul>
 * <p>All inputs are copied on the way in and every row accessor returns a copy, so a state can be
 * shared across threads freely.</p>
 */
@EqualsAndHashCode
public final class SystemState {
    public static final String REASON_EMPTY_PROCESSES = "STATE_EMPTY_PROCESSES";
    public static final String REASON_EMPTY_RESOURCES = "STATE_EMPTY_RESOURCES";
    public static final String REASON_NULL_INPUT = "STATE_NULL_INPUT";
    public static final String REASON_NEGATIVE_ID = "STATE_NEGATIVE_ID";
    public static final String REASON_BLANK_NAME = "STATE_BLANK_NAME";
    public static final String REASON_INSTANCES_NOT_POSITIVE = "STATE_INSTANCES_NOT_POSITIVE";
    public static final String REASON_PID_NOT_DENSE = "STATE_PID_NOT_DENSE";
    public static final String REASON_RID_NOT_DENSE = "STATE_RID_NOT_DENSE";
    public static final String REASON_DIMENSION_MISMATCH = "STATE_DIMENSION_MISMATCH";
    public static final String REASON_NEGATIVE_VALUE = "STATE_NEGATIVE_VALUE";
    public static final String REASON_CONSERVATION_VIOLATED = "STATE_CONSERVATION_VIOLATED";
    public static final String REASON_REQUEST_EXCEEDS_TOTAL = "STATE_REQUEST_EXCEEDS_TOTAL";

    private final List<ProcessDescriptor> processes;
    private final List<ResourceType> resourceTypes;
    private final int[] available;
    private final int[][] allocation;
    private final int[][] request;

    @EqualsAndHashCode.Exclude
    private final int[][] holdersByResource;

    private SystemState(
            List<ProcessDescriptor> processes,
            List<ResourceType> resourceTypes,
            int[] available,
            int[][] allocation,
            int[][] request
    ) {
        this.processes = processes;
        this.resourceTypes = resourceTypes;
        this.available = available;
        this.allocation = allocation;
        this.request = request;
        this.holdersByResource = buildHolderIndex(allocation, resourceTypes.size());
    }

    /**
     * Validates raw input and creates a state.
     *
     * @param processes processes ordered by pid.
     * @param resourceTypes resource types ordered by rid.
     * @param available free instances per resource.
     * @param allocation held instances, one row per process.
     * @param request wanted-but-not-held instances, one row per process.
     * @return validated immutable state.
     * @throws StateValidationException when any structural rule fails.
     */
    @Builder
    public static SystemState of(
            List<ProcessDescriptor> processes,
            List<ResourceType> resourceTypes,
            int[] available,
            int[][] allocation,
            int[][] request
    ) {
        requireInput(processes, "processes");
        requireInput(resourceTypes, "resourceTypes");
        requireInput(available, "available");
        requireInput(allocation, "allocation");
        requireInput(request, "request");
        requireElements(processes, "processes");
        requireElements(resourceTypes, "resourceTypes");

        List<ProcessDescriptor> processCopy = List.copyOf(processes);
        List<ResourceType> resourceCopy = List.copyOf(resourceTypes);
        int n = processCopy.size();
        int m = resourceCopy.size();
        if (n == 0) {
            throw new StateValidationException(
                    REASON_EMPTY_PROCESSES, "processes", -1, -1, "at least one process is required");
        }
        if (m == 0) {
            throw new StateValidationException(
                    REASON_EMPTY_RESOURCES, "resourceTypes", -1, -1, "at least one resource type is required");
        }
        for (int i = 0; i < n; i++) {
            if (processCopy.get(i).getPid() != i) {
                throw new StateValidationException(
                        REASON_PID_NOT_DENSE,
                        "processes",
                        i,
                        -1,
                        "process at position " + i + " has pid " + processCopy.get(i).getPid() + ", expected " + i
                );
            }
        }
        for (int j = 0; j < m; j++) {
            if (resourceCopy.get(j).getRid() != j) {
                throw new StateValidationException(
                        REASON_RID_NOT_DENSE,
                        "resourceTypes",
                        j,
                        -1,
                        "resource at position " + j + " has rid " + resourceCopy.get(j).getRid() + ", expected " + j
                );
            }
        }

        checkVectorLength(available, m, "available");
        checkMatrixShape(allocation, n, m, "allocation");
        checkMatrixShape(request, n, m, "request");

        int[] availableCopy = available.clone();
        int[][] allocationCopy = deepCopy(allocation);
        int[][] requestCopy = deepCopy(request);

        for (int j = 0; j < m; j++) {
            if (availableCopy[j] < 0) {
                throw new StateValidationException(
                        REASON_NEGATIVE_VALUE, "available", j, -1, "negative value at available[" + j + "]");
            }
        }
        checkNonNegative(allocationCopy, "allocation");
        checkNonNegative(requestCopy, "request");

        for (int j = 0; j < m; j++) {
            long allocated = 0L;
            for (int i = 0; i < n; i++) {
                allocated += allocationCopy[i][j];
            }
            int total = resourceCopy.get(j).getInstances();
            if (availableCopy[j] + allocated != total) {
                throw new StateValidationException(
                        REASON_CONSERVATION_VIOLATED,
                        "available",
                        j,
                        -1,
                        "resource conservation violated for resource " + j + ": available(" + availableCopy[j]
                                + ")+allocated(" + allocated + ") != total(" + total + ")"
                );
            }
        }

        for (int i = 0; i < n; i++) {
            for (int j = 0; j < m; j++) {
                int total = resourceCopy.get(j).getInstances();
                if (requestCopy[i][j] > total) {
                    throw new StateValidationException(
                            REASON_REQUEST_EXCEEDS_TOTAL,
                            "request",
                            i,
                            j,
                            "request[" + i + "][" + j + "] = " + requestCopy[i][j]
                                    + " exceeds total instances of resource " + j + " (" + total + ")"
                    );
                }
            }
        }

        return new SystemState(processCopy, resourceCopy, availableCopy, allocationCopy, requestCopy);
    }

    /** Number of processes ({@code n}). */
    public int processCount() {
        return processes.size();
    }

    /** Number of resource types ({@code m}). */
    public int resourceCount() {
        return resourceTypes.size();
    }

    public List<ProcessDescriptor> processes() {
        return processes;
    }

    public List<ResourceType> resourceTypes() {
        return resourceTypes;
    }

    public ProcessDescriptor process(int pid) {
        return processes.get(pid);
    }

    public ResourceType resourceType(int rid) {
        return resourceTypes.get(rid);
    }

    public int totalInstances(int rid) {
        return resourceTypes.get(rid).getInstances();
    }

    public int available(int rid) {
        return available[rid];
    }

    public int allocation(int pid, int rid) {
        return allocation[pid][rid];
    }

    public int request(int pid, int rid) {
        return request[pid][rid];
    }

    /** Copy of the available vector. */
    public int[] availableVector() {
        return available.clone();
    }

    /** Copy of one allocation row. */
    public int[] allocationRow(int pid) {
        return allocation[pid].clone();
    }

    /** Copy of one request row. */
    public int[] requestRow(int pid) {
        return request[pid].clone();
    }

    /** Deep copy of the allocation matrix. */
    public int[][] allocationMatrix() {
        return deepCopy(allocation);
    }

    /** Deep copy of the request matrix. */
    public int[][] requestMatrix() {
        return deepCopy(request);
    }

    /**
     * Returns processes currently holding at least one instance of a resource, ascending by pid.
     */
    public int[] holdersOf(int rid) {
        return holdersByResource[rid].clone();
    }

    /**
     * Returns whether every resource type has exactly one instance.
     *
     * <p>This is the dispatch key for choosing the wait-for detector over the reachability
     * detector.</p>
     */
    public boolean isSingleInstance() {
        for (ResourceType resourceType : resourceTypes) {
            if (resourceType.getInstances() != 1) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "SystemState(n=" + processCount()
                + ", m=" + resourceCount()
                + ", available=" + Arrays.toString(available)
                + ", allocation=" + Arrays.deepToString(allocation)
                + ", request=" + Arrays.deepToString(request)
                + ")";
    }

    private static int[][] buildHolderIndex(int[][] allocation, int resourceCount) {
        int[][] holders = new int[resourceCount][];
        for (int j = 0; j < resourceCount; j++) {
            IntArrayList resourceHolders = new IntArrayList();
            for (int i = 0; i < allocation.length; i++) {
                if (allocation[i][j] > 0) {
                    resourceHolders.add(i);
                }
            }
            holders[j] = resourceHolders.toIntArray();
        }
        return holders;
    }

    private static void requireInput(Object value, String structure) {
        if (value == null) {
            throw new StateValidationException(REASON_NULL_INPUT, structure, -1, -1, structure + " must be non-null");
        }
    }

    private static void requireElements(List<?> values, String structure) {
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw new StateValidationException(
                        REASON_NULL_INPUT, structure, i, -1, structure + "[" + i + "] must be non-null");
            }
        }
    }

    private static void checkVectorLength(int[] vector, int expected, String structure) {
        if (vector.length != expected) {
            throw new StateValidationException(
                    REASON_DIMENSION_MISMATCH,
                    structure,
                    -1,
                    -1,
                    structure + " must have " + expected + " elements, got " + vector.length
            );
        }
    }

    private static void checkMatrixShape(int[][] matrix, int rows, int columns, String structure) {
        if (matrix.length != rows) {
            throw new StateValidationException(
                    REASON_DIMENSION_MISMATCH,
                    structure,
                    -1,
                    -1,
                    structure + " must have " + rows + " rows, got " + matrix.length
            );
        }
        for (int i = 0; i < rows; i++) {
            if (matrix[i] == null) {
                throw new StateValidationException(
                        REASON_NULL_INPUT, structure, i, -1, structure + "[" + i + "] must be non-null");
            }
            if (matrix[i].length != columns) {
                throw new StateValidationException(
                        REASON_DIMENSION_MISMATCH,
                        structure,
                        i,
                        -1,
                        structure + "[" + i + "] must have " + columns + " columns, got " + matrix[i].length
                );
            }
        }
    }

    private static void checkNonNegative(int[][] matrix, String structure) {
        for (int i = 0; i < matrix.length; i++) {
            for (int j = 0; j < matrix[i].length; j++) {
                if (matrix[i][j] < 0) {
                    throw new StateValidationException(
                            REASON_NEGATIVE_VALUE,
                            structure,
                            i,
                            j,
                            "negative value at " + structure + "[" + i + "][" + j + "]"
                    );
                }
            }
        }
    }

    private static int[][] deepCopy(int[][] matrix) {
        int[][] copy = new int[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i].clone();
        }
        return copy;
    }
}
