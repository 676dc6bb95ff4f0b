package org.detective.samples;

import org.detective.core.state.ProcessDescriptor;
import org.detective.core.state.ResourceType;
import org.detective.core.state.SystemState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * Named demonstration states.
 */
public final class SampleStates {
    public static final String SINGLE_INSTANCE_DEADLOCK = "single-deadlock";
    public static final String SINGLE_INSTANCE_NO_DEADLOCK = "single-safe";
    public static final String MULTI_INSTANCE_DEADLOCK = "multi-deadlock";
    public static final String MULTI_INSTANCE_NO_DEADLOCK = "multi-safe";
    public static final String EMPTY_TEMPLATE = "empty";

    private static final Map<String, Supplier<SystemState>> SAMPLES = createRegistry();

    private SampleStates() {
    }

    /**
     * Sample names in presentation order.
     */
    public static List<String> names() {
        return List.copyOf(SAMPLES.keySet());
    }

    /**
     * Loads one sample by name.
     *
     * @throws NoSuchElementException when the name is unknown.
     */
    public static SystemState load(String name) {
        Supplier<SystemState> sample = SAMPLES.get(name);
        if (sample == null) {
            throw new NoSuchElementException("unknown sample '" + name + "', available: " + names());
        }
        return sample.get();
    }

    /**
     * Classic three-process cycle: P0 holds R0 and wants R1, P1 holds R1 and wants R2,
     * P2 holds R2 and wants R0.
     */
    public static SystemState singleInstanceDeadlock() {
        return state(
                new int[]{1, 1, 1},
                new int[]{0, 0, 0},
                new int[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}},
                new int[][]{{0, 1, 0}, {0, 0, 1}, {1, 0, 0}}
        );
    }

    /**
     * P0 waits on R1, but P1 and P2 request nothing, so everyone finishes.
     */
    public static SystemState singleInstanceNoDeadlock() {
        return state(
                new int[]{1, 1, 1},
                new int[]{0, 0, 0},
                new int[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}},
                new int[][]{{0, 1, 0}, {0, 0, 0}, {0, 0, 0}}
        );
    }

    /**
     * Two instances of each resource, all allocated; every process needs two more it cannot get.
     */
    public static SystemState multiInstanceDeadlock() {
        return state(
                new int[]{2, 2, 2},
                new int[]{0, 0, 0},
                new int[][]{{1, 0, 1}, {1, 1, 0}, {0, 1, 1}},
                new int[][]{{1, 1, 0}, {0, 1, 1}, {1, 0, 1}}
        );
    }

    /**
     * Five processes over 10/5/7 instances; all can finish.
     */
    public static SystemState multiInstanceNoDeadlock() {
        return state(
                new int[]{10, 5, 7},
                new int[]{3, 3, 2},
                new int[][]{{0, 1, 0}, {2, 0, 0}, {3, 0, 2}, {2, 1, 1}, {0, 0, 2}},
                new int[][]{{0, 0, 0}, {1, 0, 2}, {0, 0, 0}, {1, 0, 0}, {0, 0, 2}}
        );
    }

    /**
     * Three idle processes over three free single-instance resources.
     */
    public static SystemState emptyTemplate() {
        return state(
                new int[]{1, 1, 1},
                new int[]{1, 1, 1},
                new int[3][3],
                new int[3][3]
        );
    }

    /**
     * Builds a state with conventional {@code P<i>} / {@code R<j>} names.
     */
    public static SystemState state(int[] instances, int[] available, int[][] allocation, int[][] request) {
        List<ProcessDescriptor> processes = new ArrayList<>(allocation.length);
        for (int i = 0; i < allocation.length; i++) {
            processes.add(ProcessDescriptor.of(i));
        }
        List<ResourceType> resourceTypes = new ArrayList<>(instances.length);
        for (int j = 0; j < instances.length; j++) {
            resourceTypes.add(ResourceType.of(j, instances[j]));
        }
        return SystemState.of(processes, resourceTypes, available, allocation, request);
    }

    private static Map<String, Supplier<SystemState>> createRegistry() {
        Map<String, Supplier<SystemState>> registry = new LinkedHashMap<>();
        registry.put(SINGLE_INSTANCE_DEADLOCK, SampleStates::singleInstanceDeadlock);
        registry.put(SINGLE_INSTANCE_NO_DEADLOCK, SampleStates::singleInstanceNoDeadlock);
        registry.put(MULTI_INSTANCE_DEADLOCK, SampleStates::multiInstanceDeadlock);
        registry.put(MULTI_INSTANCE_NO_DEADLOCK, SampleStates::multiInstanceNoDeadlock);
        registry.put(EMPTY_TEMPLATE, SampleStates::emptyTemplate);
        return Collections.unmodifiableMap(registry);
    }
}
