package org.detective.recovery;

import java.util.Arrays;
import java.util.NoSuchElementException;

/**
 * Iterative generator of k-combinations over index range {@code [0, n)}.
 *
 * <p>Sizes are visited in increasing order and, within one size, combinations come in
 * lexicographic order. Only the current index array is held, so memory stays {@code O(n)}
 * regardless of how many subsets are visited.</p>
 */
final class CombinationCursor {
    private final int n;
    private int size;
    private int[] current;
    private boolean primed;

    CombinationCursor(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        this.n = n;
        this.size = 1;
    }

    /**
     * Returns whether another combination exists in the current size.
     */
    boolean hasNextInSize() {
        if (size > n) {
            return false;
        }
        if (!primed) {
            return true;
        }
        for (int k = size - 1; k >= 0; k--) {
            if (current[k] < n - size + k) {
                return true;
            }
        }
        return false;
    }

    /**
     * Advances to the next combination of the current size.
     *
     * @return shared index array; valid until the next call.
     */
    int[] nextInSize() {
        if (!hasNextInSize()) {
            throw new NoSuchElementException("no more combinations of size " + size);
        }
        if (!primed) {
            current = new int[size];
            for (int k = 0; k < size; k++) {
                current[k] = k;
            }
            primed = true;
            return current;
        }
        int k = size - 1;
        while (current[k] == n - size + k) {
            k--;
        }
        current[k]++;
        for (int t = k + 1; t < size; t++) {
            current[t] = current[t - 1] + 1;
        }
        return current;
    }

    /**
     * Moves to the next combination size.
     *
     * @return false when no larger size exists.
     */
    boolean advanceSize() {
        if (size >= n) {
            size = n + 1;
            return false;
        }
        size++;
        primed = false;
        return true;
    }

    int size() {
        return size;
    }

    @Override
    public String toString() {
        return "CombinationCursor(n=" + n + ", size=" + size
                + ", current=" + (primed ? Arrays.toString(current) : "[]") + ")";
    }
}
