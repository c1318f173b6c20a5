package io.github.vishalmysore.bkdetect.similarity;

import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;

/**
 * Immutable sparse vector over the hashed feature space: strictly increasing
 * slot ids with their weights, plus the cached L2 norm.
 */
public final class SparseVector {
    private static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

    private final int[] slots;
    private final double[] weights;
    private final double norm;

    private SparseVector(int[] slots, double[] weights) {
        this.slots = slots;
        this.weights = weights;
        double sum = 0.0;
        for (double w : weights) {
            sum += w * w;
        }
        this.norm = Math.sqrt(sum);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    static SparseVector of(SortedMap<Integer, Double> entries) {
        if (entries.isEmpty())
            return EMPTY;
        int[] slots = new int[entries.size()];
        double[] weights = new double[entries.size()];
        int i = 0;
        for (Map.Entry<Integer, Double> e : entries.entrySet()) {
            slots[i] = e.getKey();
            weights[i] = e.getValue();
            i++;
        }
        return new SparseVector(slots, weights);
    }

    public double dot(SparseVector other) {
        double dot = 0.0;
        int i = 0, j = 0;
        while (i < slots.length && j < other.slots.length) {
            if (slots[i] == other.slots[j]) {
                dot += weights[i++] * other.weights[j++];
            } else if (slots[i] < other.slots[j]) {
                i++;
            } else {
                j++;
            }
        }
        return dot;
    }

    public double norm() {
        return norm;
    }

    public int nonZeroCount() {
        return slots.length;
    }

    public boolean isZero() {
        return slots.length == 0;
    }

    /** Weight at {@code slot}, 0 when the slot is not set. */
    public double get(int slot) {
        int pos = Arrays.binarySearch(slots, slot);
        return pos >= 0 ? weights[pos] : 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SparseVector))
            return false;
        SparseVector that = (SparseVector) o;
        return Arrays.equals(slots, that.slots) && Arrays.equals(weights, that.weights);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(slots) + Arrays.hashCode(weights);
    }

    @Override
    public String toString() {
        return "SparseVector{nnz=" + slots.length + ", norm=" + norm + "}";
    }
}
