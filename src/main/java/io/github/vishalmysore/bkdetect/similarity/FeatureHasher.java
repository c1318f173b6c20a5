package io.github.vishalmysore.bkdetect.similarity;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.SortedMap;
import java.util.TreeMap;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The shared coordinate system of the index: every token is hashed with
 * MurmurHash3 (32 bit, seed 0) into one of {@code featureCount} slots and adds
 * 1.0 to it. No vocabulary is kept, so each unit is vectorized on its own;
 * colliding tokens simply share a slot.
 */
public class FeatureHasher {
    private static final HashFunction MURMUR = Hashing.murmur3_32_fixed();

    private final int featureCount;

    public FeatureHasher(int featureCount) {
        checkArgument(featureCount > 0, "featureCount must be > 0 (got %s)", featureCount);
        this.featureCount = featureCount;
    }

    public int slot(String token) {
        int h = MURMUR.hashString(token, StandardCharsets.UTF_8).asInt();
        return (int) (Math.abs((long) h) % featureCount);
    }

    public SparseVector vectorize(Collection<String> tokens) {
        if (tokens.isEmpty())
            return SparseVector.empty();
        SortedMap<Integer, Double> counts = new TreeMap<>();
        for (String token : tokens) {
            counts.merge(slot(token), 1.0, Double::sum);
        }
        return SparseVector.of(counts);
    }

    public int getFeatureCount() {
        return featureCount;
    }
}
