package io.github.vishalmysore.bkdetect.similarity;

/**
 * Cosine similarity over hashed term-frequency vectors.
 * <p>
 * Weights are never negative, so the result lies in [0, 1]. An all-zero
 * vector on either side scores 0.
 */
public class CosineSimilarityProvider implements SimilarityProvider {

    @Override
    public double computeSimilarity(SparseVector query, SparseVector row) {
        if (query == null || row == null)
            return 0.0;
        return cosine(query, row);
    }

    /**
     * Cosine similarity: dot(A, B) / (||A|| * ||B||)
     */
    private double cosine(SparseVector a, SparseVector b) {
        double denom = a.norm() * b.norm();
        if (denom == 0.0)
            return 0.0;
        double value = a.dot(b) / denom;
        // rounding can push identical vectors marginally above 1
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String getName() {
        return "Cosine (hashed term frequencies)";
    }
}
