package io.github.vishalmysore.bkdetect.similarity;

/**
 * Strategy interface for scoring a query vector against an index row.
 */
public interface SimilarityProvider {

    /**
     * Compute similarity between two vectors of the same feature space.
     *
     * @return a score between 0.0 (nothing shared) and 1.0 (same direction)
     */
    double computeSimilarity(SparseVector query, SparseVector row);

    /**
     * Descriptive name of this provider (for logging/reporting).
     */
    String getName();
}
