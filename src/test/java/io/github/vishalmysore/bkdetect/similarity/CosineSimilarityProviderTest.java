package io.github.vishalmysore.bkdetect.similarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assumptions.assumeThat;

class CosineSimilarityProviderTest {

    private final FeatureHasher hasher = new FeatureHasher(1 << 20);
    private final CosineSimilarityProvider cosine = new CosineSimilarityProvider();

    @Test
    void identicalTokenMultisetsScoreOne() {
        SparseVector a = hasher.vectorize(List.of("кот", "сидит", "окне", "кот"));
        SparseVector b = hasher.vectorize(List.of("кот", "кот", "окне", "сидит"));

        assertThat(cosine.computeSimilarity(a, b)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void disjointVectorsScoreZero() {
        assumeThat(hasher.slot("кот")).isNotEqualTo(hasher.slot("собака"));

        SparseVector a = hasher.vectorize(List.of("кот"));
        SparseVector b = hasher.vectorize(List.of("собака"));

        assertThat(cosine.computeSimilarity(a, b)).isZero();
    }

    @Test
    void partialOverlapIsBetweenZeroAndOne() {
        SparseVector query = hasher.vectorize(List.of("кот", "сид"));
        SparseVector row = hasher.vectorize(List.of("кот", "сид", "окн"));

        assertThat(cosine.computeSimilarity(query, row)).isCloseTo(2.0 / Math.sqrt(6.0), within(1e-12));
    }

    @Test
    void zeroVectorScoresZeroNotNaN() {
        SparseVector row = hasher.vectorize(List.of("кот"));

        assertThat(cosine.computeSimilarity(SparseVector.empty(), row)).isZero();
        assertThat(cosine.computeSimilarity(row, SparseVector.empty())).isZero();
        assertThat(cosine.computeSimilarity(SparseVector.empty(), SparseVector.empty())).isZero();
        assertThat(cosine.computeSimilarity(null, row)).isZero();
    }
}
