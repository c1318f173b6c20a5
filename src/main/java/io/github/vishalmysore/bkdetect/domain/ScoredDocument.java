package io.github.vishalmysore.bkdetect.domain;

import lombok.Value;

/**
 * A document paired with its similarity to a query vector.
 */
@Value
public class ScoredDocument {
    Document document;
    double score;
}
