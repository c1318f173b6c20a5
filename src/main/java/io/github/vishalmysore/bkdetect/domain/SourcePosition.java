package io.github.vishalmysore.bkdetect.domain;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * A unit inside a matched file that shares at least one normalized token with
 * the query. {@code score} is the score of the parent file match, not a
 * per-fragment similarity.
 */
@Value
@Builder
public class SourcePosition {
    Path path;
    int index; // 1-based unit number
    String snippet;
    double score;
    String label;
}
