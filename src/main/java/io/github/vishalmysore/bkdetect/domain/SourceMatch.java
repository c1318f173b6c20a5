package io.github.vishalmysore.bkdetect.domain;

import lombok.Value;

import java.nio.file.Path;

/**
 * A candidate source file with the best cosine similarity any of its units
 * reached against one query.
 */
@Value
public class SourceMatch {
    Path path;
    double score;
}
