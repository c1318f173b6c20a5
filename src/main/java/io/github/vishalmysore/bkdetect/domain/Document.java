package io.github.vishalmysore.bkdetect.domain;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * One indexable unit of a source file: a line, a paragraph or a whole file,
 * depending on the format it was extracted from.
 * <p>
 * A loader creates the document in its raw form (no tokens). Normalization
 * produces a new instance through {@link #withTokens(List)}; neither instance
 * is ever mutated.
 */
@Value
@Builder(toBuilder = true)
public class Document {
    Path path;
    String text;

    // Provenance written by the loader (line number, paragraph, csv row...)
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();

    @Builder.Default
    List<String> tokens = Collections.emptyList();

    public static Document raw(Path path, String text, Map<String, Object> metadata) {
        return Document.builder()
                .path(path)
                .text(text)
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
    }

    public Document withTokens(List<String> normalized) {
        return toBuilder().tokens(List.copyOf(normalized)).build();
    }

    public boolean hasTokens() {
        return !tokens.isEmpty();
    }

    @Override
    public String toString() {
        return "<Document path=" + path + " metadata=" + new TreeSet<>(metadata.keySet()) + ">";
    }
}
