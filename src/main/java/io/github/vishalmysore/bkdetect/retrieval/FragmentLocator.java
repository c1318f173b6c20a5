package io.github.vishalmysore.bkdetect.retrieval;

import io.github.vishalmysore.bkdetect.domain.SourceMatch;
import io.github.vishalmysore.bkdetect.domain.SourcePosition;
import io.github.vishalmysore.bkdetect.domain.UnitKind;
import io.github.vishalmysore.bkdetect.loader.DocumentFormat;
import io.github.vishalmysore.bkdetect.loader.SourceReader;
import io.github.vishalmysore.bkdetect.text.TextPipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Second stage of a search: re-opens each matched file and reports the units
 * (lines, or paragraphs for rich documents) sharing at least one normalized
 * token with the query.
 * <p>
 * It only explains matches already selected; no similarity is recomputed
 * and every position carries its file's match score.
 */
public class FragmentLocator {
    private static final Logger log = Logger.getLogger(FragmentLocator.class.getName());

    public static final String ELLIPSIS = "...";

    private final TextPipeline pipeline;
    private final boolean parallel;

    public FragmentLocator(TextPipeline pipeline) {
        this(pipeline, false);
    }

    public FragmentLocator(TextPipeline pipeline, boolean parallel) {
        this.pipeline = pipeline;
        this.parallel = parallel;
    }

    /**
     * Positions for every match, in match order; within a file in unit order,
     * at most {@code maxPositionsPerFile} each.
     */
    public List<SourcePosition> locate(List<SourceMatch> matches, String queryText,
            int maxPositionsPerFile, int snippetLength) {
        if (matches.isEmpty())
            return Collections.emptyList();
        Set<String> queryTokens = pipeline.tokenSet(queryText);
        if (queryTokens.isEmpty())
            return Collections.emptyList();

        Stream<SourceMatch> stream = parallel ? matches.parallelStream() : matches.stream();
        List<List<SourcePosition>> perFile = stream
                .map(match -> scan(match, queryTokens, maxPositionsPerFile, snippetLength))
                .collect(Collectors.toList());

        List<SourcePosition> positions = new ArrayList<>();
        perFile.forEach(positions::addAll);
        log.info("Located " + positions.size() + " fragments in " + matches.size() + " files");
        return positions;
    }

    List<SourcePosition> scan(SourceMatch match, Set<String> queryTokens, int maxPositionsPerFile,
            int snippetLength) {
        Path path = match.getPath();
        UnitKind kind = DocumentFormat.forPath(path)
                .map(DocumentFormat::getUnitKind)
                .orElse(UnitKind.LINE);

        List<String> units;
        try {
            units = kind == UnitKind.PARAGRAPH ? SourceReader.readParagraphs(path) : SourceReader.readLines(path);
        } catch (IOException e) {
            log.warning("Could not re-scan " + path + ": " + e.getMessage());
            return Collections.emptyList();
        }

        List<SourcePosition> positions = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            if (positions.size() >= maxPositionsPerFile)
                break;
            String text = units.get(i).strip();
            if (text.isEmpty())
                continue;
            if (sharesToken(text, queryTokens)) {
                positions.add(SourcePosition.builder()
                        .path(path)
                        .index(i + 1)
                        .snippet(truncate(text, snippetLength))
                        .score(match.getScore())
                        .label(kind.getLabel())
                        .build());
            }
        }
        return positions;
    }

    private boolean sharesToken(String text, Set<String> queryTokens) {
        for (String token : pipeline.transform(text)) {
            if (queryTokens.contains(token))
                return true;
        }
        return false;
    }

    /**
     * Keeps the first {@code limit} characters; when anything was cut the
     * trailing blanks are dropped and {@value #ELLIPSIS} appended.
     */
    public static String truncate(String text, int limit) {
        if (text.codePointCount(0, text.length()) <= limit)
            return text;
        int end = text.offsetByCodePoints(0, limit);
        return text.substring(0, end).stripTrailing() + ELLIPSIS;
    }
}
