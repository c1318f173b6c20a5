package io.github.vishalmysore.bkdetect.retrieval;

import io.github.vishalmysore.bkdetect.config.SearchSettings;
import io.github.vishalmysore.bkdetect.domain.Document;
import io.github.vishalmysore.bkdetect.domain.ScoredDocument;
import io.github.vishalmysore.bkdetect.domain.SourceMatch;
import io.github.vishalmysore.bkdetect.domain.SourcePosition;
import io.github.vishalmysore.bkdetect.index.HashingIndex;
import io.github.vishalmysore.bkdetect.loader.ChunkedDocumentLoader;
import io.github.vishalmysore.bkdetect.loader.SourceReader;
import io.github.vishalmysore.bkdetect.text.TextPipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Two-stage source search over a corpus of documents:
 * Stage 1: rank files by the best cosine similarity of any of their units.
 * Stage 2: point to the units of the top files that overlap the query
 * ({@link FragmentLocator}).
 * <p>
 * The index is built once by {@link #buildIndex()}; queries must only run
 * after it returns.
 */
public class SourceFinder {
    private static final Logger log = Logger.getLogger(SourceFinder.class.getName());

    private final ChunkedDocumentLoader loader;
    private final TextPipeline pipeline;
    private final HashingIndex index;
    private final FragmentLocator locator;
    private final SearchSettings settings;
    private boolean built;

    public SourceFinder(ChunkedDocumentLoader loader, TextPipeline pipeline, HashingIndex index,
            SearchSettings settings) {
        this.loader = loader;
        this.pipeline = pipeline;
        this.index = index;
        this.settings = settings;
        this.locator = new FragmentLocator(pipeline, settings.isParallel());
    }

    public static SourceFinder fromPath(Path inputPath, SearchSettings settings) {
        ChunkedDocumentLoader loader = new ChunkedDocumentLoader(inputPath, settings.getChunkSize());
        TextPipeline pipeline = new TextPipeline(settings);
        HashingIndex index = new HashingIndex(settings.getFeatureCount());
        return new SourceFinder(loader, pipeline, index, settings);
    }

    /**
     * Normalizes and indexes every batch the loader produces, in order.
     *
     * @throws java.nio.file.NoSuchFileException when the input path does not exist
     */
    public void buildIndex() throws IOException {
        if (built)
            throw new IllegalStateException("Index already built; create a new SourceFinder to rebuild");
        log.info("Building index from " + loader.getRoot());

        int batches = 0;
        Iterator<List<Document>> it = loader.load();
        while (it.hasNext()) {
            index.append(process(it.next()));
            batches++;
        }
        built = true;
        log.info("Index built: " + index.size() + " units from " + batches + " batches");
    }

    private List<Document> process(List<Document> batch) {
        Stream<Document> stream = settings.isParallel() ? batch.parallelStream() : batch.stream();
        return stream
                .map(document -> document.withTokens(pipeline.transform(document.getText())))
                .collect(Collectors.toList());
    }

    /**
     * Files most likely to be the source of {@code queryText}, best first.
     * Files whose best unit scores 0 are never returned.
     */
    public List<SourceMatch> findSources(String queryText, int topK) {
        List<String> tokens = pipeline.transform(queryText);
        if (tokens.isEmpty() || topK <= 0)
            return Collections.emptyList();

        // aggregate over the full unit ranking before cutting to topK: several
        // units may belong to the same file
        List<ScoredDocument> ranking = index.query(tokens);
        Map<Path, Double> best = aggregateBestScores(ranking);

        List<Map.Entry<Path, Double>> ranked = new ArrayList<>(best.entrySet());
        ranked.sort(Map.Entry.<Path, Double>comparingByValue().reversed());
        List<SourceMatch> matches = ranked.stream()
                .limit(topK)
                .map(e -> new SourceMatch(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
        log.info("Stage 1 - " + ranking.size() + " units scored, " + best.size() + " files matched, "
                + matches.size() + " returned");
        return matches;
    }

    public List<SourceMatch> findSources(String queryText) {
        return findSources(queryText, settings.getTopK());
    }

    public List<SourceMatch> findSourcesFromFile(Path queryFile, int topK) throws IOException {
        return findSources(SourceReader.readText(queryFile), topK);
    }

    /**
     * Matching fragments of the top files, in file rank order and unit order
     * within a file.
     */
    public List<SourcePosition> locateSourcePositions(String queryText, int topK, int maxPositionsPerFile,
            int snippetLength) {
        List<SourceMatch> matches = findSources(queryText, topK);
        if (matches.isEmpty())
            return Collections.emptyList();
        return locator.locate(matches, queryText, maxPositionsPerFile, snippetLength);
    }

    public List<SourcePosition> locateSourcePositions(String queryText) {
        return locateSourcePositions(queryText, settings.getTopK(), settings.getMaxPositionsPerFile(),
                settings.getSnippetLength());
    }

    /**
     * Best score per file in order of first appearance, non-positive scores
     * dropped.
     */
    static Map<Path, Double> aggregateBestScores(List<ScoredDocument> ranking) {
        Map<Path, Double> best = new LinkedHashMap<>();
        for (ScoredDocument scored : ranking) {
            if (scored.getScore() <= 0.0)
                continue;
            Path path = scored.getDocument().getPath();
            if (scored.getScore() > best.getOrDefault(path, 0.0))
                best.put(path, scored.getScore());
        }
        return best;
    }

    public boolean isBuilt() {
        return built;
    }

    public int getIndexedUnitCount() {
        return index.size();
    }

    public SearchSettings getSettings() {
        return settings;
    }

    public TextPipeline getPipeline() {
        return pipeline;
    }

    public HashingIndex getIndex() {
        return index;
    }
}
