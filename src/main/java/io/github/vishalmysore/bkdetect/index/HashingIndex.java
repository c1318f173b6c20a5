package io.github.vishalmysore.bkdetect.index;

import io.github.vishalmysore.bkdetect.domain.Document;
import io.github.vishalmysore.bkdetect.domain.ScoredDocument;
import io.github.vishalmysore.bkdetect.similarity.CosineSimilarityProvider;
import io.github.vishalmysore.bkdetect.similarity.FeatureHasher;
import io.github.vishalmysore.bkdetect.similarity.SimilarityProvider;
import io.github.vishalmysore.bkdetect.similarity.SparseVector;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * In-memory corpus of hashed unit vectors, grown batch by batch.
 * <p>
 * Row {@code i} of the matrix always belongs to {@code documents.get(i)};
 * rows are only ever appended. Appends are serialized by a write lock, and
 * queries share a read lock so a stable index can be searched concurrently.
 * <p>
 * Scoring is delegated to a pluggable {@link SimilarityProvider}, cosine by
 * default.
 */
public class HashingIndex {
    private static final Logger log = Logger.getLogger(HashingIndex.class.getName());

    private final FeatureHasher hasher;
    private final SimilarityProvider similarityProvider;
    private final List<SparseVector> rows = new ArrayList<>();
    private final List<Document> documents = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public HashingIndex(int featureCount) {
        this(new FeatureHasher(featureCount), new CosineSimilarityProvider());
    }

    public HashingIndex(FeatureHasher hasher, SimilarityProvider similarityProvider) {
        this.hasher = hasher;
        this.similarityProvider = similarityProvider;
        log.info("HashingIndex initialized: features=" + hasher.getFeatureCount()
                + ", similarity=" + similarityProvider.getName());
    }

    /**
     * Vectorizes and appends every document of the batch that has tokens.
     * Documents without tokens are skipped, not stored as zero rows.
     *
     * @return number of rows appended
     */
    public int append(Collection<Document> batch) {
        List<SparseVector> batchRows = new ArrayList<>(batch.size());
        List<Document> batchDocuments = new ArrayList<>(batch.size());
        for (Document document : batch) {
            if (!document.hasTokens())
                continue;
            batchRows.add(hasher.vectorize(document.getTokens()));
            batchDocuments.add(document);
        }
        if (batchRows.isEmpty())
            return 0;

        lock.writeLock().lock();
        try {
            rows.addAll(batchRows);
            documents.addAll(batchDocuments);
            log.fine("Appended " + batchRows.size() + " rows, index size " + rows.size());
        } finally {
            lock.writeLock().unlock();
        }
        return batchRows.size();
    }

    /**
     * Full ranking of every indexed unit against the query tokens.
     */
    public List<ScoredDocument> query(List<String> tokens) {
        return query(tokens, Integer.MAX_VALUE);
    }

    /**
     * Scores every row against the query and returns at most {@code topK}
     * documents by descending similarity; equal scores keep insertion order.
     */
    public List<ScoredDocument> query(List<String> tokens, int topK) {
        if (topK <= 0)
            return Collections.emptyList();
        SparseVector queryVector = hasher.vectorize(tokens);

        List<ScoredDocument> ranked;
        lock.readLock().lock();
        try {
            if (rows.isEmpty())
                return Collections.emptyList();
            ranked = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                double score = similarityProvider.computeSimilarity(queryVector, rows.get(i));
                ranked.add(new ScoredDocument(documents.get(i), score));
            }
        } finally {
            lock.readLock().unlock();
        }

        // List.sort is stable
        ranked.sort(Comparator.comparingDouble(ScoredDocument::getScore).reversed());
        return topK >= ranked.size() ? ranked : new ArrayList<>(ranked.subList(0, topK));
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rows.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Snapshot of the indexed documents in row order. */
    public List<Document> getDocuments() {
        lock.readLock().lock();
        try {
            return List.copyOf(documents);
        } finally {
            lock.readLock().unlock();
        }
    }

    public FeatureHasher getHasher() {
        return hasher;
    }

    public SimilarityProvider getSimilarityProvider() {
        return similarityProvider;
    }
}
