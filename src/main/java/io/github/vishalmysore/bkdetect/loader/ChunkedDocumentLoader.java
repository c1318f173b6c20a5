package io.github.vishalmysore.bkdetect.loader;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import io.github.vishalmysore.bkdetect.domain.Document;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects documents from a file or a directory tree and hands them out in
 * batches of at most {@code chunkSize}.
 * <p>
 * Units per format:
 * <ul>
 * <li>.txt: every non-blank line ({@code line_number})</li>
 * <li>.docx: every non-blank paragraph ({@code paragraph})</li>
 * <li>.csv: every non-blank record after the header ({@code csv_row}, {@code header})</li>
 * <li>.html/.htm: the whole raw file ({@code suffix})</li>
 * </ul>
 * Files are visited in sorted path order and read one at a time, when the
 * batch iterator reaches them. A file that cannot be read or parsed is logged
 * and skipped.
 */
public class ChunkedDocumentLoader {
    private static final Logger log = Logger.getLogger(ChunkedDocumentLoader.class.getName());

    // blank records still count towards csv_row
    private static final CSVFormat CSV_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(false)
            .build();

    private final Path root;
    private final int chunkSize;

    public ChunkedDocumentLoader(Path root, int chunkSize) {
        this.root = root;
        this.chunkSize = Math.max(1, chunkSize);
    }

    /**
     * @throws NoSuchFileException when the root path does not exist
     */
    public Iterator<List<Document>> load() throws IOException {
        if (!Files.exists(root))
            throw new NoSuchFileException(root.toString(), null, "Path does not exist");

        Iterator<Path> files = listFiles().iterator();
        return new AbstractIterator<>() {
            private Iterator<List<Document>> current = Collections.emptyIterator();

            @Override
            protected List<Document> computeNext() {
                while (!current.hasNext()) {
                    if (!files.hasNext())
                        return endOfData();
                    current = Lists.partition(extract(files.next()), chunkSize).iterator();
                }
                return current.next();
            }
        };
    }

    /**
     * Every document below the root, ignoring batch boundaries.
     */
    public List<Document> loadAll() throws IOException {
        List<Document> all = new ArrayList<>();
        Iterators.addAll(all, Iterators.concat(Iterators.transform(load(), List::iterator)));
        return all;
    }

    List<Path> listFiles() throws IOException {
        if (Files.isRegularFile(root))
            return DocumentFormat.forPath(root).isPresent() ? List.of(root) : List.of();
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> DocumentFormat.forPath(p).isPresent())
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    List<Document> extract(Path file) {
        DocumentFormat format = DocumentFormat.forPath(file).orElseThrow();
        try {
            switch (format) {
                case TEXT:
                    return loadText(file);
                case DOCX:
                    return loadDocx(file);
                case CSV:
                    return loadCsv(file);
                case HTML:
                    return loadHtml(file);
                default:
                    throw new IllegalStateException("Unhandled format " + format);
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.warning("Skipping " + file + ": " + e.getMessage());
            return List.of();
        }
    }

    private List<Document> loadText(Path file) throws IOException {
        List<Document> documents = new ArrayList<>();
        List<String> lines = SourceReader.readLines(file);
        for (int i = 0; i < lines.size(); i++) {
            String text = lines.get(i).strip();
            if (text.isEmpty())
                continue;
            documents.add(Document.raw(file, text, Map.of("line_number", i + 1)));
        }
        return documents;
    }

    private List<Document> loadDocx(Path file) throws IOException {
        List<Document> documents = new ArrayList<>();
        List<String> paragraphs = SourceReader.readParagraphs(file);
        for (int i = 0; i < paragraphs.size(); i++) {
            String text = paragraphs.get(i).strip();
            if (text.isEmpty())
                continue;
            documents.add(Document.raw(file, text, Map.of("paragraph", i + 1)));
        }
        return documents;
    }

    private List<Document> loadCsv(Path file) throws IOException {
        List<Document> documents = new ArrayList<>();
        try (CSVParser parser = CSV_FORMAT.parse(new StringReader(SourceReader.readText(file)))) {
            List<String> header = null;
            int row = 0;
            for (CSVRecord record : parser) {
                row++;
                if (header == null) {
                    header = record.toList();
                    continue;
                }
                String text = record.stream()
                        .map(String::strip)
                        .filter(cell -> !cell.isEmpty())
                        .collect(Collectors.joining(" "));
                if (text.isEmpty())
                    continue;
                documents.add(Document.raw(file, text, Map.of("csv_row", row, "header", header)));
            }
        }
        return documents;
    }

    private List<Document> loadHtml(Path file) throws IOException {
        String raw = SourceReader.readText(file);
        return List.of(Document.raw(file, raw, Map.of("suffix", DocumentFormat.suffixOf(file))));
    }

    public Path getRoot() {
        return root;
    }

    public int getChunkSize() {
        return chunkSize;
    }
}
