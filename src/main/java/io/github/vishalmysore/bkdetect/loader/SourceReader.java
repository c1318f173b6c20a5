package io.github.vishalmysore.bkdetect.loader;

import com.google.common.base.Splitter;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads source files into their natural units. Shared by the loader and by
 * the fragment re-scan so both number units the same way.
 * <p>
 * Text is decoded as UTF-8; malformed bytes become U+FFFD instead of failing.
 * Lines end at CR, LF, CRLF, vertical tab, form feed, the file/group/record
 * separators, NEL and the Unicode line and paragraph separators.
 */
public final class SourceReader {
    private static final Splitter LINES = Splitter.onPattern("\r\n|[\n\r\\x0B\\x0C\\x1C-\\x1E\\x85\\u2028\\u2029]");

    private SourceReader() {
    }

    public static String readText(Path path) throws IOException {
        String text = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }

    public static List<String> splitLines(String text) {
        return LINES.splitToList(text);
    }

    public static List<String> readLines(Path path) throws IOException {
        return splitLines(readText(path));
    }

    /**
     * Texts of the body-level paragraphs of an Office Open XML document, in
     * document order. Headers, footers and paragraphs nested in tables are
     * not units of their own.
     *
     * @throws IOException when the file cannot be read or is not a valid package
     */
    public static List<String> readParagraphs(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path); XWPFDocument document = new XWPFDocument(in)) {
            List<String> paragraphs = new ArrayList<>();
            for (XWPFParagraph paragraph : document.getParagraphs()) {
                paragraphs.add(paragraph.getText());
            }
            return paragraphs;
        } catch (RuntimeException e) {
            // POI reports broken packages with unchecked exceptions
            throw new IOException("Could not extract paragraphs from " + path + ": " + e.getMessage(), e);
        }
    }
}
