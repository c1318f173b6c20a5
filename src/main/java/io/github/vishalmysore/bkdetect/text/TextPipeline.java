package io.github.vishalmysore.bkdetect.text;

import com.google.common.base.Splitter;
import io.github.vishalmysore.bkdetect.config.SearchSettings;
import org.jsoup.Jsoup;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Turns raw text into the canonical token sequence every index row and every
 * query is built from:
 * <ol>
 * <li>strip markup (jsoup, lenient on broken HTML)</li>
 * <li>lower-case</li>
 * <li>collapse runs outside latin/cyrillic letters, digits and apostrophe into a blank</li>
 * <li>split on blanks</li>
 * <li>drop stopwords (optional)</li>
 * <li>stem (optional)</li>
 * </ol>
 * Stopwords and stemmer are resolved once at construction. {@link #transform}
 * keeps no state and may be called from several threads.
 */
public class TextPipeline {
    private static final Logger log = Logger.getLogger(TextPipeline.class.getName());

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9а-яё']+");
    private static final Splitter BLANKS = Splitter.on(' ').omitEmptyStrings();

    private final Language language;
    private final boolean useStemming;
    private final boolean removeStopwords;
    private final Set<String> stopwords;
    private final TokenStemmer stemmer;

    public TextPipeline(SearchSettings settings) {
        this(settings.resolveLanguage(), settings.isUseStemming(), settings.isRemoveStopwords());
    }

    public TextPipeline(Language language, boolean useStemming, boolean removeStopwords) {
        this(language, useStemming, removeStopwords, new StopwordLoader());
    }

    TextPipeline(Language language, boolean useStemming, boolean removeStopwords, StopwordLoader loader) {
        this.language = language;
        this.useStemming = useStemming;
        this.removeStopwords = removeStopwords;
        this.stopwords = removeStopwords ? loader.load(language) : Set.of();
        this.stemmer = useStemming ? TokenStemmer.forLanguage(language) : TokenStemmer.IDENTITY;
        log.info("TextPipeline initialized: language=" + language + ", stopwords=" + stopwords.size()
                + ", stemmer=" + stemmer.getName());
    }

    public List<String> transform(String text) {
        if (text == null || text.isEmpty())
            return List.of();

        String normalized = normalizeText(text);
        List<String> tokens = new ArrayList<>();
        for (String token : BLANKS.split(normalized)) {
            if (stopwords.contains(token))
                continue;
            tokens.add(stemmer.stem(token));
        }
        return tokens;
    }

    /**
     * Distinct tokens of {@code text}; used where only overlap matters.
     */
    public Set<String> tokenSet(String text) {
        return new HashSet<>(transform(text));
    }

    String normalizeText(String text) {
        String lowered = stripMarkup(text).toLowerCase(Locale.ROOT);
        return NON_ALPHANUMERIC.matcher(lowered).replaceAll(" ");
    }

    /**
     * Text content of every text node, blank separated. Plain text without
     * tags or entities is returned as is.
     */
    static String stripMarkup(String text) {
        if (text.indexOf('<') < 0 && text.indexOf('&') < 0)
            return text;

        StringBuilder sb = new StringBuilder(text.length());
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode)
                sb.append(((TextNode) node).getWholeText()).append(' ');
        }, Jsoup.parse(text));
        return sb.toString();
    }

    public Language getLanguage() {
        return language;
    }

    public boolean isUseStemming() {
        return useStemming;
    }

    public boolean isRemoveStopwords() {
        return removeStopwords;
    }

    public Set<String> getStopwords() {
        return stopwords;
    }
}
