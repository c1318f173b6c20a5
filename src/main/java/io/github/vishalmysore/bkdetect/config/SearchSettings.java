package io.github.vishalmysore.bkdetect.config;

import io.github.vishalmysore.bkdetect.text.Language;
import lombok.Builder;
import lombok.Value;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Tunables of the index build and of the query phase.
 * <p>
 * Defaults can be overridden through an optional {@code bkdetect.properties}
 * on the classpath; the command line runner overrides them again through
 * {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class SearchSettings {
    private static final Logger log = Logger.getLogger(SearchSettings.class.getName());

    public static final String RESOURCE = "bkdetect.properties";
    public static final int DEFAULT_FEATURE_COUNT = 1 << 20;

    @Builder.Default
    String language = "ru";
    @Builder.Default
    boolean useStemming = true;
    @Builder.Default
    boolean removeStopwords = true;
    @Builder.Default
    int chunkSize = 500;
    @Builder.Default
    int topK = 5;
    @Builder.Default
    int maxPositionsPerFile = 2;
    @Builder.Default
    int snippetLength = 200;
    @Builder.Default
    int featureCount = DEFAULT_FEATURE_COUNT;
    // normalize the documents of a batch on the common fork-join pool
    @Builder.Default
    boolean parallel = false;

    private SearchSettings(String language, boolean useStemming, boolean removeStopwords, int chunkSize,
            int topK, int maxPositionsPerFile, int snippetLength, int featureCount, boolean parallel) {
        checkArgument(chunkSize > 0, "chunkSize must be > 0 (got %s)", chunkSize);
        checkArgument(topK >= 0, "topK must be >= 0 (got %s)", topK);
        checkArgument(maxPositionsPerFile >= 0, "maxPositionsPerFile must be >= 0 (got %s)", maxPositionsPerFile);
        checkArgument(snippetLength >= 0, "snippetLength must be >= 0 (got %s)", snippetLength);
        checkArgument(featureCount > 0, "featureCount must be > 0 (got %s)", featureCount);
        this.language = language == null ? "ru" : language;
        this.useStemming = useStemming;
        this.removeStopwords = removeStopwords;
        this.chunkSize = chunkSize;
        this.topK = topK;
        this.maxPositionsPerFile = maxPositionsPerFile;
        this.snippetLength = snippetLength;
        this.featureCount = featureCount;
        this.parallel = parallel;
    }

    public static SearchSettings defaults() {
        return SearchSettings.builder().build();
    }

    public Language resolveLanguage() {
        return Language.fromTag(language);
    }

    /**
     * Reads {@value #RESOURCE} from the classpath. A missing resource yields
     * the defaults.
     */
    public static SearchSettings load() {
        Properties props = new Properties();
        try (InputStream is = SearchSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null)
                props.load(is);
        } catch (IOException e) {
            log.warning("Could not load " + RESOURCE + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    public static SearchSettings fromProperties(Properties props) {
        SearchSettings d = defaults();
        return SearchSettings.builder()
                .language(props.getProperty("bkdetect.language", d.language).trim())
                .useStemming(bool(props, "bkdetect.stemming", d.useStemming))
                .removeStopwords(bool(props, "bkdetect.stopwords", d.removeStopwords))
                .chunkSize(integer(props, "bkdetect.chunk-size", d.chunkSize))
                .topK(integer(props, "bkdetect.top-k", d.topK))
                .maxPositionsPerFile(integer(props, "bkdetect.max-positions", d.maxPositionsPerFile))
                .snippetLength(integer(props, "bkdetect.snippet-length", d.snippetLength))
                .featureCount(integer(props, "bkdetect.features", d.featureCount))
                .parallel(bool(props, "bkdetect.parallel", d.parallel))
                .build();
    }

    private static boolean bool(Properties props, String key, boolean fallback) {
        String value = props.getProperty(key);
        return value == null || value.isBlank() ? fallback : Boolean.parseBoolean(value.trim());
    }

    private static int integer(Properties props, String key, int fallback) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank())
            return fallback;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }
}
