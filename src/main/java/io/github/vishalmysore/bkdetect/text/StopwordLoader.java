package io.github.vishalmysore.bkdetect.text;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Resources;
import org.apache.lucene.analysis.snowball.SnowballFilter;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Loads stopword sets. The list bundled under {@code stopwords/<tag>.txt} is
 * tried first; when it is missing or unreadable the set is rebuilt once from
 * the Snowball list shipped inside Lucene. Failing both is fatal.
 */
public class StopwordLoader {
    private static final Logger log = Logger.getLogger(StopwordLoader.class.getName());
    private static final Splitter WORDS = Splitter.on(' ').trimResults().omitEmptyStrings();

    public static final String DEFAULT_LOCATION = "stopwords/";
    public static final String SNOWBALL_LOCATION = SnowballFilter.class.getPackageName().replace('.', '/') + "/";

    private final ClassLoader classLoader;
    private final String location;
    private final String snowballLocation;

    public StopwordLoader() {
        this(StopwordLoader.class.getClassLoader(), DEFAULT_LOCATION, SNOWBALL_LOCATION);
    }

    StopwordLoader(ClassLoader classLoader, String location, String snowballLocation) {
        this.classLoader = classLoader;
        this.location = location;
        this.snowballLocation = snowballLocation;
    }

    public Set<String> load(Language language) {
        if (language.getSnowballStopList() == null)
            return ImmutableSet.of();

        URL bundled = classLoader.getResource(location + language.getTag() + ".txt");
        if (bundled != null) {
            try {
                return parse(Resources.readLines(bundled, StandardCharsets.UTF_8), '#');
            } catch (IOException e) {
                log.warning("Could not read stopwords from " + bundled + ": " + e.getMessage());
            }
        }

        log.info("Building " + language.getTag() + " stopwords from the Snowball list");
        URL snowball = classLoader.getResource(snowballLocation + language.getSnowballStopList());
        if (snowball == null)
            throw new ResourceUnavailableException(
                    "Stopword list for language '" + language.getTag() + "' is unavailable");
        try {
            return parse(Resources.readLines(snowball, StandardCharsets.UTF_8), '|');
        } catch (IOException e) {
            throw new ResourceUnavailableException(
                    "Stopword list for language '" + language.getTag() + "' is unavailable", e);
        }
    }

    /**
     * Words are separated by blanks; everything after the comment marker on a
     * line is ignored.
     */
    static Set<String> parse(List<String> lines, char commentMarker) {
        ImmutableSet.Builder<String> words = ImmutableSet.builder();
        for (String line : lines) {
            int comment = line.indexOf(commentMarker);
            String content = comment >= 0 ? line.substring(0, comment) : line;
            for (String word : WORDS.split(content.replace('\t', ' '))) {
                words.add(word);
            }
        }
        return words.build();
    }
}
