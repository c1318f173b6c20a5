package io.github.vishalmysore.bkdetect.text;

import org.tartarus.snowball.SnowballStemmer;
import org.tartarus.snowball.ext.PorterStemmer;
import org.tartarus.snowball.ext.RussianStemmer;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Languages the pipeline has stopword lists and stemmers for. Any other tag
 * resolves to {@link #OTHER}, which disables both steps.
 */
public enum Language {
    RUSSIAN("ru", "russian_stop.txt", RussianStemmer::new),
    ENGLISH("en", "english_stop.txt", PorterStemmer::new),
    OTHER(null, null, null);

    private final String tag;
    private final String snowballStopList;
    private final Supplier<SnowballStemmer> stemmerFactory;

    Language(String tag, String snowballStopList, Supplier<SnowballStemmer> stemmerFactory) {
        this.tag = tag;
        this.snowballStopList = snowballStopList;
        this.stemmerFactory = stemmerFactory;
    }

    public static Language fromTag(String tag) {
        if (tag == null)
            return OTHER;
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (Language language : values()) {
            if (normalized.equals(language.tag))
                return language;
        }
        return OTHER;
    }

    public String getTag() {
        return tag;
    }

    /** Name of the Snowball stop list bundled with Lucene, or null. */
    public String getSnowballStopList() {
        return snowballStopList;
    }

    public boolean hasStemmer() {
        return stemmerFactory != null;
    }

    SnowballStemmer newStemmer() {
        if (stemmerFactory == null)
            throw new IllegalStateException("No stemmer for " + name());
        return stemmerFactory.get();
    }
}
