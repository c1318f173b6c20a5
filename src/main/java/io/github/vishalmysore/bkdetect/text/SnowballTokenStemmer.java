package io.github.vishalmysore.bkdetect.text;

import org.tartarus.snowball.SnowballStemmer;

/**
 * Snowball stemmer from Lucene's analysis module. Snowball programs keep
 * their working buffer in fields, so each thread gets its own instance.
 */
class SnowballTokenStemmer implements TokenStemmer {
    private final Language language;
    private final ThreadLocal<SnowballStemmer> stemmers;

    SnowballTokenStemmer(Language language) {
        this.language = language;
        this.stemmers = ThreadLocal.withInitial(language::newStemmer);
    }

    @Override
    public String stem(String token) {
        SnowballStemmer stemmer = stemmers.get();
        stemmer.setCurrent(token);
        stemmer.stem();
        return stemmer.getCurrent();
    }

    @Override
    public String getName() {
        return "snowball-" + language.getTag();
    }
}
