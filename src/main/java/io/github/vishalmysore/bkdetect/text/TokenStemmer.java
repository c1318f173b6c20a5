package io.github.vishalmysore.bkdetect.text;

/**
 * Per-token stemming transform, chosen once when a pipeline is configured.
 */
public interface TokenStemmer {

    TokenStemmer IDENTITY = new TokenStemmer() {
        @Override
        public String stem(String token) {
            return token;
        }

        @Override
        public String getName() {
            return "identity";
        }
    };

    String stem(String token);

    String getName();

    static TokenStemmer forLanguage(Language language) {
        return language.hasStemmer() ? new SnowballTokenStemmer(language) : IDENTITY;
    }
}
