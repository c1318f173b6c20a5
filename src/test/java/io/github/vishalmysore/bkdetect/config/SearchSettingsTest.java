package io.github.vishalmysore.bkdetect.config;

import io.github.vishalmysore.bkdetect.text.Language;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchSettingsTest {

    @Test
    void defaults() {
        SearchSettings settings = SearchSettings.defaults();

        assertThat(settings.getLanguage()).isEqualTo("ru");
        assertThat(settings.resolveLanguage()).isEqualTo(Language.RUSSIAN);
        assertThat(settings.isUseStemming()).isTrue();
        assertThat(settings.isRemoveStopwords()).isTrue();
        assertThat(settings.getChunkSize()).isEqualTo(500);
        assertThat(settings.getTopK()).isEqualTo(5);
        assertThat(settings.getMaxPositionsPerFile()).isEqualTo(2);
        assertThat(settings.getSnippetLength()).isEqualTo(200);
        assertThat(settings.getFeatureCount()).isEqualTo(1 << 20);
        assertThat(settings.isParallel()).isFalse();
    }

    @Test
    void bundledPropertiesMatchDefaults() {
        assertThat(SearchSettings.load()).isEqualTo(SearchSettings.defaults());
    }

    @Test
    void propertiesOverrideDefaults() {
        Properties props = new Properties();
        props.setProperty("bkdetect.language", " en ");
        props.setProperty("bkdetect.stemming", "false");
        props.setProperty("bkdetect.top-k", "3");
        props.setProperty("bkdetect.chunk-size", " 50 ");
        props.setProperty("bkdetect.parallel", "true");

        SearchSettings settings = SearchSettings.fromProperties(props);

        assertThat(settings.resolveLanguage()).isEqualTo(Language.ENGLISH);
        assertThat(settings.isUseStemming()).isFalse();
        assertThat(settings.isRemoveStopwords()).isTrue();
        assertThat(settings.getTopK()).isEqualTo(3);
        assertThat(settings.getChunkSize()).isEqualTo(50);
        assertThat(settings.isParallel()).isTrue();
    }

    @Test
    void blankPropertiesFallBackToDefaults() {
        Properties props = new Properties();
        props.setProperty("bkdetect.top-k", "  ");

        assertThat(SearchSettings.fromProperties(props).getTopK()).isEqualTo(5);
    }

    @Test
    void nonIntegerPropertyIsRejected() {
        Properties props = new Properties();
        props.setProperty("bkdetect.snippet-length", "long");

        assertThatThrownBy(() -> SearchSettings.fromProperties(props))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bkdetect.snippet-length");
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> SearchSettings.builder().chunkSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SearchSettings.builder().featureCount(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SearchSettings.builder().topK(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toBuilderKeepsOtherValues() {
        SearchSettings settings = SearchSettings.defaults().toBuilder().topK(9).build();

        assertThat(settings.getTopK()).isEqualTo(9);
        assertThat(settings.getSnippetLength()).isEqualTo(200);
    }

    @Test
    void unknownLanguageResolvesToOther() {
        SearchSettings settings = SearchSettings.builder().language("de").build();

        assertThat(settings.resolveLanguage()).isEqualTo(Language.OTHER);
    }
}
