package io.github.vishalmysore.bkdetect.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class TextPipelineTest {

    private final TextPipeline plain = new TextPipeline(Language.RUSSIAN, false, false);

    @Test
    void lowercasesAndSplitsOnEverythingOutsideTheAlphabet() {
        assertThat(plain.transform("Кот, СИДИТ на окне!!! 42 раза -- rock'n'roll"))
                .containsExactly("кот", "сидит", "на", "окне", "42", "раза", "rock'n'roll");
    }

    @Test
    void keepsYoAndDropsOtherScripts() {
        assertThat(plain.transform("Ёлка—ель; straße 東京"))
                .containsExactly("ёлка", "ель", "stra", "e");
    }

    @Test
    void emptyAndPunctuationOnlyInputYieldNoTokens() {
        assertThat(plain.transform("")).isEmpty();
        assertThat(plain.transform(null)).isEmpty();
        assertThat(plain.transform("!!! ... ---  \t\n")).isEmpty();
    }

    @Test
    void stripsMarkupAndSeparatesAdjacentElements() {
        assertThat(plain.transform("<html><body><p>Hello</p><b>big</b><i>world</i></body></html>"))
                .containsExactly("hello", "big", "world");
        assertThat(plain.transform("fish &amp; chips")).containsExactly("fish", "chips");
    }

    @Test
    void malformedMarkupDegradesToText() {
        assertThatCode(() -> plain.transform("<p>unclosed <b>bold <<< >> </div></span>"))
                .doesNotThrowAnyException();
        assertThat(plain.transform("<p>unclosed <b>bold")).containsExactly("unclosed", "bold");
        assertThat(plain.transform("a < b and c > d")).containsExactly("a", "b", "and", "c", "d");
    }

    @Test
    void removesRussianStopwords() {
        TextPipeline pipeline = new TextPipeline(Language.RUSSIAN, false, true);

        assertThat(pipeline.transform("кот сидит на окне и смотрит в окно"))
                .containsExactly("кот", "сидит", "окне", "смотрит", "окно");
    }

    @Test
    void stemsEnglishWithPorter() {
        TextPipeline pipeline = new TextPipeline(Language.ENGLISH, true, true);

        assertThat(pipeline.transform("The cats were running quickly"))
                .containsExactly("cat", "run", "quickli");
    }

    @Test
    void russianStemmingConflatesInflections() {
        TextPipeline pipeline = new TextPipeline(Language.RUSSIAN, true, true);

        assertThat(pipeline.transform("окна")).isEqualTo(pipeline.transform("окно"));
        assertThat(pipeline.transform("кошками")).isEqualTo(pipeline.transform("кошка"));
    }

    @Test
    void unsupportedLanguageSkipsStopwordsAndStemming() {
        TextPipeline pipeline = new TextPipeline(Language.fromTag("de"), true, true);

        assertThat(pipeline.getLanguage()).isEqualTo(Language.OTHER);
        assertThat(pipeline.getStopwords()).isEmpty();
        assertThat(pipeline.transform("the running cats")).containsExactly("the", "running", "cats");
    }

    @Test
    void secondPassOverNormalizedTextIsAFixedPoint() {
        TextPipeline pipeline = new TextPipeline(Language.RUSSIAN, false, true);
        String[] inputs = {
                "<div>Кот СИДИТ, на окне!</div> 2024 г.",
                "It's the end of the world as we know it",
                "   ",
                "ёжик&nbsp;в тумане"
        };
        for (String input : inputs) {
            List<String> once = pipeline.transform(input);
            assertThat(pipeline.transform(String.join(" ", once))).isEqualTo(once);
        }
    }

    @Test
    void transformIsDeterministic() {
        TextPipeline first = new TextPipeline(Language.RUSSIAN, true, true);
        TextPipeline second = new TextPipeline(Language.RUSSIAN, true, true);
        String text = "Собака бежит по двору, а кот сидит на окне.";

        assertThat(first.transform(text))
                .isEqualTo(first.transform(text))
                .isEqualTo(second.transform(text));
    }

    @Test
    void tokenSetIgnoresOrderAndRepeats() {
        assertThat(plain.tokenSet("кот кот окно кот")).containsExactlyInAnyOrder("кот", "окно");
    }
}
