package io.github.vishalmysore.bkdetect.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.vishalmysore.bkdetect.actions.SourceDetectionAction;
import io.github.vishalmysore.bkdetect.config.SearchSettings;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BkDetectRunnerTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private Path corpus;
    private Path query;

    @BeforeEach
    void setUp() throws IOException {
        corpus = Files.createDirectories(dir.resolve("corpus"));
        Files.writeString(corpus.resolve("a.txt"), "кот сидит на окне\nсобака бежит по двору\n",
                StandardCharsets.UTF_8);
        query = Files.writeString(dir.resolve("query.txt"), "кот сидит\n", StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        SourceDetectionAction.initialize(null);
    }

    private int run(String... args) {
        return BkDetectRunner.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void printsMatchesAndFragments() {
        int code = run(corpus.toString(), query.toString());

        assertThat(code).isEqualTo(BkDetectRunner.EXIT_OK);
        assertThat(out())
                .contains("Building index...")
                .contains("Units: 2")
                .contains("Top matches:")
                .contains("a.txt - score:")
                .contains("Matching fragments:")
                .contains("a.txt - line 1: кот сидит на окне")
                .contains("Total time:");
    }

    @Test
    void builtIndexIsHandedToTheAgentAction() {
        SourceDetectionAction.initialize(null);

        assertThat(run("--json", corpus.toString(), query.toString())).isEqualTo(BkDetectRunner.EXIT_OK);

        SourceDetectionAction action = new SourceDetectionAction();
        assertThat(action.findSources("кот сидит")).contains("a.txt");
        assertThat(action.getIndexStatistics()).contains("Units: 2");
    }

    @Test
    void reportsWhenNothingMatches() throws IOException {
        Path other = Files.writeString(dir.resolve("other.txt"), "птица летит\n", StandardCharsets.UTF_8);

        assertThat(run(corpus.toString(), other.toString())).isEqualTo(BkDetectRunner.EXIT_OK);
        assertThat(out()).contains("No similar sources found").doesNotContain("Top matches:");
    }

    @Test
    void printsJsonReport() throws IOException {
        int code = run("--json", "--max-positions", "1", corpus.toString(), query.toString());

        assertThat(code).isEqualTo(BkDetectRunner.EXIT_OK);
        JsonNode report = new ObjectMapper().readTree(out());
        assertThat(report.get("matchCount").asInt()).isEqualTo(1);
        assertThat(report.get("positions").get(0).get("label").asText()).isEqualTo("line");
    }

    @Test
    void missingDocumentsPathExitsWithOne() {
        int code = run(dir.resolve("nowhere").toString(), query.toString());

        assertThat(code).isEqualTo(BkDetectRunner.EXIT_NOT_FOUND);
        assertThat(err()).contains("path does not exist");
    }

    @Test
    void missingQueryFileExitsWithOne() {
        assertThat(run(corpus.toString(), dir.resolve("none.txt").toString()))
                .isEqualTo(BkDetectRunner.EXIT_NOT_FOUND);
    }

    @Test
    void wrongArgumentCountIsUsageError() {
        assertThat(run(corpus.toString())).isEqualTo(BkDetectRunner.EXIT_USAGE);
        assertThat(err()).contains("usage: bkdetect");
    }

    @Test
    void badOptionValuesAreUsageErrors() {
        assertThat(run("--language", "de", corpus.toString(), query.toString())).isEqualTo(BkDetectRunner.EXIT_USAGE);
        assertThat(run("--top-k", "many", corpus.toString(), query.toString())).isEqualTo(BkDetectRunner.EXIT_USAGE);
        assertThat(run("--chunk-size", "0", corpus.toString(), query.toString())).isEqualTo(BkDetectRunner.EXIT_USAGE);
        assertThat(run("--bogus", corpus.toString(), query.toString())).isEqualTo(BkDetectRunner.EXIT_USAGE);
    }

    @Test
    void helpExitsCleanly() {
        assertThat(run("--help")).isEqualTo(BkDetectRunner.EXIT_OK);
        assertThat(out()).contains("--snippet-len").contains("--keep-stopwords");
    }

    @Test
    void optionsOverrideSettings() throws ParseException {
        String[] args = { "--language", "en", "--top-k", "3", "--snippet-len", "40", "--no-stemming",
                "--keep-stopwords", "docs", "query.txt" };

        SearchSettings settings = BkDetectRunner.applyOptions(SearchSettings.defaults(),
                new DefaultParser().parse(BkDetectRunner.buildOptions(), args));

        assertThat(settings.getLanguage()).isEqualTo("en");
        assertThat(settings.getTopK()).isEqualTo(3);
        assertThat(settings.getSnippetLength()).isEqualTo(40);
        assertThat(settings.isUseStemming()).isFalse();
        assertThat(settings.isRemoveStopwords()).isFalse();
        assertThat(settings.getMaxPositionsPerFile()).isEqualTo(2);
    }

    @Test
    void negativeNumberIsRejected() {
        String[] args = { "--max-positions", "-1", "docs", "query.txt" };

        assertThatThrownBy(() -> BkDetectRunner.applyOptions(SearchSettings.defaults(),
                new DefaultParser().parse(BkDetectRunner.buildOptions(), args)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
