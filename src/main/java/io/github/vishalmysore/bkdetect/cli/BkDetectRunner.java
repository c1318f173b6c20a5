package io.github.vishalmysore.bkdetect.cli;

import io.github.vishalmysore.bkdetect.actions.SourceDetectionAction;
import io.github.vishalmysore.bkdetect.config.SearchSettings;
import io.github.vishalmysore.bkdetect.domain.SourceMatch;
import io.github.vishalmysore.bkdetect.domain.SourcePosition;
import io.github.vishalmysore.bkdetect.loader.SourceReader;
import io.github.vishalmysore.bkdetect.report.MatchReportExporter;
import io.github.vishalmysore.bkdetect.retrieval.SourceFinder;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.LogManager;

/**
 * Command line entry point: indexes a document tree, searches it for the
 * sources of a query file and prints the best files and their overlapping
 * fragments.
 */
public class BkDetectRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "bkdetect [options] <documents> <query-file>";

    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = buildOptions();
        CommandLine cmd;
        SearchSettings settings;
        try {
            cmd = new DefaultParser().parse(options, args);
            if (cmd.hasOption("help")) {
                printUsage(options, out);
                return EXIT_OK;
            }
            if (cmd.getArgList().size() != 2)
                throw new ParseException("expected <documents> and <query-file>");
            settings = applyOptions(SearchSettings.load(), cmd);
        } catch (ParseException | IllegalArgumentException e) {
            err.println("bkdetect: error: " + e.getMessage());
            printUsage(options, err);
            return EXIT_USAGE;
        }

        Path documents = Paths.get(cmd.getArgList().get(0));
        Path queryFile = Paths.get(cmd.getArgList().get(1));
        try {
            return search(documents, queryFile, settings, cmd.hasOption("json"), out);
        } catch (NoSuchFileException e) {
            err.println("bkdetect: error: path does not exist: " + e.getFile());
            return EXIT_NOT_FOUND;
        } catch (IOException e) {
            err.println("bkdetect: error: " + e.getMessage());
            return EXIT_NOT_FOUND;
        }
    }

    private static int search(Path documents, Path queryFile, SearchSettings settings, boolean json,
            PrintStream out) throws IOException {
        long totalStart = System.nanoTime();
        SourceFinder finder = SourceFinder.fromPath(documents, settings);

        if (!json)
            out.println("Building index...");
        long buildStart = System.nanoTime();
        finder.buildIndex();
        SourceDetectionAction.initialize(finder);
        if (!json) {
            out.printf("Index built in %.2f s%n", seconds(buildStart));
            out.println(new SourceDetectionAction().getIndexStatistics());
            out.println();
        }

        String queryText = SourceReader.readText(queryFile);

        long searchStart = System.nanoTime();
        List<SourceMatch> matches = finder.findSources(queryText, settings.getTopK());
        double searchTime = seconds(searchStart);

        List<SourcePosition> positions = List.of();
        long positionsStart = System.nanoTime();
        if (!matches.isEmpty()) {
            positions = finder.locateSourcePositions(queryText, settings.getTopK(),
                    settings.getMaxPositionsPerFile(), settings.getSnippetLength());
        }
        double positionsTime = seconds(positionsStart);

        if (json) {
            out.println(new MatchReportExporter().export(queryText, matches, positions));
            return EXIT_OK;
        }

        if (matches.isEmpty()) {
            out.printf("No similar sources found (search took %.2f s).%n", searchTime);
            out.printf("Total time: %.2f s%n", seconds(totalStart));
            return EXIT_OK;
        }

        out.println("Top matches:");
        for (SourceMatch match : matches) {
            out.printf("%s - score: %.4f%n", match.getPath().getFileName(), match.getScore());
        }
        out.printf("Source search took %.2f s%n%n", searchTime);

        if (positions.isEmpty()) {
            out.printf("No matching fragments found (analysis took %.2f s).%n", positionsTime);
            out.printf("Total time: %.2f s%n", seconds(totalStart));
            return EXIT_OK;
        }

        out.println("Matching fragments:");
        for (SourcePosition position : positions) {
            out.printf("%s - %s %d: %s [score: %.4f]%n", position.getPath().getFileName(), position.getLabel(),
                    position.getIndex(), position.getSnippet(), position.getScore());
        }
        out.printf("Fragment analysis took %.2f s%n%n", positionsTime);
        out.printf("Total time: %.2f s%n", seconds(totalStart));
        return EXIT_OK;
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("language").hasArg().argName("ru|en")
                .desc("Language of the texts (default ru)").build());
        options.addOption(Option.builder().longOpt("chunk-size").hasArg().argName("n")
                .desc("Documents per indexing batch (default 500)").build());
        options.addOption(Option.builder().longOpt("top-k").hasArg().argName("n")
                .desc("Number of source files to report (default 5)").build());
        options.addOption(Option.builder().longOpt("max-positions").hasArg().argName("n")
                .desc("Maximum fragments reported per file (default 2)").build());
        options.addOption(Option.builder().longOpt("snippet-len").hasArg().argName("n")
                .desc("Maximum length of a reported fragment (default 200)").build());
        options.addOption(Option.builder().longOpt("no-stemming").desc("Disable stemming").build());
        options.addOption(Option.builder().longOpt("keep-stopwords").desc("Do not remove stopwords").build());
        options.addOption(Option.builder().longOpt("json").desc("Print a JSON report").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show this help").build());
        return options;
    }

    static SearchSettings applyOptions(SearchSettings base, CommandLine cmd) throws ParseException {
        SearchSettings.SearchSettingsBuilder builder = base.toBuilder();
        if (cmd.hasOption("language")) {
            String language = cmd.getOptionValue("language");
            if (!"ru".equals(language) && !"en".equals(language))
                throw new ParseException("invalid choice for --language: " + language + " (choose from ru, en)");
            builder.language(language);
        }
        if (cmd.hasOption("chunk-size"))
            builder.chunkSize(intOption(cmd, "chunk-size"));
        if (cmd.hasOption("top-k"))
            builder.topK(intOption(cmd, "top-k"));
        if (cmd.hasOption("max-positions"))
            builder.maxPositionsPerFile(intOption(cmd, "max-positions"));
        if (cmd.hasOption("snippet-len"))
            builder.snippetLength(intOption(cmd, "snippet-len"));
        if (cmd.hasOption("no-stemming"))
            builder.useStemming(false);
        if (cmd.hasOption("keep-stopwords"))
            builder.removeStopwords(false);
        return builder.build();
    }

    private static int intOption(CommandLine cmd, String name) throws ParseException {
        String value = cmd.getOptionValue(name);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ParseException("invalid int value for --" + name + ": " + value);
        }
    }

    private static void printUsage(Options options, PrintStream stream) {
        PrintWriter writer = new PrintWriter(stream);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE,
                "Finds the source documents of a text and their matching fragments.", options,
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }

    private static double seconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    private static void configureLogging() {
        try (InputStream is = BkDetectRunner.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (is != null)
                LogManager.getLogManager().readConfiguration(is);
        } catch (IOException e) {
            System.err.println("Warning: Could not load logging.properties");
        }
    }
}
