package io.github.vishalmysore.bkdetect.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.vishalmysore.bkdetect.domain.SourceMatch;
import io.github.vishalmysore.bkdetect.domain.SourcePosition;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Renders the outcome of one query as an indented JSON report.
 */
public class MatchReportExporter {
    private static final Logger log = Logger.getLogger(MatchReportExporter.class.getName());
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String export(String query, List<SourceMatch> matches, List<SourcePosition> positions) {
        try {
            return mapper.writeValueAsString(buildReport(query, matches, positions));
        } catch (JsonProcessingException e) {
            log.severe("Failed to export match report: " + e.getMessage());
            return "{}";
        }
    }

    Map<String, Object> buildReport(String query, List<SourceMatch> matches, List<SourcePosition> positions) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("query", query);
        report.put("matchCount", matches.size());
        report.put("matches", matches.stream()
                .map(MatchReportExporter::toMap)
                .collect(Collectors.toList()));
        report.put("positionCount", positions.size());
        report.put("positions", positions.stream()
                .map(MatchReportExporter::toMap)
                .collect(Collectors.toList()));
        return report;
    }

    private static Map<String, Object> toMap(SourceMatch match) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("path", match.getPath().toString());
        item.put("file", fileName(match.getPath()));
        item.put("score", match.getScore());
        return item;
    }

    private static Map<String, Object> toMap(SourcePosition position) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("path", position.getPath().toString());
        item.put("file", fileName(position.getPath()));
        item.put("label", position.getLabel());
        item.put("index", position.getIndex());
        item.put("snippet", position.getSnippet());
        item.put("score", position.getScore());
        return item;
    }

    static String fileName(Path path) {
        Path name = path.getFileName();
        return name == null ? path.toString() : name.toString();
    }
}
