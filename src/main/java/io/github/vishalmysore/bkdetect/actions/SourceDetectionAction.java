package io.github.vishalmysore.bkdetect.actions;

import com.t4a.annotations.Action;
import com.t4a.annotations.Agent;
import io.github.vishalmysore.bkdetect.domain.SourceMatch;
import io.github.vishalmysore.bkdetect.domain.SourcePosition;
import io.github.vishalmysore.bkdetect.retrieval.SourceFinder;

import java.util.List;
import java.util.logging.Logger;

/**
 * Tools4AI action class that exposes source detection over an indexed corpus
 * as AI-callable tools.
 */
@Agent(groupName = "SourceDetectionAgent", groupDescription = "Agent that finds which indexed documents a text " +
        "was most likely taken from and which fragments of them overlap with it")
public class SourceDetectionAction {
    private static final Logger log = Logger.getLogger(SourceDetectionAction.class.getName());

    // Shared finder instance (set by the runner once the index is built)
    private static SourceFinder sharedFinder;

    public static void initialize(SourceFinder finder) {
        sharedFinder = finder;
    }

    @Action(description = "Find the documents a text most likely comes from. Returns the best matching " +
            "files with their similarity scores.")
    public String findSources(String text) {
        log.info("findSources invoked");
        if (sharedFinder == null) {
            return "Error: Source index not initialized.";
        }

        List<SourceMatch> matches = sharedFinder.findSources(text, sharedFinder.getSettings().getTopK());
        if (matches.isEmpty()) {
            return "No similar sources found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Found ").append(matches.size()).append(" candidate sources:\n");
        for (int i = 0; i < matches.size(); i++) {
            SourceMatch match = matches.get(i);
            sb.append(String.format("  [%d] %s - score: %.4f%n", i + 1, match.getPath().getFileName(),
                    match.getScore()));
        }
        return sb.toString();
    }

    @Action(description = "Point to the lines or paragraphs of the candidate source documents that " +
            "share words with a text.")
    public String locateFragments(String text) {
        log.info("locateFragments invoked");
        if (sharedFinder == null) {
            return "Error: Source index not initialized.";
        }

        List<SourcePosition> positions = sharedFinder.locateSourcePositions(text);
        if (positions.isEmpty()) {
            return "No matching fragments found.";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Matching fragments (").append(positions.size()).append("):\n");
        for (SourcePosition position : positions) {
            sb.append(String.format("  %s - %s %d: %s [score: %.4f]%n", position.getPath().getFileName(),
                    position.getLabel(), position.getIndex(), position.getSnippet(), position.getScore()));
        }
        return sb.toString();
    }

    @Action(description = "Get statistics about the source index: indexed units and feature space size.")
    public String getIndexStatistics() {
        log.info("getIndexStatistics invoked");
        if (sharedFinder == null) {
            return "Error: Source index not initialized.";
        }
        return String.format("Index Statistics:\n  Units: %d\n  Features: %d\n  Language: %s",
                sharedFinder.getIndexedUnitCount(),
                sharedFinder.getIndex().getHasher().getFeatureCount(),
                sharedFinder.getPipeline().getLanguage());
    }
}
