package io.github.vishalmysore.bkdetect.loader;

import io.github.vishalmysore.bkdetect.domain.UnitKind;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * File formats the loader understands, keyed by lower-cased file suffix.
 */
public enum DocumentFormat {
    TEXT(UnitKind.LINE, ".txt"),
    DOCX(UnitKind.PARAGRAPH, ".docx"),
    CSV(UnitKind.LINE, ".csv"),
    HTML(UnitKind.LINE, ".html", ".htm");

    private final UnitKind unitKind;
    private final Set<String> suffixes;

    DocumentFormat(UnitKind unitKind, String... suffixes) {
        this.unitKind = unitKind;
        this.suffixes = Set.of(suffixes);
    }

    public static Optional<DocumentFormat> forPath(Path path) {
        String suffix = suffixOf(path);
        for (DocumentFormat format : values()) {
            if (format.suffixes.contains(suffix))
                return Optional.of(format);
        }
        return Optional.empty();
    }

    static String suffixOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null)
            return "";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Unit a matched file of this format is re-scanned by. */
    public UnitKind getUnitKind() {
        return unitKind;
    }
}
