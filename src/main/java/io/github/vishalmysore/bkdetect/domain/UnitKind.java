package io.github.vishalmysore.bkdetect.domain;

/**
 * Natural sub-unit a source file is re-scanned by when locating fragments.
 */
public enum UnitKind {
    LINE("line"), // plain text, csv and html files
    PARAGRAPH("paragraph"); // rich documents (docx)

    private final String label;

    UnitKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
