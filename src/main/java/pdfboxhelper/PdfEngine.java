package pdfboxhelper;

/**
 * Text extraction strategy.
 */
public enum PdfEngine {

    /**
     * Plain {@code PDFTextStripper} text, page by page.
     */
    TEXT_STRIPPER(1),

    /**
     * Position-aware text fragments, filtered for repeated overlay / watermark
     * text and rebuilt into lines.
     */
    TEXT_OBJECTS(2);

    private final int id;

    PdfEngine(int id) {
        this.id = id;
    }

    /**
     * Maps a settings-file id; unknown ids fall back to {@link #TEXT_STRIPPER}.
     */
    public static PdfEngine fromId(int id) {
        for (PdfEngine e : values()) {
            if (e.id == id)
                return e;
        }
        return TEXT_STRIPPER;
    }
}
