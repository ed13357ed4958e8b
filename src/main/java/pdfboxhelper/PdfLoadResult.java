package pdfboxhelper;

import java.util.Objects;

/**
 * Extracted document text together with its page count.
 */
public final class PdfLoadResult {

    public final String text;
    public final int pageCount;

    public PdfLoadResult(String text, int pageCount) {
        this.text = Objects.requireNonNull(text, "text must not be null");
        this.pageCount = pageCount;
    }

    @Override
    public String toString() {
        return "PdfLoadResult{pageCount=" + pageCount + ", chars=" + text.length() + '}';
    }
}
