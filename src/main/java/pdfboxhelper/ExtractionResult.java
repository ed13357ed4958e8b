package pdfboxhelper;

/**
 * Outcome of {@link PdfBoxHelper#tryExtract}.
 *
 * <p>Either {@code success} with a {@link PdfLoadResult}, or a failure with a
 * human-readable {@code message} and no result. Callers reflow only successful
 * extractions.</p>
 */
public final class ExtractionResult {

    public final boolean success;
    public final String message;
    public final PdfLoadResult result;
    public final boolean cancelled;

    private ExtractionResult(boolean success, String message, PdfLoadResult result, boolean cancelled) {
        this.success = success;
        this.message = message;
        this.result = result;
        this.cancelled = cancelled;
    }

    public static ExtractionResult ok(PdfLoadResult result) {
        return new ExtractionResult(true, "✅ Extracted " + result.pageCount + " page(s)", result, false);
    }

    public static ExtractionResult failed(String message) {
        return new ExtractionResult(false, message, null, false);
    }

    public static ExtractionResult cancelled() {
        return new ExtractionResult(false, "❌ Extraction cancelled", null, true);
    }
}
