package pdfboxhelper;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Small utility class wrapping PDFBox 3.x text extraction for the reflow engine.
 *
 * <p>Features:</p>
 * <ul>
 *   <li>Extract full text from a PDF ({@link #extractText(File)})</li>
 *   <li>Extract page-by-page text as a list ({@link #extractTextPerPage(File)})</li>
 *   <li>Optional {@code === [Page X/Y] ===} markers, blank pages included</li>
 *   <li>Two engines: plain text stripping or overlay-filtered text objects ({@link PdfEngine})</li>
 *   <li>Percent progress at an adaptive cadence and cooperative cancellation, checked once per page</li>
 *   <li>Strip common zero-width characters from extracted text</li>
 * </ul>
 *
 * <p>Failures are logged with {@link java.util.logging.Logger} and rethrown;
 * {@link #tryExtract} turns them into an {@link ExtractionResult} instead.</p>
 */
public final class PdfBoxHelper {

    private static final Logger LOGGER = Logger.getLogger(PdfBoxHelper.class.getName());

    private PdfBoxHelper() {
        // Utility class – no instances allowed.
    }

    // ========================================================================
    // Zero-width character normalization
    // ========================================================================

    /**
     * Zero-width characters commonly found in extracted PDF text:
     * <ul>
     *   <li>U+200B ZERO WIDTH SPACE</li>
     *   <li>U+200C ZERO WIDTH NON-JOINER</li>
     *   <li>U+200D ZERO WIDTH JOINER</li>
     *   <li>U+FEFF ZERO WIDTH NO-BREAK SPACE (BOM)</li>
     * </ul>
     */
    private static final String ZERO_WIDTH_REGEX = "[\u200B\u200C\u200D\uFEFF]";

    /**
     * Removes common zero-width characters from the given text.
     *
     * @param text input text, may be {@code null}
     * @return cleaned text, or {@code null} if input was {@code null}
     */
    static String cleanText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        return text.replaceAll(ZERO_WIDTH_REGEX, "");
    }

    /**
     * Page marker line consumed by the reflow engine.
     */
    public static String pageMarker(int page, int total) {
        return "=== [Page " + page + "/" + total + "] ===";
    }

    // ========================================================================
    // Core helpers
    // ========================================================================

    private static PDFTextStripper createStripper() throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setLineSeparator("\n");
        return stripper;
    }

    /**
     * Ensures the document is not encrypted. PDFBox requires additional
     * decryption handling for encrypted PDFs, which this helper does not
     * implement. For now, we fail fast with a clear error.
     *
     * @throws IOException if the document is encrypted
     */
    private static void ensureNotEncrypted(PDDocument doc) throws IOException {
        if (doc.isEncrypted()) {
            throw new IOException("Encrypted PDFs are not supported by PdfBoxHelper.");
        }
    }

    // ========================================================================
    // Public API – file based
    // ========================================================================

    /**
     * Extracts the full text of the given PDF file as a single string,
     * without page headers.
     *
     * @param file PDF file to read; must not be {@code null}
     * @return extracted text with zero-width characters stripped
     * @throws IOException if loading or parsing the PDF fails
     */
    public static String extractText(File file) throws IOException {
        return extractText(file, false);
    }

    /**
     * Extracts the full text of the given PDF file with or without page headers.
     *
     * @param file       PDF file to read; must not be {@code null}
     * @param withHeader whether to add {@code === [Page x/n] ===} page markers
     * @return extracted text with zero-width characters stripped
     * @throws IOException if loading or parsing the PDF fails
     */
    public static String extractText(File file, boolean withHeader) throws IOException {
        return extractText(file, withHeader, PdfEngine.TEXT_STRIPPER, null, null).text;
    }

    /**
     * Extracts the text of the given PDF file page by page.
     *
     * <p>The {@code progress} callback, if non-null, receives percent-complete
     * values (0..100) at the cadence of {@link ProgressCadence}. The
     * {@code cancelled} signal, if non-null, is polled before each page.</p>
     *
     * @param file       PDF file to read; must not be {@code null}
     * @param withHeader whether to add {@code === [Page x/n] ===} page markers
     * @param engine     extraction strategy
     * @param progress   optional percent callback
     * @param cancelled  optional cooperative cancellation signal
     * @return extracted text and page count
     * @throws IOException           if loading or parsing the PDF fails
     * @throws CancellationException if {@code cancelled} turned true
     */
    public static PdfLoadResult extractText(File file,
                                            boolean withHeader,
                                            PdfEngine engine,
                                            IntConsumer progress,
                                            BooleanSupplier cancelled) throws IOException {
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(engine, "engine must not be null");

        try (PDDocument doc = Loader.loadPDF(file)) {
            ensureNotEncrypted(doc);
            return extractPages(doc, withHeader, engine, progress, cancelled);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to extract text from PDF: " + file, e);
            throw e;
        }
    }

    /**
     * Extracts the PDF text as a list of pages. Each entry in the returned
     * list corresponds to one page.
     *
     * @param file PDF file to read; must not be {@code null}
     * @return list of per-page text (never {@code null}, possibly empty)
     * @throws IOException if loading or parsing the PDF fails
     */
    public static List<String> extractTextPerPage(File file) throws IOException {
        Objects.requireNonNull(file, "file must not be null");

        List<String> pages = new ArrayList<>();

        try (PDDocument doc = Loader.loadPDF(file)) {
            ensureNotEncrypted(doc);

            PDFTextStripper stripper = createStripper();
            int total = doc.getNumberOfPages();

            for (int i = 1; i <= total; i++) {
                stripper.setStartPage(i);
                stripper.setEndPage(i);
                String text = stripper.getText(doc);
                pages.add(cleanText(text != null ? text : ""));
            }
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to extract text per page from PDF: " + file, e);
            throw e;
        }

        return pages;
    }

    /**
     * Extracts text without throwing: failures and cancellation become an
     * unsuccessful {@link ExtractionResult} with a message.
     */
    public static ExtractionResult tryExtract(File file,
                                              boolean withHeader,
                                              PdfEngine engine,
                                              IntConsumer progress,
                                              BooleanSupplier cancelled) {
        try {
            return ExtractionResult.ok(extractText(file, withHeader, engine, progress, cancelled));
        } catch (CancellationException e) {
            LOGGER.info("PDF extraction cancelled: " + file);
            return ExtractionResult.cancelled();
        } catch (IOException e) {
            return ExtractionResult.failed("❌ Failed to extract PDF text: " + e.getMessage());
        }
    }

    /**
     * Runs {@link #extractText(File, boolean, PdfEngine, IntConsumer, BooleanSupplier)}
     * on the given executor.
     *
     * <p>The future completes exceptionally with the {@link IOException} (wrapped
     * in a {@link CompletionException}) or with a {@link CancellationException}.</p>
     */
    public static CompletableFuture<PdfLoadResult> extractTextAsync(File file,
                                                                    boolean withHeader,
                                                                    PdfEngine engine,
                                                                    IntConsumer progress,
                                                                    BooleanSupplier cancelled,
                                                                    Executor executor) {
        Objects.requireNonNull(executor, "executor must not be null");

        return CompletableFuture.supplyAsync(() -> {
            try {
                return extractText(file, withHeader, engine, progress, cancelled);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    // ========================================================================
    // Public API – document / byte[] based
    // ========================================================================

    /**
     * Extracts full text from a PDF represented as a byte array.
     *
     * @param pdfBytes bytes of a PDF document; must not be {@code null}
     * @return extracted text with zero-width characters stripped
     * @throws IOException if loading or parsing the PDF fails
     */
    public static String extractText(byte[] pdfBytes) throws IOException {
        Objects.requireNonNull(pdfBytes, "pdfBytes must not be null");

        try (PDDocument doc = Loader.loadPDF(pdfBytes)) {
            ensureNotEncrypted(doc);

            PDFTextStripper stripper = createStripper();
            String text = stripper.getText(doc);
            return cleanText(text);
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Failed to extract text from PDF bytes", e);
            throw e;
        }
    }

    /**
     * Page loop shared by all extraction entry points. The document stays
     * owned by the caller.
     *
     * <p>Each page contributes its trimmed text followed by a blank line;
     * a blank page contributes its marker (when requested) and a blank line.</p>
     *
     * @throws CancellationException if {@code cancelled} turned true before a page
     */
    public static PdfLoadResult extractPages(PDDocument doc,
                                             boolean withHeader,
                                             PdfEngine engine,
                                             IntConsumer progress,
                                             BooleanSupplier cancelled) throws IOException {
        Objects.requireNonNull(doc, "doc must not be null");
        Objects.requireNonNull(engine, "engine must not be null");

        int total = doc.getNumberOfPages();
        if (total <= 0) {
            if (progress != null) {
                progress.accept(100);
            }
            return new PdfLoadResult("", 0);
        }

        ProgressCadence cadence = new ProgressCadence(total);
        PDFTextStripper stripper = engine == PdfEngine.TEXT_STRIPPER ? createStripper() : null;
        OverlayFilter overlayFilter = engine == PdfEngine.TEXT_OBJECTS ? new OverlayFilter() : null;
        TextObjectExtractor extractor = overlayFilter != null ? new TextObjectExtractor(overlayFilter) : null;

        StringBuilder sb = new StringBuilder(8192);

        for (int i = 1; i <= total; i++) {
            if (cancelled != null && cancelled.getAsBoolean()) {
                throw new CancellationException("PDF extraction cancelled before page " + i + "/" + total);
            }

            if (progress != null && cadence.shouldReport(i)) {
                progress.accept(cadence.percent(i));
            }

            String pageText;
            if (stripper != null) {
                stripper.setStartPage(i);
                stripper.setEndPage(i);
                pageText = stripper.getText(doc);
            } else {
                pageText = overlayFilter.filterPage(extractor.extractPage(doc, i));
            }
            pageText = cleanText(pageText != null ? pageText : "").trim();

            if (withHeader) {
                sb.append(pageMarker(i, total)).append('\n');
            }

            // blank pages still leave a visible separator
            if (!pageText.isEmpty()) {
                sb.append(pageText).append('\n');
            }
            sb.append('\n');
        }

        return new PdfLoadResult(sb.toString(), total);
    }

    // ========================================================================
    // Write UTF-8 text to file
    // ========================================================================

    /**
     * Writes the given text to the specified file using UTF-8 encoding.
     *
     * @param text   text content to write (never null)
     * @param output target file (never null)
     * @throws IOException if writing fails
     */
    public static void saveTextToFile(String text, File output) throws IOException {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(output, "output must not be null");

        try {
            Files.write(output.toPath(), text.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Unable to write PDF text to file: " + output, e);
            throw e;
        }
    }
}
