package pdfboxhelper;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the text chunks PDFBox emits for a page together with their
 * vertical midpoint, as input for {@link OverlayFilter}.
 *
 * <p>Duplicate overlapping glyphs are kept on purpose: stacked watermark
 * copies are exactly what the overlay filter has to see.</p>
 */
final class TextObjectExtractor extends PDFTextStripper {

    private final OverlayFilter filter;
    private List<TextObjectFragment> current = new ArrayList<>();

    TextObjectExtractor(OverlayFilter filter) throws IOException {
        super();
        this.filter = filter;
        setSortByPosition(true);
        setSuppressDuplicateOverlappingText(false);
    }

    /**
     * Extracts the fragments of one page.
     *
     * @param page 1-based page index
     */
    List<TextObjectFragment> extractPage(PDDocument doc, int page) throws IOException {
        current = new ArrayList<>();
        setStartPage(page);
        setEndPage(page);
        getText(doc);
        return current;
    }

    @Override
    protected void startPage(PDPage page) throws IOException {
        super.startPage(page);
        current = new ArrayList<>();
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (text == null || text.trim().isEmpty() || textPositions.isEmpty())
            return;

        float sum = 0f;
        for (TextPosition tp : textPositions) {
            // YDirAdj is the baseline; the glyph box extends upwards by its height
            sum += tp.getYDirAdj() - tp.getHeightDir() / 2f;
        }

        current.add(filter.fragment(text, sum / textPositions.size()));
    }
}
