package pdfboxhelper;

import java.util.Objects;

/**
 * One extracted text object of a page with its vertical position.
 *
 * <p>The normalized key (whitespace collapsed and trimmed) and the band
 * bucket {@code floor(yMid / bandStep)} are what the overlay filter counts.</p>
 */
public final class TextObjectFragment {

    private final String text;
    private final String key;
    private final float yMid;
    private final int bucket;

    public TextObjectFragment(String text, float yMid, float bandStep) {
        if (!(bandStep > 0f))
            throw new IllegalArgumentException("bandStep must be positive: " + bandStep);

        this.text = Objects.requireNonNull(text, "text must not be null");
        this.key = normalizeKey(text);
        this.yMid = yMid;
        this.bucket = (int) Math.floor(yMid / bandStep);
    }

    static String normalizeKey(String s) {
        return s.replaceAll("[\\s　]+", " ").trim();
    }

    public String getText() {
        return text;
    }

    public String getKey() {
        return key;
    }

    public float getYMid() {
        return yMid;
    }

    public int getBucket() {
        return bucket;
    }

    @Override
    public String toString() {
        return "TextObjectFragment{'" + text + "', bucket=" + bucket + '}';
    }
}
