package pdfboxhelper;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drops repeated overlay / watermark text objects from one page and rebuilds
 * the surviving fragments into line-oriented text for the reflow engine.
 *
 * <p>A fragment is an overlay when</p>
 * <ul>
 *   <li>the same normalized text appears at least {@code repeatThreshold}
 *       times in the same vertical band of the page, or</li>
 *   <li>it is a tiled single-word pattern: at least {@code tiledMinTokens}
 *       space-separated tokens, all but at most one the same short token.</li>
 * </ul>
 */
public final class OverlayFilter {

    private static final Logger LOGGER = Logger.getLogger(OverlayFilter.class.getName());

    private final OverlayFilterOptions options;

    public OverlayFilter() {
        this(OverlayFilterOptions.defaults());
    }

    public OverlayFilter(OverlayFilterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Creates a fragment bucketed with this filter's band step.
     */
    public TextObjectFragment fragment(String text, float yMid) {
        return new TextObjectFragment(text, yMid, options.getBandStep());
    }

    /**
     * Filters one page and joins the survivors into lines.
     *
     * @param pageFragments fragments of a single page, in page order
     * @return reconstructed page text, never {@code null}
     */
    public String filterPage(List<TextObjectFragment> pageFragments) {
        List<TextObjectFragment> kept = filter(pageFragments);

        if (LOGGER.isLoggable(Level.FINE) && kept.size() < pageFragments.size()) {
            LOGGER.fine("Dropped " + (pageFragments.size() - kept.size())
                    + " overlay fragment(s) of " + pageFragments.size());
        }

        return joinLines(kept);
    }

    /**
     * @return surviving fragments in their original order
     */
    public List<TextObjectFragment> filter(List<TextObjectFragment> pageFragments) {
        Objects.requireNonNull(pageFragments, "pageFragments must not be null");

        // frequency of (normalized text, band)
        Map<BandKey, Integer> counts = new HashMap<>();
        for (TextObjectFragment f : pageFragments) {
            if (f.getKey().isEmpty())
                continue;
            counts.merge(new BandKey(f.getKey(), f.getBucket()), 1, Integer::sum);
        }

        List<TextObjectFragment> kept = new ArrayList<>(pageFragments.size());
        for (TextObjectFragment f : pageFragments) {
            if (f.getKey().isEmpty())
                continue;

            int n = counts.get(new BandKey(f.getKey(), f.getBucket()));
            if (n >= options.getRepeatThreshold())
                continue;

            if (isTiledWatermark(f.getKey()))
                continue;

            kept.add(f);
        }

        return kept;
    }

    /**
     * {@code "DRAFT DRAFT DRAFT DRAFT DRAFT DRAFT"} and similar.
     */
    boolean isTiledWatermark(String key) {
        String[] tokens = key.split(" ");
        if (tokens.length < options.getTiledMinTokens())
            return false;

        Map<String, Integer> freq = new HashMap<>();
        int best = 0;
        for (String t : tokens) {
            if (t.length() > options.getTiledMaxTokenLength())
                continue;
            int n = freq.merge(t, 1, Integer::sum);
            best = Math.max(best, n);
        }

        return best >= tokens.length - 1;
    }

    /**
     * Concatenates fragments in order. A newline is inserted when the vertical
     * midpoint moves by more than the line jitter. Bands are only the repeat key:
     * two lines at normal leading can sit in neighbouring bands.
     */
    String joinLines(List<TextObjectFragment> fragments) {
        StringBuilder sb = new StringBuilder();
        TextObjectFragment prev = null;

        for (TextObjectFragment f : fragments) {
            String text = f.getText();

            if (prev != null) {
                if (Math.abs(f.getYMid() - prev.getYMid()) > options.getLineJitter()) {
                    sb.append('\n');
                } else if (needsSpace(sb, text)) {
                    sb.append(' ');
                }
            }

            sb.append(text);
            prev = f;
        }

        return sb.toString();
    }

    // Latin words split into separate objects keep one space between them
    private static boolean needsSpace(StringBuilder sb, String next) {
        if (sb.length() == 0 || next.isEmpty())
            return false;

        char a = sb.charAt(sb.length() - 1);
        char b = next.charAt(0);
        return isAsciiAlnum(a) && isAsciiAlnum(b);
    }

    private static boolean isAsciiAlnum(char ch) {
        return ch <= 0x7F && Character.isLetterOrDigit(ch);
    }

    private static final class BandKey {
        private final String text;
        private final int bucket;

        BandKey(String text, int bucket) {
            this.text = text;
            this.bucket = bucket;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BandKey)) return false;
            BandKey other = (BandKey) o;
            return bucket == other.bucket && text.equals(other.text);
        }

        @Override
        public int hashCode() {
            return 31 * text.hashCode() + bucket;
        }
    }
}
