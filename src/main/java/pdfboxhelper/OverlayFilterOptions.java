package pdfboxhelper;

/**
 * Tuning for {@link OverlayFilter}. Immutable.
 */
public final class OverlayFilterOptions {

    private static final OverlayFilterOptions DEFAULTS = new OverlayFilterOptions(8f, 4, 6, 12, 3f);

    private final float bandStep;
    private final int repeatThreshold;
    private final int tiledMinTokens;
    private final int tiledMaxTokenLength;
    private final float lineJitter;

    /**
     * @param bandStep            height of one vertical band in PDF points
     * @param repeatThreshold     same text in the same band this many times is an overlay
     * @param tiledMinTokens      minimum space-separated tokens of a tiled watermark
     * @param tiledMaxTokenLength longest token still considered a tile
     * @param lineJitter          vertical midpoint distance in PDF points up to which
     *                            fragments stay on one line
     */
    public OverlayFilterOptions(float bandStep,
                                int repeatThreshold,
                                int tiledMinTokens,
                                int tiledMaxTokenLength,
                                float lineJitter) {
        if (!(bandStep > 0f))
            throw new IllegalArgumentException("bandStep must be positive: " + bandStep);
        if (repeatThreshold < 2)
            throw new IllegalArgumentException("repeatThreshold must be >= 2: " + repeatThreshold);

        this.bandStep = bandStep;
        this.repeatThreshold = repeatThreshold;
        this.tiledMinTokens = tiledMinTokens;
        this.tiledMaxTokenLength = tiledMaxTokenLength;
        this.lineJitter = Math.max(0f, lineJitter);
    }

    /**
     * 8pt bands, 4 repeats, 6-token tiles of up to 12 chars, 3pt of line jitter.
     */
    public static OverlayFilterOptions defaults() {
        return DEFAULTS;
    }

    public float getBandStep() {
        return bandStep;
    }

    public int getRepeatThreshold() {
        return repeatThreshold;
    }

    public int getTiledMinTokens() {
        return tiledMinTokens;
    }

    public int getTiledMaxTokenLength() {
        return tiledMaxTokenLength;
    }

    public float getLineJitter() {
        return lineJitter;
    }
}
