package cjkreflow;

/**
 * How aggressively ambiguous punctuation ends a paragraph.
 * Each level accepts everything the stricter levels accept.
 */
public enum SentenceBoundaryLevel {
    /**
     * Also treats bare {@code ；：;:} as boundaries.
     */
    VERY_LENIENT(1),
    /**
     * Default: closers after a strong end, colon in a mostly-CJK line, ellipsis.
     */
    BALANCED(2),
    /**
     * Strong terminators and OCR {@code .}/{@code :} after CJK only.
     */
    STRICT(3);

    private final int value;

    SentenceBoundaryLevel(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    /**
     * Maps a numeric level, clamping into 1..3.
     */
    public static SentenceBoundaryLevel of(int level) {
        if (level <= 1)
            return VERY_LENIENT;
        if (level >= 3)
            return STRICT;
        return BALANCED;
    }
}
