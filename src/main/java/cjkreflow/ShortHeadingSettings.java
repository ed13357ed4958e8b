package cjkreflow;

import java.util.Objects;

/**
 * Immutable short-heading rules for one reflow run.
 *
 * <p>{@code maxLen} is clamped into {@value #MIN_MAX_LEN}..{@value #MAX_MAX_LEN}.
 * The four toggles enable which character-pattern classes may form a short heading.</p>
 */
public final class ShortHeadingSettings {

    public static final int MIN_MAX_LEN = 3;
    public static final int MAX_MAX_LEN = 30;
    public static final int DEFAULT_MAX_LEN = 8;

    private static final ShortHeadingSettings DEFAULTS =
            new ShortHeadingSettings(DEFAULT_MAX_LEN, true, true, true, false);

    private final int maxLen;
    private final boolean allCjk;
    private final boolean allAscii;
    private final boolean allAsciiDigits;
    private final boolean mixedCjkAscii;

    public ShortHeadingSettings(int maxLen,
                                boolean allCjk,
                                boolean allAscii,
                                boolean allAsciiDigits,
                                boolean mixedCjkAscii) {
        this.maxLen = clampMaxLen(maxLen);
        this.allCjk = allCjk;
        this.allAscii = allAscii;
        this.allAsciiDigits = allAsciiDigits;
        this.mixedCjkAscii = mixedCjkAscii;
    }

    /**
     * MaxLen=8, AllCjk, AllAscii and AllAsciiDigits on, MixedCjkAscii off.
     */
    public static ShortHeadingSettings defaults() {
        return DEFAULTS;
    }

    public static int clampMaxLen(int maxLen) {
        return Math.max(MIN_MAX_LEN, Math.min(MAX_MAX_LEN, maxLen));
    }

    public int getMaxLen() {
        return maxLen;
    }

    public boolean isAllCjk() {
        return allCjk;
    }

    public boolean isAllAscii() {
        return allAscii;
    }

    public boolean isAllAsciiDigits() {
        return allAsciiDigits;
    }

    public boolean isMixedCjkAscii() {
        return mixedCjkAscii;
    }

    public ShortHeadingSettings withMaxLen(int newMaxLen) {
        return new ShortHeadingSettings(newMaxLen, allCjk, allAscii, allAsciiDigits, mixedCjkAscii);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShortHeadingSettings)) return false;
        ShortHeadingSettings that = (ShortHeadingSettings) o;
        return maxLen == that.maxLen
                && allCjk == that.allCjk
                && allAscii == that.allAscii
                && allAsciiDigits == that.allAsciiDigits
                && mixedCjkAscii == that.mixedCjkAscii;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLen, allCjk, allAscii, allAsciiDigits, mixedCjkAscii);
    }

    @Override
    public String toString() {
        return "ShortHeadingSettings{maxLen=" + maxLen
                + ", allCjk=" + allCjk
                + ", allAscii=" + allAscii
                + ", allAsciiDigits=" + allAsciiDigits
                + ", mixedCjkAscii=" + mixedCjkAscii + '}';
    }
}
