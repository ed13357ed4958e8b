package cjkreflow;

/**
 * Character-level predicates used by the reflow heuristics.
 *
 * <p>Everything here is BMP focused and total: unexpected code points simply
 * classify as "not CJK" / "not recognized", nothing throws.</p>
 */
public final class CjkText {

    private CjkText() {
    }

    /**
     * Minimal CJK checker (BMP focused).
     * Designed for heading / structure heuristics, not full Unicode linguistics.
     */
    public static boolean isCjk(char ch) {
        return isCjk((int) ch);
    }

    /**
     * Code point variant of {@link #isCjk(char)}. Supplementary planes are never CJK here.
     */
    public static boolean isCjk(int codePoint) {

        // CJK Unified Ideographs Extension A (U+3400–U+4DBF)
        if (codePoint >= 0x3400 && codePoint <= 0x4DBF)
            return true;

        // CJK Unified Ideographs (U+4E00–U+9FFF)
        if (codePoint >= 0x4E00 && codePoint <= 0x9FFF)
            return true;

        // CJK Compatibility Ideographs (U+F900–U+FAFF)
        return codePoint >= 0xF900 && codePoint <= 0xFAFF;
    }

    public static boolean isDigitAsciiOrFullWidth(char ch) {
        // ASCII digits '0'–'9'
        if (ch >= '0' && ch <= '9')
            return true;

        // FULLWIDTH digits '０'–'９'
        return ch >= '０' && ch <= '９';
    }

    public static boolean isAllAscii(CharSequence s) {
        for (int i = 0; i < s.length(); i++)
            if (s.charAt(i) > 0x7F)
                return false;
        return true;
    }

    /**
     * ASCII or full-width digits, ASCII space allowed as neutral; at least one digit required.
     */
    public static boolean isAllAsciiDigits(CharSequence s) {
        boolean hasDigit = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == ' ')
                continue;
            if (!isDigitAsciiOrFullWidth(ch))
                return false;
            hasDigit = true;
        }

        return hasDigit;
    }

    // Returns true if the string consists entirely of CJK characters.
    // Whitespace handling is controlled by allowWhitespace.
    // Returns false for null, empty, or whitespace-only strings.
    private static boolean isAllCjk(CharSequence s, boolean allowWhitespace) {
        if (s == null || s.length() == 0)
            return false;

        boolean seen = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (Character.isWhitespace(ch)) {
                if (!allowWhitespace)
                    return false;
                continue;
            }

            seen = true;

            if (!isCjk(ch))
                return false;
        }

        return seen;
    }

    public static boolean isAllCjkIgnoringWhitespace(CharSequence s) {
        return isAllCjk(s, true);
    }

    public static boolean isAllCjkNoWhiteSpace(CharSequence s) {
        return isAllCjk(s, false);
    }

    public static boolean containsAnyCjk(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (isCjk(s.charAt(i)))
                return true;
        }
        return false;
    }

    /**
     * Returns true if the string contains BOTH:
     * - CJK (as defined by isCjk(ch)), and
     * - ASCII letters / digits OR full-width digits (０-９),
     * while rejecting any other characters except neutral ASCII separators:
     * space, '-', '/', ':', '.'
     */
    public static boolean isMixedCjkAscii(CharSequence s) {
        boolean hasCjk = false;
        boolean hasAscii = false;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);

            // Neutral ASCII (allowed, but doesn't count as ASCII content)
            if (ch == ' ' || ch == '-' || ch == '/' || ch == ':' || ch == '.')
                continue;

            if (ch <= 0x7F) {
                if (Character.isLetterOrDigit(ch)) {
                    hasAscii = true;
                } else {
                    return false;
                }
            } else if (ch >= '０' && ch <= '９') {
                hasAscii = true;
            } else if (isCjk(ch)) {
                hasCjk = true;
            } else {
                return false;
            }
        }

        return hasCjk && hasAscii;
    }

    /**
     * Returns true if the string is mostly CJK:
     * - Ignores whitespace
     * - Ignores digits (ASCII + FULLWIDTH)
     * - Counts CJK characters
     * - Counts ASCII letters only (punctuation is neutral)
     * <p>
     * Rule:
     * cjk > 0 && cjk >= asciiLetters
     */
    public static boolean isMostlyCjk(CharSequence s) {
        if (s == null || s.length() == 0)
            return false;

        int cjk = 0;
        int ascii = 0;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (Character.isWhitespace(ch))
                continue;

            if (isDigitAsciiOrFullWidth(ch))
                continue;

            if (isCjk(ch)) {
                cjk++;
                continue;
            }

            // Count ASCII letters only; ASCII punctuation is neutral
            if (ch <= 0x7F && Character.isLetter(ch)) {
                ascii++;
            }
        }

        return cjk > 0 && cjk >= ascii;
    }

    public static String trimEnd(String s) {
        if (s == null || s.isEmpty()) return s;
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return (end == s.length()) ? s : s.substring(0, end);
    }
}
