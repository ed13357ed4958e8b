package cjkreflow;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One physical input row in its three forms.
 *
 * <ul>
 *   <li>{@code raw}: as split from the input, used for indentation checks</li>
 *   <li>{@code stripped}: trailing whitespace and leading half-width spaces
 *       removed, full-width indentation kept; this is what gets emitted</li>
 *   <li>{@code probe}: all leading indentation removed; classification only</li>
 * </ul>
 */
public final class Line {

    /**
     * Lines with 2+ leading ASCII/full-width spaces are considered indented
     */
    private static final Pattern INDENT_REGEX = Pattern.compile("^[\\s　]{2,}");

    private final String raw;
    private final String stripped;
    private final String probe;

    private Line(String raw, String stripped) {
        this.raw = raw;
        this.stripped = stripped;
        this.probe = trimStartSpacesAndFullWidth(stripped);
    }

    public static Line of(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");

        // Visual form: trim right, remove half-width indent
        String stripped = CjkText.trimEnd(raw);
        stripped = stripHalfWidthIndentKeepFullWidth(stripped);
        return new Line(raw, stripped);
    }

    /**
     * Same physical line with a rewritten stripped form (e.g. after repeat collapse).
     */
    public Line withStripped(String newStripped) {
        if (newStripped.equals(stripped))
            return this;
        return new Line(raw, newStripped);
    }

    public String getRaw() {
        return raw;
    }

    public String getStripped() {
        return stripped;
    }

    public String getProbe() {
        return probe;
    }

    public boolean isEmpty() {
        return stripped.isEmpty();
    }

    public boolean isIndented() {
        return INDENT_REGEX.matcher(raw).find();
    }

    public boolean isDialogStarter() {
        return PunctSets.isDialogStarter(probe);
    }

    public boolean isPageMarker() {
        return stripped.startsWith("=== ") && stripped.endsWith("===");
    }

    private static String stripHalfWidthIndentKeepFullWidth(String s) {
        if (s == null || s.isEmpty()) return s;
        int i = 0;
        while (i < s.length() && s.charAt(i) == ' ') i++;
        return s.substring(i);
    }

    private static String trimStartSpacesAndFullWidth(String s) {
        if (s == null || s.isEmpty()) return s;
        int start = 0;
        while (start < s.length()) {
            char ch = s.charAt(start);
            if (Character.isWhitespace(ch) || ch == '　') {
                start++;
            } else {
                break;
            }
        }
        return s.substring(start);
    }

    @Override
    public String toString() {
        return stripped;
    }
}
