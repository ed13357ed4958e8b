package cjkreflow;

/**
 * Style-layer repeat collapse for PDF headings / title lines.
 * <p>
 * Conceptually similar to the regex:
 * (.{4,10}?)\1{2,}
 * <p>
 * but implemented with token- and phrase-aware logic so that
 * CJK headings such as:
 * <p>
 * "背负着一切的麒麟 背负着一切的麒麟 背负着一切的麒麟 背负着一切的麒麟"
 * <p>
 * collapse cleanly to a single phrase.
 * <p>
 * This also avoids collapsing natural text such as "哈哈哈哈哈哈"
 * by enforcing a base-unit length of 4–10 and at least 3 repeats.
 */
public final class RepeatCollapser {

    private static final int MIN_REPEATS = 3;
    private static final int MAX_PHRASE_TOKENS = 8;
    private static final int MIN_UNIT_LEN = 4;
    private static final int MAX_UNIT_LEN = 10;
    private static final int MAX_TOKEN_LEN = 200;

    private RepeatCollapser() {
    }

    /**
     * Collapses repeated phrases and repeated in-token units.
     *
     * @return the collapsed line, or the very same instance when nothing repeats
     */
    public static String collapse(String line) {
        if (line == null || line.isEmpty())
            return line;

        // keep indentation out of the token comparison
        int bodyStart = 0;
        while (bodyStart < line.length()
                && (line.charAt(bodyStart) == ' ' || line.charAt(bodyStart) == '　'))
            bodyStart++;

        String body = line.substring(bodyStart).trim();
        if (body.isEmpty())
            return line;

        String[] parts = body.split("[ \t]+");
        boolean changed = false;

        // 1) collapse repeated *word sequences*
        String[] collapsed = collapseRepeatedWordSequences(parts);
        if (collapsed != parts) {
            parts = collapsed;
            changed = true;
        }

        // 2) collapse repeated patterns *inside a token*
        for (int i = 0; i < parts.length; i++) {
            String token = collapseRepeatedToken(parts[i]);
            if (!token.equals(parts[i])) {
                parts[i] = token;
                changed = true;
            }
        }

        if (!changed)
            return line;

        return line.substring(0, bodyStart) + String.join(" ", parts);
    }

    /**
     * Collapses repeated sequences of tokens (phrases).
     * <p>
     * Example:
     * ["背负着一切的麒麟", "背负着一切的麒麟", "背负着一切的麒麟", "背负着一切的麒麟"]
     * becomes:
     * ["背负着一切的麒麟"]
     *
     * @return {@code parts} itself when no phrase repeats
     */
    static String[] collapseRepeatedWordSequences(String[] parts) {
        final int n = parts.length;
        if (n < MIN_REPEATS)
            return parts;

        for (int start = 0; start < n; start++) {
            for (int phraseLen = 1; phraseLen <= MAX_PHRASE_TOKENS && start + phraseLen <= n; phraseLen++) {

                // single glyph phrases ("哈 哈 哈", "* * *") are left alone
                if (phraseCharCount(parts, start, phraseLen) < 2)
                    continue;

                int count = 1;

                while (true) {
                    int nextStart = start + count * phraseLen;
                    if (nextStart + phraseLen > n)
                        break;

                    boolean equal = true;
                    for (int k = 0; k < phraseLen; k++) {
                        if (!parts[start + k].equals(parts[nextStart + k])) {
                            equal = false;
                            break;
                        }
                    }

                    if (!equal)
                        break;

                    count++;
                }

                if (count >= MIN_REPEATS) {
                    int newSize = n - (count - 1) * phraseLen;
                    String[] result = new String[newSize];

                    int idx = 0;

                    // prefix
                    for (int i = 0; i < start; i++)
                        result[idx++] = parts[i];

                    // one copy of the repeated phrase
                    for (int k = 0; k < phraseLen; k++)
                        result[idx++] = parts[start + k];

                    // tail
                    int tailStart = start + count * phraseLen;
                    for (int i = tailStart; i < n; i++)
                        result[idx++] = parts[i];

                    return result;
                }
            }
        }

        return parts;
    }

    /**
     * Collapses repeated substring patterns inside a single token.
     * <p>
     * Only applies when:
     * - base unit length between 4..10
     * - the token consists of N ≥ 3 consecutive repeats
     * <p>
     * Examples:
     * "abcdabcdabcd" → "abcd"
     * "第一季大结局第一季大结局第一季大结局" → "第一季大结局"
     */
    static String collapseRepeatedToken(String token) {
        int len = token.length();
        if (len < MIN_UNIT_LEN * MIN_REPEATS || len > MAX_TOKEN_LEN)
            return token;

        for (int unitLen = MIN_UNIT_LEN; unitLen <= MAX_UNIT_LEN && unitLen <= len / MIN_REPEATS; unitLen++) {

            if (len % unitLen != 0)
                continue;

            String unit = token.substring(0, unitLen);
            boolean allMatch = true;

            for (int pos = 0; pos < len; pos += unitLen) {
                if (!token.regionMatches(pos, unit, 0, unitLen)) {
                    allMatch = false;
                    break;
                }
            }

            // a unit made of one repeated glyph is a natural run, not a style repeat
            if (allMatch && !isSingleGlyphRun(unit)) {
                return unit;
            }
        }

        return token;
    }

    private static int phraseCharCount(String[] parts, int start, int len) {
        int total = 0;
        for (int k = 0; k < len; k++)
            total += parts[start + k].length();
        return total;
    }

    private static boolean isSingleGlyphRun(String s) {
        for (int i = 1; i < s.length(); i++) {
            if (s.charAt(i) != s.charAt(0))
                return false;
        }
        return true;
    }
}
