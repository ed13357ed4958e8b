package cjkreflow;

/**
 * Decides whether an accumulated paragraph ends at a sentence or bracket boundary.
 *
 * <p>PDF / OCR text often substitutes ASCII punctuation for CJK punctuation
 * near line and page breaks. The {@link SentenceBoundaryLevel} trades recall
 * against false paragraph splits.</p>
 */
public final class SentenceBoundary {

    private SentenceBoundary() {
    }

    public static boolean endsWithSentenceBoundary(CharSequence s, SentenceBoundaryLevel level) {
        int lastIdx = PunctSets.lastNonWhitespaceIndex(s);
        if (lastIdx < 0)
            return false;

        char last = s.charAt(lastIdx);

        // ---- STRICT ----
        if (PunctSets.isStrongSentenceEnd(last))
            return true;

        if ((last == '.' || last == ':') && isOcrCjkAsciiPunctAtLineEnd(s, lastIdx))
            return true;

        if (level == SentenceBoundaryLevel.STRICT)
            return false;

        // ---- BALANCED ----
        int prevIdx = PunctSets.prevNonWhitespaceIndex(s, lastIdx);

        // Quote closers + allowed postfix closer after a strong end: 。」 ！） .」
        if ((PunctSets.isQuoteCloser(last) || PunctSets.isAllowedPostfixCloser(last)) && prevIdx >= 0) {
            char prev = s.charAt(prevIdx);

            if (PunctSets.isStrongSentenceEnd(prev))
                return true;

            if (prev == '.' && isOcrCjkAsciiPunctBeforeClosers(s, prevIdx))
                return true;
        }

        // "他说：" then dialog on the next line
        if (last == '：' && CjkText.isMostlyCjk(s))
            return true;

        if (endsWithEllipsis(s))
            return true;

        if (level == SentenceBoundaryLevel.BALANCED)
            return false;

        // ---- VERY LENIENT ----
        return last == '；' || last == '：' || last == ';' || last == ':';
    }

    /**
     * True iff the trimmed text is exactly one matching bracket pair around
     * mostly-CJK content, e.g. {@code （完）} or {@code 【番外】}.
     *
     * <p>ASCII {@code ( )} and {@code [ ]} additionally require at least one CJK
     * char inside, and the outer bracket type must be balanced in the text.</p>
     */
    public static boolean endsWithCjkBracketBoundary(CharSequence text) {
        if (text == null)
            return false;

        String s = text.toString().trim();
        if (s.length() < 2)
            return false;

        char open = s.charAt(0);
        char close = s.charAt(s.length() - 1);

        if (!PunctSets.isMatchingBracket(open, close))
            return false;

        String inner = s.substring(1, s.length() - 1).trim();
        if (inner.isEmpty())
            return false;

        if (!CjkText.isMostlyCjk(inner))
            return false;

        if ((open == '(' || open == '[') && !CjkText.containsAnyCjk(inner))
            return false;

        return PunctSets.isBracketTypeBalanced(s, open);
    }

    /**
     * Single {@code …} or an OCR {@code ...} run, in a mostly-CJK text only.
     */
    public static boolean endsWithEllipsis(CharSequence s) {
        int i = PunctSets.lastNonWhitespaceIndex(s);
        if (i < 0)
            return false;

        if (!CjkText.isMostlyCjk(s))
            return false;

        if (s.charAt(i) == '…')
            return true;

        return i >= 2 && s.charAt(i) == '.' && s.charAt(i - 1) == '.' && s.charAt(i - 2) == '.';
    }

    // The ASCII punct is the last non-whitespace char and directly follows a CJK char.
    private static boolean isOcrCjkAsciiPunctAtLineEnd(CharSequence s, int lastNonWsIndex) {
        if (lastNonWsIndex <= 0)
            return false;

        return CjkText.isCjk(s.charAt(lastNonWsIndex - 1)) && CjkText.isMostlyCjk(s);
    }

    // '.' followed only by whitespace and closers, e.g. 好.」
    private static boolean isOcrCjkAsciiPunctBeforeClosers(CharSequence s, int index) {
        for (int j = index + 1; j < s.length(); j++) {
            char ch = s.charAt(j);
            if (Character.isWhitespace(ch))
                continue;
            if (PunctSets.isQuoteCloser(ch) || PunctSets.isBracketCloser(ch))
                continue;
            return false;
        }

        int prevIdx = PunctSets.prevNonWhitespaceIndex(s, index);
        if (prevIdx < 0)
            return false;

        return CjkText.isCjk(s.charAt(prevIdx)) && CjkText.isMostlyCjk(s);
    }
}
