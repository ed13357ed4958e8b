package cjkreflow;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed punctuation / bracket tables shared by the line classifier and the
 * segmentation engine.
 *
 * <p>None of these sets are configurable. Lookups are backed by
 * {@code boolean[65536]} tables so that every predicate is O(1) per char.</p>
 */
public final class PunctSets {

    /**
     * Dialog opening characters
     */
    private static final String DIALOG_OPENERS = "“‘「『﹁﹃";

    /**
     * Dialog closing characters
     * <p>
     * IMPORTANT:
     * Order and pairing MUST stay consistent with DIALOG_OPENERS.
     */
    private static final String DIALOG_CLOSERS = "”’」』﹂﹄";

    /**
     * Clause-or-end punctuation: looser than a strong sentence end,
     * includes colons, semicolons, closing quotes and closing brackets.
     */
    private static final char[] CLAUSE_OR_END_CHARS = {
            // Standard CJK sentence-ending punctuation
            '。', '！', '？', '；', '：', '…', '—',

            // Closing quotes (CJK)
            '”', '’', '」', '』', '﹂', '﹄',

            // Chinese / full-width closing brackets
            '）', '】', '》', '〗', '〕', '］', '｝',

            // Angle brackets (CJK + ASCII)
            '＞', '〉', '>',

            // Allowed ASCII-like endings
            '.', ')', ':', '!', '?'
    };

    private static final boolean[] CLAUSE_OR_END_TABLE = new boolean[Character.MAX_VALUE + 1];

    // -------------------------
    // Soft continuation punctuation
    // -------------------------
    private static final boolean[] COMMA_LIKE_TABLE = new boolean[Character.MAX_VALUE + 1];

    // ---------------------------------------------------------------------
    // Bracket punctuations (open → close)
    // ---------------------------------------------------------------------

    private static final boolean[] OPEN_BRACKET_TABLE = new boolean[Character.MAX_VALUE + 1];
    private static final boolean[] CLOSE_BRACKET_TABLE = new boolean[Character.MAX_VALUE + 1];
    private static final char[] BRACKET_CLOSE_BY_OPEN = new char[Character.MAX_VALUE + 1];

    // Metadata key-value separators
    private static final char[] METADATA_SEPARATORS = new char[]{
            '：', // full-width colon
            ':',  // ASCII colon
            '　', // full-width ideographic space (U+3000)
            '·',  // Middle dot (Latin)
            '・'  // Katakana middle dot
    };

    private static final boolean[] METADATA_SEPARATOR_TABLE = new boolean[Character.MAX_VALUE + 1];

    static {
        for (char c : CLAUSE_OR_END_CHARS)
            CLAUSE_OR_END_TABLE[c] = true;

        COMMA_LIKE_TABLE['，'] = true; // full-width comma
        COMMA_LIKE_TABLE[','] = true; // ASCII comma
        COMMA_LIKE_TABLE['、'] = true; // ideographic comma

        for (char c : METADATA_SEPARATORS)
            METADATA_SEPARATOR_TABLE[c] = true;

        Map<Character, Character> map = new HashMap<>();

        // Parentheses
        map.put('（', '）');
        map.put('(', ')');

        // Square brackets
        map.put('[', ']');
        map.put('［', '］');

        // Curly braces (ASCII + FULLWIDTH)
        map.put('{', '}');
        map.put('｛', '｝');

        // Angle brackets
        map.put('<', '>');
        map.put('＜', '＞');
        map.put('〈', '〉');

        // CJK brackets
        map.put('【', '】');
        map.put('《', '》');
        map.put('〔', '〕');
        map.put('〖', '〗');

        for (Map.Entry<Character, Character> e : map.entrySet()) {
            char o = e.getKey();
            char c = e.getValue();
            OPEN_BRACKET_TABLE[o] = true;
            CLOSE_BRACKET_TABLE[c] = true;
            BRACKET_CLOSE_BY_OPEN[o] = c;
        }
    }

    private PunctSets() {
    }

    // ---------------------------------------------------------------------
    // Dialog quotes
    // ---------------------------------------------------------------------

    public static boolean isDialogOpener(char ch) {
        return DIALOG_OPENERS.indexOf(ch) >= 0;
    }

    public static boolean isDialogCloser(char ch) {
        return DIALOG_CLOSERS.indexOf(ch) >= 0;
    }

    public static boolean isQuoteCloser(char ch) {
        return isDialogCloser(ch);
    }

    /**
     * True when the first non-whitespace char is a dialog opener.
     */
    public static boolean isDialogStarter(CharSequence s) {
        int idx = indexOfFirstNonWhitespace(s);
        return idx >= 0 && isDialogOpener(s.charAt(idx));
    }

    // ---------------------------------------------------------------------
    // Sentence endings (two tiers) and soft punctuation
    // ---------------------------------------------------------------------

    public static boolean isStrongSentenceEnd(char ch) {
        return ch == '。' || ch == '！' || ch == '？' || ch == '!' || ch == '?';
    }

    public static boolean containsStrongSentenceEnd(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (isStrongSentenceEnd(s.charAt(i)))
                return true;
        }
        return false;
    }

    public static boolean isClauseOrEndPunct(char ch) {
        return CLAUSE_OR_END_TABLE[ch];
    }

    public static boolean isCommaLike(char ch) {
        return COMMA_LIKE_TABLE[ch];
    }

    public static boolean containsAnyCommaLike(CharSequence s) {
        for (int i = 0; i < s.length(); i++) {
            if (isCommaLike(s.charAt(i)))
                return true;
        }
        return false;
    }

    public static boolean isColonLike(char ch) {
        return ch == '：' || ch == ':';
    }

    public static boolean endsWithColonLike(CharSequence s) {
        int idx = lastNonWhitespaceIndex(s);
        return idx >= 0 && isColonLike(s.charAt(idx));
    }

    public static boolean isMetadataSeparator(char ch) {
        return METADATA_SEPARATOR_TABLE[ch];
    }

    // ---------------------------------------------------------------------
    // Brackets
    // ---------------------------------------------------------------------

    public static boolean isBracketOpener(char ch) {
        return OPEN_BRACKET_TABLE[ch];
    }

    public static boolean isBracketCloser(char ch) {
        return CLOSE_BRACKET_TABLE[ch];
    }

    public static boolean isMatchingBracket(char open, char close) {
        return OPEN_BRACKET_TABLE[open] && BRACKET_CLOSE_BY_OPEN[open] == close;
    }

    /**
     * Closers that may follow a strong sentence end and still end the sentence: {@code ）)}.
     */
    public static boolean isAllowedPostfixCloser(char ch) {
        return ch == '）' || ch == ')';
    }

    /**
     * Depth check for a single bracket type. Unknown openers are reported as balanced.
     */
    public static boolean isBracketTypeBalanced(CharSequence s, char open) {
        if (!isBracketOpener(open))
            return true;

        char close = BRACKET_CLOSE_BY_OPEN[open];
        int depth = 0;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth < 0)
                    return false;
            }
        }

        return depth == 0;
    }

    /**
     * Stack-based bracket check: any unmatched opener, stray closer or
     * mismatched pair reports {@code true}.
     */
    public static boolean hasUnclosedBracket(CharSequence s) {
        if (s == null || s.length() == 0)
            return false;

        BracketStack stack = new BracketStack();
        stack.push(s);
        return stack.isUnbalanced();
    }

    /**
     * Incremental bracket stack. Once a stray or mismatched closer is seen the
     * stack stays unbalanced until {@link #clear()}.
     */
    public static final class BracketStack {
        private char[] stack;
        private int top;
        private boolean broken;

        public void push(CharSequence s) {
            if (s == null)
                return;

            for (int i = 0, n = s.length(); i < n && !broken; i++) {
                char ch = s.charAt(i);

                if (isBracketOpener(ch)) {
                    if (stack == null) {
                        stack = new char[16];
                    } else if (top == stack.length) {
                        char[] bigger = new char[stack.length * 2];
                        System.arraycopy(stack, 0, bigger, 0, stack.length);
                        stack = bigger;
                    }
                    stack[top++] = ch;
                    continue;
                }

                if (!isBracketCloser(ch))
                    continue;

                // stray closer
                if (top == 0) {
                    broken = true;
                    break;
                }

                // mismatch
                if (!isMatchingBracket(stack[--top], ch)) {
                    broken = true;
                }
            }
        }

        public boolean isUnbalanced() {
            return broken || top != 0;
        }

        public void clear() {
            top = 0;
            broken = false;
        }
    }

    // ---------------------------------------------------------------------
    // Layout / visual dividers
    // ---------------------------------------------------------------------

    /**
     * Detects visual separator / divider lines such as:
     * ──────
     * ======
     * ------
     * or mixed variants (e.g. ───===───).
     *
     * <p>This method is intended to run on a <b>probe</b> string
     * (indentation already removed). Whitespace is ignored.</p>
     */
    public static boolean isVisualDividerLine(CharSequence s) {
        if (s == null)
            return false;

        int total = 0;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);

            if (Character.isWhitespace(ch))
                continue;

            total++;

            // Unicode box drawing block (U+2500–U+257F)
            if (ch >= '─' && ch <= '╿')
                continue;

            // ASCII visual separators (common in TXT / OCR)
            if (ch == '-' || ch == '=' || ch == '_' || ch == '~' || ch == '～')
                continue;

            // Star / asterisk-based visual dividers
            if (ch == '*' || ch == '＊' || ch == '★' || ch == '☆')
                continue;

            return false;
        }

        // Require minimal visual length to avoid accidental triggers
        return total >= 3;
    }

    // ---------------------------------------------------------------------
    // Index helpers
    // ---------------------------------------------------------------------

    /**
     * @return index of first non-whitespace char, or -1 if none
     */
    public static int indexOfFirstNonWhitespace(CharSequence s) {
        if (s == null)
            return -1;

        for (int i = 0, n = s.length(); i < n; i++) {
            if (!Character.isWhitespace(s.charAt(i)))
                return i;
        }
        return -1;
    }

    /**
     * @return index of last non-whitespace char, or -1 if none
     */
    public static int lastNonWhitespaceIndex(CharSequence s) {
        if (s == null)
            return -1;

        for (int i = s.length() - 1; i >= 0; i--) {
            if (!Character.isWhitespace(s.charAt(i)))
                return i;
        }
        return -1;
    }

    /**
     * Previous non-whitespace index strictly before {@code beforeIndex}, or -1.
     */
    public static int prevNonWhitespaceIndex(CharSequence s, int beforeIndex) {
        if (s == null)
            return -1;

        for (int i = Math.min(beforeIndex - 1, s.length() - 1); i >= 0; i--) {
            if (!Character.isWhitespace(s.charAt(i)))
                return i;
        }
        return -1;
    }

    /**
     * Last non-whitespace char, or {@code '\0'} when there is none.
     */
    public static char lastNonWhitespace(CharSequence s) {
        int idx = lastNonWhitespaceIndex(s);
        return idx >= 0 ? s.charAt(idx) : '\0';
    }
}
