package cjkreflow;

/**
 * Incremental quote tracker for the paragraph currently being assembled.
 *
 * <p>One counter per quote family. Counters are updated only with the newly
 * appended fragment and never rescan earlier text; they are cleared by
 * {@link #reset()} when the owning paragraph is flushed.</p>
 */
public final class DialogState {

    // “ ”
    private int doubleQuote;
    // ‘ ’
    private int singleQuote;
    // 「 」
    private int corner;
    // 『 』
    private int cornerBold;
    // ﹁ ﹂
    private int cornerTop;
    // ﹃ ﹄
    private int cornerWide;

    public void reset() {
        doubleQuote = 0;
        singleQuote = 0;
        corner = 0;
        cornerBold = 0;
        cornerTop = 0;
        cornerWide = 0;
    }

    public void update(CharSequence s) {
        if (s == null || s.length() == 0) return;

        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '“':
                    doubleQuote++;
                    break;
                case '”':
                    if (doubleQuote > 0) doubleQuote--;
                    break;

                case '‘':
                    singleQuote++;
                    break;
                case '’':
                    if (singleQuote > 0) singleQuote--;
                    break;

                case '「':
                    corner++;
                    break;
                case '」':
                    if (corner > 0) corner--;
                    break;

                case '『':
                    cornerBold++;
                    break;
                case '』':
                    if (cornerBold > 0) cornerBold--;
                    break;

                case '﹁':
                    cornerTop++;
                    break;
                case '﹂':
                    if (cornerTop > 0) cornerTop--;
                    break;

                case '﹃':
                    cornerWide++;
                    break;
                case '﹄':
                    if (cornerWide > 0) cornerWide--;
                    break;

                default:
                    break;
            }
        }
    }

    public boolean isUnclosed() {
        return doubleQuote > 0
                || singleQuote > 0
                || corner > 0
                || cornerBold > 0
                || cornerTop > 0
                || cornerWide > 0;
    }
}
