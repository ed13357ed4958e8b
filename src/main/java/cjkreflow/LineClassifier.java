package cjkreflow;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Ordered, first-match-wins line classification.
 *
 * <ol>
 *   <li>visual divider (on the probe form)</li>
 *   <li>style-repeat collapse, before any further check</li>
 *   <li>empty</li>
 *   <li>page marker</li>
 *   <li>custom title pattern, then the built-in title pattern</li>
 *   <li>metadata line</li>
 *   <li>short heading</li>
 *   <li>bracket-wrapped structural line</li>
 *   <li>prose</li>
 * </ol>
 *
 * <p>Short headings and bracket-wrapped lines are weak: when the paragraph
 * currently being assembled is unsafe to end here they are downgraded to
 * {@link LineKind#PROSE}.</p>
 */
public final class LineClassifier {

    private final ShortHeadingSettings shortHeading;
    private final Pattern customTitleHeading;

    public LineClassifier(ReflowOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.shortHeading = options.getShortHeading();
        this.customTitleHeading = options.getCustomTitleHeading();
    }

    /**
     * Classifies a line with no open paragraph before it.
     */
    public ClassifiedLine classify(String rawLine) {
        return classify(rawLine, null);
    }

    /**
     * @param rawLine one input row, without its line terminator
     * @param buffer  the paragraph being assembled, or {@code null} when there is none
     */
    public ClassifiedLine classify(String rawLine, ParagraphBuffer buffer) {
        Line line = Line.of(rawLine);

        // Absolute structural rule: must be first (run on probe, output stripped)
        if (PunctSets.isVisualDividerLine(line.getProbe()))
            return new ClassifiedLine(LineKind.VISUAL_DIVIDER, line);

        line = line.withStripped(RepeatCollapser.collapse(line.getStripped()));
        String probe = line.getProbe();

        if (line.isEmpty())
            return new ClassifiedLine(LineKind.EMPTY, line);

        if (line.isPageMarker())
            return new ClassifiedLine(LineKind.PAGE_MARKER, line);

        // user intent over built-in heuristics
        if (TitleHeadingRules.isCustomTitleHeading(probe, customTitleHeading))
            return new ClassifiedLine(LineKind.CUSTOM_TITLE_HEADING, line);

        if (TitleHeadingRules.isTitleHeading(probe))
            return new ClassifiedLine(LineKind.TITLE_HEADING, line);

        if (MetadataRules.isMetadataLine(line.getStripped()))
            return new ClassifiedLine(LineKind.METADATA, line);

        if (isHeadingLike(probe, shortHeading))
            return weak(LineKind.SHORT_HEADING, line, buffer);

        if (SentenceBoundary.endsWithCjkBracketBoundary(probe))
            return weak(LineKind.BRACKET_STRUCTURAL, line, buffer);

        return new ClassifiedLine(LineKind.PROSE, line);
    }

    private static ClassifiedLine weak(LineKind kind, Line line, ParagraphBuffer buffer) {
        if (canStandAlone(line, buffer))
            return new ClassifiedLine(kind, line);
        return new ClassifiedLine(LineKind.PROSE, line);
    }

    /**
     * Whether a weak structural line may end the current paragraph. Only the
     * buffer's trailing char is inspected, not deeper context.
     */
    static boolean canStandAlone(Line line, ParagraphBuffer buffer) {
        if (buffer == null || buffer.isEmpty())
            return true;

        // previous paragraph is "unsafe" -> must treat as continuation
        if (buffer.hasUnclosedBracket() || buffer.isDialogUnclosed())
            return false;

        char last = buffer.lastNonWhitespace();
        if (last == '\0')
            return true;

        // previous ends with comma -> continuation
        if (PunctSets.isCommaLike(last))
            return false;

        // all-CJK (or colon item) line + previous sentence not ended -> continuation
        String text = line.getProbe();
        boolean cjkLike = CjkText.isAllCjkIgnoringWhitespace(text) || PunctSets.endsWithColonLike(text);
        return !cjkLike || PunctSets.isClauseOrEndPunct(last);
    }

    /**
     * Pure short-heading test on a single line, without buffer context.
     */
    public static boolean isHeadingLike(String s, ShortHeadingSettings sh) {
        if (s == null)
            return false;

        s = s.trim();
        if (s.isEmpty())
            return false;

        // keep page markers intact
        if (s.startsWith("=== ") && s.endsWith("==="))
            return false;

        // Reject headings with unclosed brackets
        if (PunctSets.hasUnclosedBracket(s))
            return false;

        final int baseMax = sh.getMaxLen();
        final int len = s.length();
        final char last = s.charAt(len - 1);

        // Short circuit for item title-like: "物品准备："
        if (PunctSets.isColonLike(last) && len <= baseMax
                && CjkText.isAllCjkNoWhiteSpace(s.substring(0, len - 1)))
            return true;

        if (PunctSets.isClauseOrEndPunct(last))
            return false;

        // Reject any short line containing comma-like separators
        if (PunctSets.containsAnyCommaLike(s))
            return false;

        final boolean allAscii = CjkText.isAllAscii(s);
        final boolean mixed = CjkText.isMixedCjkAscii(s);

        // ASCII headings can be longer
        int effectiveMax = baseMax;
        if ((sh.isAllAscii() && allAscii) || (sh.isMixedCjkAscii() && mixed)) {
            effectiveMax = Math.max(10, Math.min(30, baseMax * 2));
        }

        if (len > effectiveMax)
            return false;

        if (PunctSets.containsStrongSentenceEnd(s))
            return false;

        return (sh.isAllAscii() && allAscii && hasLetterOrDigit(s))
                || (sh.isAllCjk() && CjkText.isAllCjkNoWhiteSpace(s))
                || (sh.isAllAsciiDigits() && CjkText.isAllAsciiDigits(s))
                || (sh.isMixedCjkAscii() && mixed);
    }

    private static boolean hasLetterOrDigit(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLetterOrDigit(s.charAt(i)))
                return true;
        }
        return false;
    }
}
