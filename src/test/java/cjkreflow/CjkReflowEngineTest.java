package cjkreflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

class CjkReflowEngineTest {

    private static final String NOVEL_PAGE = String.join("\n",
            "第一章 出發",
            "天色漸漸暗了下來，他收拾好行",
            "李，準備出發。",
            "「你真的要走嗎？」她問。",
            "他點了點頭：",
            "「嗯，明天見。」",
            "──────");

    private static String novel(String text) {
        return CjkReflowEngine.reflowCjkParagraphs(text, false, false);
    }

    private static String compact(String text) {
        return CjkReflowEngine.reflowCjkParagraphs(text, false, true);
    }

    @Test
    void shortCjkLineJoinsItsContinuation() {
        assertThat(novel("今天天氣\n很好。")).isEqualTo("今天天氣很好。");
    }

    @Test
    void chapterTitleStandsAlone() {
        assertThat(novel("第一章\n很久以前……")).isEqualTo("第一章\n\n很久以前……");
    }

    @Test
    void colonLineJoinsFollowingDialog() {
        assertThat(novel("他說：\n「你好」")).isEqualTo("他說：「你好」");
    }

    @Test
    void blankLineAfterCommaIsAPageBreakArtifact() {
        String text = "他走進房間，\n\n看見了她。";

        assertThat(CjkReflowEngine.reflowCjkParagraphs(text, false)).isEqualTo("他走進房間，看見了她。");
        assertThat(CjkReflowEngine.reflowCjkParagraphs(text, true)).isEqualTo("他走進房間，\n\n看見了她。");
    }

    @Test
    void blankLineAfterSentenceEndSplitsParagraphs() {
        assertThat(novel("他走了。\n\n她留下。")).isEqualTo("他走了。\n\n她留下。");
    }

    @Test
    void mergesSoftWrappedLines() {
        assertThat(novel("他慢慢地走出了房間\n然後關上了門。")).isEqualTo("他慢慢地走出了房間然後關上了門。");
    }

    @Test
    void sentenceEndFollowedByNewLineStartsNewParagraph() {
        assertThat(novel("他走出了房間。\n然後關上了門。")).isEqualTo("他走出了房間。\n\n然後關上了門。");
    }

    @Test
    void indentationStartsNewParagraph() {
        assertThat(novel("他慢慢地走出了房間\n　　新的一段開始了。"))
                .isEqualTo("他慢慢地走出了房間\n\n　　新的一段開始了。");
        assertThat(novel("他慢慢地走出了房間\n    新的一段開始了。"))
                .isEqualTo("他慢慢地走出了房間\n\n新的一段開始了。");
    }

    @Test
    void dialogStarterOpensNewParagraphUnlessSentenceIsUnfinished() {
        assertThat(novel("他慢慢地走出了房間\n「等等我！」")).isEqualTo("他慢慢地走出了房間\n\n「等等我！」");
        assertThat(novel("他轉過身來，\n「等等我！」")).isEqualTo("他轉過身來，「等等我！」");
    }

    @Test
    void neverSplitsInsideOpenDialog() {
        String text = String.join("\n",
                "「我們走吧，",
                "",
                "他說完",
                "就走了。」",
                "下一段。");

        assertThat(CjkReflowEngine.reflowCjkParagraphs(text, true))
                .isEqualTo("「我們走吧，他說完就走了。」\n\n下一段。");
    }

    @Test
    void keepsPageMarkersOnlyWhenRequested() {
        String text = String.join("\n",
                "=== [Page 1/2] ===",
                "",
                "第一頁的內容，",
                "",
                "=== [Page 2/2] ===",
                "",
                "繼續第二頁。",
                "");

        assertThat(CjkReflowEngine.reflowCjkParagraphs(text, true, true))
                .isEqualTo("=== [Page 1/2] ===\n第一頁的內容，\n=== [Page 2/2] ===\n繼續第二頁。");
        assertThat(CjkReflowEngine.reflowCjkParagraphs(text, false, true))
                .isEqualTo("第一頁的內容，繼續第二頁。");
    }

    @Test
    void metadataLinesStayOnTheirOwn() {
        assertThat(compact("書名：三體\n作者：劉慈欣\n\n第一章\n文字。"))
                .isEqualTo("書名：三體\n作者：劉慈欣\n第一章\n文字。");
    }

    @Test
    void dividerForcesFlush() {
        List<Segment> segments = CjkReflowEngine.segment("前面的文字，\n──────\n後面的文字。", ReflowOptions.defaults());

        assertThat(segments).containsExactly(
                new Segment("前面的文字，", LineKind.PROSE),
                new Segment("──────", LineKind.VISUAL_DIVIDER),
                new Segment("後面的文字。", LineKind.PROSE));
    }

    @Test
    void bracketWrappedLineEndsParagraph() {
        assertThat(novel("他走出了房間。\n（完）")).isEqualTo("他走出了房間。\n\n（完）");
    }

    @Test
    void asciiHeadingIsEmittedImmediately() {
        assertThat(novel("Chapter One\n今天天氣很好。")).isEqualTo("Chapter One\n\n今天天氣很好。");
    }

    @Test
    void repeatedStyledHeadingIsCollapsed() {
        String text = "背负着一切的麒麟 背负着一切的麒麟 背负着一切的麒麟\n\n正文開始了。";

        assertThat(novel(text)).isEqualTo("背负着一切的麒麟\n\n正文開始了。");
    }

    @Test
    void customTitleHeadingIsHonored() {
        ReflowOptions options = ReflowOptions.builder().customTitleHeadingRegex("^Part \\d+$").build();

        List<Segment> segments = CjkReflowEngine.segment("前文結束了。\nPart 2\n後文。", options);

        assertThat(segments).extracting(Segment::getKind).containsExactly(
                LineKind.PROSE, LineKind.CUSTOM_TITLE_HEADING, LineKind.PROSE);
    }

    @Test
    void sentenceBoundaryLevelControlsColonAndSemicolon() {
        String colon = "他停了一下然後慢慢說道：\n我們明天再談這件事。";
        String semicolon = "第一項內容結束；\n第二項內容開始了。";

        ReflowOptions balanced = ReflowOptions.defaults();
        ReflowOptions strict = ReflowOptions.builder().sentenceBoundaryLevel(SentenceBoundaryLevel.STRICT).build();
        ReflowOptions lenient = ReflowOptions.builder().sentenceBoundaryLevel(1).build();

        assertThat(CjkReflowEngine.reflow(colon, balanced))
                .isEqualTo("他停了一下然後慢慢說道：\n\n我們明天再談這件事。");
        assertThat(CjkReflowEngine.reflow(colon, strict))
                .isEqualTo("他停了一下然後慢慢說道：我們明天再談這件事。");
        assertThat(CjkReflowEngine.reflow(semicolon, balanced))
                .isEqualTo("第一項內容結束；第二項內容開始了。");
        assertThat(CjkReflowEngine.reflow(semicolon, lenient))
                .isEqualTo("第一項內容結束；\n\n第二項內容開始了。");
    }

    @Test
    void reflowsNovelPageAndIsStableOnItsOwnOutput() {
        String expected = String.join("\n\n",
                "第一章 出發",
                "天色漸漸暗了下來，他收拾好行李，準備出發。",
                "「你真的要走嗎？」她問。",
                "他點了點頭：「嗯，明天見。」",
                "──────");

        String once = novel(NOVEL_PAGE);

        assertThat(once).isEqualTo(expected);
        assertThat(novel(once)).isEqualTo(once);
    }

    @Test
    void compactAndNovelDifferOnlyInSeparators() {
        String novel = novel(NOVEL_PAGE);
        String compact = compact(NOVEL_PAGE);

        assertThat(compact).doesNotContain("\n\n");
        assertThat(novel.replace("\n\n", "\n")).isEqualTo(compact);
    }

    @Test
    void keepsEveryNonWhitespaceCharacter() {
        String text = "=== [Page 1/1] ===\n" + NOVEL_PAGE + "\n\n（完）\n作者：某人\n";

        String out = CjkReflowEngine.reflowCjkParagraphs(text, true);

        assertThat(charCounts(out)).isEqualTo(charCounts(text));
    }

    @Test
    void normalizesLineEndings() {
        assertThat(novel("他走出了房間。\r\n然後關上了門。\r另一行。"))
                .isEqualTo("他走出了房間。\n\n然後關上了門。\n\n另一行。");
    }

    @Test
    void blankInputYieldsNoSegments() {
        assertThat(novel("")).isEmpty();
        assertThat(novel(" \n\n　\n")).isEmpty();
        assertThat(CjkReflowEngine.segment("\n\n", ReflowOptions.defaults())).isEmpty();
    }

    @Test
    void rejectsNullText() {
        assertThatThrownBy(() -> CjkReflowEngine.reflow(null, ReflowOptions.defaults()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void segmentsAreReadOnly() {
        List<Segment> segments = CjkReflowEngine.segment("他走了。", ReflowOptions.defaults());

        assertThatThrownBy(() -> segments.add(new Segment("x", LineKind.PROSE)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static Map<Integer, Integer> charCounts(String s) {
        Map<Integer, Integer> counts = new TreeMap<>();
        s.codePoints()
                .filter(cp -> !Character.isWhitespace(cp))
                .forEach(cp -> counts.merge(cp, 1, Integer::sum));
        return counts;
    }
}
