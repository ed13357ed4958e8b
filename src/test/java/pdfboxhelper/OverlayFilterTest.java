package pdfboxhelper;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class OverlayFilterTest {

    private final OverlayFilter filter = new OverlayFilter();

    @Test
    void dropsTextRepeatedInOneBand() {
        List<TextObjectFragment> page = new ArrayList<>();
        page.add(filter.fragment("第一行正文", 100f));
        for (int i = 0; i < 5; i++) {
            page.add(filter.fragment("CONFIDENTIAL", 300f + i * 0.5f));
        }
        page.add(filter.fragment("第二行正文", 120f));

        String text = filter.filterPage(page);

        assertThat(text).isEqualTo("第一行正文\n第二行正文");
    }

    @Test
    void keepsRepeatsBelowThresholdOrInDifferentBands() {
        List<TextObjectFragment> sameBand = Arrays.asList(
                filter.fragment("頁眉", 40f),
                filter.fragment("頁眉", 41f),
                filter.fragment("頁眉", 42f));
        List<TextObjectFragment> spread = Arrays.asList(
                filter.fragment("CONFIDENTIAL", 100f),
                filter.fragment("CONFIDENTIAL", 200f),
                filter.fragment("CONFIDENTIAL", 300f),
                filter.fragment("CONFIDENTIAL", 400f));

        assertThat(filter.filter(sameBand)).hasSize(3);
        assertThat(filter.filter(spread)).hasSize(4);
    }

    @Test
    void countsWhitespaceVariantsAsTheSameText() {
        List<TextObjectFragment> page = Arrays.asList(
                filter.fragment("CONFIDENTIAL ", 300f),
                filter.fragment(" CONFIDENTIAL", 300f),
                filter.fragment("CONFIDENTIAL", 301f),
                filter.fragment("CONFIDENTIAL\t", 302f),
                filter.fragment("正文", 500f));

        assertThat(filter.filter(page)).extracting(TextObjectFragment::getText).containsExactly("正文");
    }

    @Test
    void detectsTiledSingleWordWatermarks() {
        assertThat(filter.isTiledWatermark("DRAFT DRAFT DRAFT DRAFT DRAFT DRAFT")).isTrue();
        assertThat(filter.isTiledWatermark("DRAFT DRAFT DRAFT DRAFT DRAFT note")).isTrue();
        assertThat(filter.isTiledWatermark("DRAFT DRAFT DRAFT")).isFalse();
        assertThat(filter.isTiledWatermark("a b c d e f")).isFalse();
    }

    @Test
    void joinsJitteredFragmentsOnOneLine() {
        List<TextObjectFragment> page = Arrays.asList(
                filter.fragment("他說", 103.9f),
                filter.fragment("「", 104.1f),
                filter.fragment("你好」", 103f));

        assertThat(filter.filterPage(page)).isEqualTo("他說「你好」");
    }

    @Test
    void breaksLinesAtTwelvePointLeadingAcrossNeighbouringBands() {
        TextObjectFragment heading = filter.fragment("第一章", 104f);
        TextObjectFragment body = filter.fragment("很久以前，有一個人。", 116f);
        assertThat(body.getBucket() - heading.getBucket()).isEqualTo(1);

        List<TextObjectFragment> page = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            page.add(filter.fragment("第" + (i + 1) + "行", 104f + i * 12f));
        }

        assertThat(filter.filterPage(Arrays.asList(heading, body))).isEqualTo("第一章\n很久以前，有一個人。");
        assertThat(filter.filterPage(page)).isEqualTo("第1行\n第2行\n第3行\n第4行\n第5行\n第6行");
    }

    @Test
    void lineJitterIsConfigurable() {
        OverlayFilter loose = new OverlayFilter(new OverlayFilterOptions(8f, 4, 6, 12, 15f));
        List<TextObjectFragment> page = Arrays.asList(
                loose.fragment("上一行", 104f),
                loose.fragment("下一行", 116f));

        assertThat(loose.filterPage(page)).isEqualTo("上一行下一行");
        assertThat(OverlayFilterOptions.defaults().getLineJitter()).isEqualTo(3f);
    }

    @Test
    void separatesLatinWordsWithOneSpace() {
        List<TextObjectFragment> page = Arrays.asList(
                filter.fragment("Hello", 50f),
                filter.fragment("world", 50f),
                filter.fragment("中文", 50f),
                filter.fragment("OK", 50f));

        assertThat(filter.filterPage(page)).isEqualTo("Hello world中文OK");
    }

    @Test
    void skipsBlankFragments() {
        List<TextObjectFragment> page = Arrays.asList(
                filter.fragment("   ", 50f),
                filter.fragment("正文", 50f));

        assertThat(filter.filterPage(page)).isEqualTo("正文");
        assertThat(filter.filterPage(new ArrayList<>())).isEmpty();
    }

    @Test
    void rejectsInvalidOptions() {
        assertThatThrownBy(() -> new OverlayFilterOptions(0f, 4, 6, 12, 3f))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OverlayFilterOptions(8f, 1, 6, 12, 3f))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextObjectFragment("x", 10f, -1f))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void customThresholdIsApplied() {
        OverlayFilter strict = new OverlayFilter(new OverlayFilterOptions(8f, 2, 6, 12, 3f));

        List<TextObjectFragment> page = Arrays.asList(
                strict.fragment("頁眉", 40f),
                strict.fragment("頁眉", 41f),
                strict.fragment("正文", 80f));

        assertThat(strict.filterPage(page)).isEqualTo("正文");
    }
}
