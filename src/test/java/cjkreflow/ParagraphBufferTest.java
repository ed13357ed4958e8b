package cjkreflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ParagraphBufferTest {

    @Test
    void flushResetsAllState() {
        ParagraphBuffer buffer = new ParagraphBuffer();
        buffer.append("「他拿起（");

        assertThat(buffer.isDialogUnclosed()).isTrue();
        assertThat(buffer.hasUnclosedBracket()).isTrue();

        Segment segment = buffer.flush();

        assertThat(segment).isEqualTo(new Segment("「他拿起（", LineKind.PROSE));
        assertThat(buffer.isEmpty()).isTrue();
        assertThat(buffer.isDialogUnclosed()).isFalse();
        assertThat(buffer.hasUnclosedBracket()).isFalse();
        assertThat(buffer.flush()).isNull();
    }

    @Test
    void headingSeedFlushesAsHeadingUntilContinued() {
        ParagraphBuffer seeded = new ParagraphBuffer();
        seeded.seedHeading("序幕");
        assertThat(seeded.flush().getKind()).isEqualTo(LineKind.SHORT_HEADING);

        ParagraphBuffer continued = new ParagraphBuffer();
        continued.seedHeading("今天天氣");
        continued.append("很好。");
        assertThat(continued.isHeadingSeed()).isFalse();
        assertThat(continued.flush()).isEqualTo(new Segment("今天天氣很好。", LineKind.PROSE));
    }

    @Test
    void seedRequiresEmptyBuffer() {
        ParagraphBuffer buffer = new ParagraphBuffer();
        buffer.append("正文");

        assertThatThrownBy(() -> buffer.seedHeading("標題")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void reportsTrailingPunctuation() {
        ParagraphBuffer buffer = new ParagraphBuffer();
        buffer.append("他說：");
        assertThat(buffer.endsWithColonLike()).isTrue();
        assertThat(buffer.lastNonWhitespace()).isEqualTo('：');

        buffer.append("好，");
        assertThat(buffer.endsWithCommaLike()).isTrue();
    }
}
