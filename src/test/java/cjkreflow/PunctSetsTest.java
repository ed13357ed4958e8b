package cjkreflow;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class PunctSetsTest {

    @Test
    void unclosedBracketCoversOpenerStrayAndMismatch() {
        assertThat(PunctSets.hasUnclosedBracket("（未完")).isTrue();
        assertThat(PunctSets.hasUnclosedBracket("完）")).isTrue();
        assertThat(PunctSets.hasUnclosedBracket("（甲]")).isTrue();
        assertThat(PunctSets.hasUnclosedBracket("（完）《書》")).isFalse();
        assertThat(PunctSets.hasUnclosedBracket("plain text")).isFalse();
    }

    @Test
    void bracketStackTracksAcrossFragments() {
        PunctSets.BracketStack stack = new PunctSets.BracketStack();

        stack.push("他（");
        assertThat(stack.isUnbalanced()).isTrue();

        stack.push("笑）了");
        assertThat(stack.isUnbalanced()).isFalse();

        stack.push("】");
        stack.push("【");
        assertThat(stack.isUnbalanced()).as("stray closer is sticky").isTrue();

        stack.clear();
        assertThat(stack.isUnbalanced()).isFalse();
    }

    @Test
    void bracketTypeBalanceCountsDepth() {
        assertThat(PunctSets.isBracketTypeBalanced("（甲）（乙）", '（')).isTrue();
        assertThat(PunctSets.isBracketTypeBalanced("（（甲）", '（')).isFalse();
        assertThat(PunctSets.isBracketTypeBalanced("anything", 'x')).isTrue();
    }

    @Test
    void visualDividersNeedThreeMarks() {
        assertThat(PunctSets.isVisualDividerLine("──────")).isTrue();
        assertThat(PunctSets.isVisualDividerLine("= = =")).isTrue();
        assertThat(PunctSets.isVisualDividerLine("＊＊＊")).isTrue();
        assertThat(PunctSets.isVisualDividerLine("--")).isFalse();
        assertThat(PunctSets.isVisualDividerLine("--a")).isFalse();
    }

    @Test
    void dialogStarterSkipsFullWidthIndent() {
        assertThat(PunctSets.isDialogStarter("　　「你好")).isTrue();
        assertThat(PunctSets.isDialogStarter("他說「你好")).isFalse();
        assertThat(PunctSets.isDialogStarter("")).isFalse();
    }

    @Test
    void punctuationTiers() {
        assertThat(PunctSets.isStrongSentenceEnd('。')).isTrue();
        assertThat(PunctSets.isStrongSentenceEnd('；')).isFalse();
        assertThat(PunctSets.isClauseOrEndPunct('；')).isTrue();
        assertThat(PunctSets.isClauseOrEndPunct('」')).isTrue();
        assertThat(PunctSets.isClauseOrEndPunct('，')).isFalse();
        assertThat(PunctSets.isCommaLike('、')).isTrue();
        assertThat(PunctSets.endsWithColonLike("物品： ")).isTrue();
    }

    @Test
    void indexHelpers() {
        assertThat(PunctSets.lastNonWhitespaceIndex("ab  ")).isEqualTo(1);
        assertThat(PunctSets.prevNonWhitespaceIndex("a b", 2)).isEqualTo(0);
        assertThat(PunctSets.lastNonWhitespace("   ")).isEqualTo('\0');
    }
}
