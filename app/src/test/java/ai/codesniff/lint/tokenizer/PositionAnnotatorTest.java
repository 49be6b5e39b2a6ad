package ai.codesniff.lint.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.token.TokenStream;
import org.junit.jupiter.api.Test;

class PositionAnnotatorTest {

    @Test
    void assignsLinesAndColumns() {
        TokenStream stream = new PositionAnnotator(4).annotate(AnnotationFixtures.lex("<?php\n$a = 1;\n  echo $a;\n"));

        Token variable = stream.get(1);
        assertThat(variable.kind()).isEqualTo(TokenKind.VARIABLE);
        assertThat(variable.line()).isEqualTo(2);
        assertThat(variable.column()).isEqualTo(1);

        Token echo = find(stream, "echo");
        assertThat(echo.line()).isEqualTo(3);
        assertThat(echo.column()).isEqualTo(3);
        assertThat(echo.length()).isEqualTo(4);
    }

    @Test
    void lengthExcludesLineTerminator() {
        TokenStream stream = new PositionAnnotator(4).annotate(AnnotationFixtures.lex("<?php\r\n// note\r\n$a;"));

        Token comment = find(stream, "// note\r\n");
        assertThat(comment.line()).isEqualTo(2);
        assertThat(comment.length()).isEqualTo(7);
        assertThat(find(stream, "$a").line()).isEqualTo(3);
    }

    @Test
    void expandsLeadingTabsToNextTabStop() {
        TokenStream stream = new PositionAnnotator(4).annotate(AnnotationFixtures.lex("<?php\n\tif ($x) {}\n"));

        Token indent = stream.get(1);
        assertThat(indent.content()).isEqualTo("    ");
        assertThat(indent.originalContent()).contains("\t");
        assertThat(indent.length()).isEqualTo(4);
        assertThat(find(stream, "if").column()).isEqualTo(5);
    }

    @Test
    void zeroTabWidthKeepsTabsAsSingleColumns() {
        TokenStream stream = new PositionAnnotator(0).annotate(AnnotationFixtures.lex("<?php\n\tif ($x) {}\n"));

        Token indent = stream.get(1);
        assertThat(indent.content()).isEqualTo("\t");
        assertThat(indent.originalContent()).isEmpty();
        assertThat(find(stream, "if").column()).isEqualTo(2);
    }

    @Test
    void replaceTabsAlignsToStopsFromStartColumn() {
        assertThat(PositionAnnotator.replaceTabs("a\tb", 1, 4))
                .isEqualTo(new PositionAnnotator.Expansion("a   b", 5));
        assertThat(PositionAnnotator.replaceTabs("\t", 4, 4))
                .isEqualTo(new PositionAnnotator.Expansion(" ", 1));
        assertThat(PositionAnnotator.replaceTabs("\t\t", 1, 4))
                .isEqualTo(new PositionAnnotator.Expansion("        ", 8));
        assertThat(PositionAnnotator.replaceTabs("x\t", 3, 4))
                .isEqualTo(new PositionAnnotator.Expansion("x ", 2));
    }

    @Test
    void replaceTabsTreatsZeroWidthAsOne() {
        assertThat(PositionAnnotator.replaceTabs("\ta", 1, 0).content()).isEqualTo(" a");
    }

    @Test
    void rejectsNegativeTabWidth() {
        assertThatThrownBy(() -> new PositionAnnotator(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Token find(TokenStream stream, String content) {
        return stream.tokens().stream()
                .filter(token -> token.content().equals(content))
                .findFirst()
                .orElseThrow();
    }
}
