package ai.codesniff.lint.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.TokenStream;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BracketMatcherTest {

    @Test
    void linksNestedPairsBothWays() {
        TokenStream stream = match("<?php { [ ( ) ] }");

        assertThat(stream.bracketPartner(1)).isEqualTo(11);
        assertThat(stream.bracketPartner(11)).isEqualTo(1);
        assertThat(stream.bracketPartner(3)).isEqualTo(9);
        assertThat(stream.bracketPartner(5)).isEqualTo(7);
        assertThat(stream.warnings()).isEmpty();
    }

    @Test
    void mismatchedCloserPopsWithoutLinking() {
        TokenStream stream = match("<?php ( $a ]");

        assertThat(stream.bracketPartner(1)).isEqualTo(TokenStream.NONE);
        assertThat(stream.bracketPartner(5)).isEqualTo(TokenStream.NONE);
        assertThat(stream.warnings())
                .extracting(StructuralWarning::kind, StructuralWarning::tokenIndex)
                .containsExactly(tuple(StructuralWarning.Kind.MISMATCHED_BRACKET, 5));
    }

    @Test
    void closerWithoutOpenerIsReported() {
        TokenStream stream = match("<?php }");

        assertThat(stream.warnings()).singleElement()
                .satisfies(warning -> {
                    assertThat(warning.kind()).isEqualTo(StructuralWarning.Kind.UNMATCHED_CLOSER);
                    assertThat(warning.tokenIndex()).isEqualTo(1);
                });
    }

    @Test
    void unterminatedOpenerIsReported() {
        TokenStream stream = match("<?php function f() {\n    return 1;\n");

        assertThat(stream.warnings()).singleElement()
                .satisfies(warning -> {
                    assertThat(warning.kind()).isEqualTo(StructuralWarning.Kind.UNCLOSED_OPENER);
                    assertThat(stream.content(warning.tokenIndex())).isEqualTo("{");
                });
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<?php if ($a) { $b = [1, (2)]; } else { foo(); }",
            "<?php ( [ ) ] { } }",
            "<?php ((( ] } ) [ ( {",
            "<?php $x = ['a' => [1, 2], 'b' => (function () { return [3]; })()];"
    })
    void partnersAreSymmetricAndNeverCross(String source) {
        TokenStream stream = match(source);

        for (int i = 0; i < stream.size(); i++) {
            int partner = stream.bracketPartner(i);
            if (partner == TokenStream.NONE) {
                continue;
            }
            assertThat(stream.bracketPartner(partner)).isEqualTo(i);
            int from = Math.min(i, partner);
            int to = Math.max(i, partner);
            for (int inner = from + 1; inner < to; inner++) {
                int innerPartner = stream.bracketPartner(inner);
                if (innerPartner != TokenStream.NONE) {
                    assertThat(innerPartner).isStrictlyBetween(from, to);
                }
            }
        }
    }

    @Test
    void leavesNonBracketTokensAlone() {
        TokenStream stream = match("<?php $a = 1;");

        List<Integer> partners = stream.tokens().stream()
                .map(token -> token.bracketPartner().orElse(TokenStream.NONE))
                .toList();
        assertThat(partners).containsOnly(TokenStream.NONE);
    }

    private static TokenStream match(String source) {
        TokenStream stream = new PositionAnnotator(4).annotate(AnnotationFixtures.lex(source));
        return new BracketMatcher(AnnotationFixtures.PHP).annotate(stream);
    }
}
