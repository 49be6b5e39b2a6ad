package ai.codesniff.lint.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenStream;
import org.junit.jupiter.api.Test;

class LevelAnnotatorTest {

    private static final String SOURCE = String.join("\n",
            "<?php",
            "namespace App;",
            "class Greeter {",
            "    public function greet($names) {",
            "        foreach ($names as $name) {",
            "            if ($name === '') continue;",
            "            try { echo $name; } catch (Exception $e) { log($e); }",
            "        }",
            "    }",
            "}",
            "");

    @Test
    void levelMatchesNumberOfConditions() {
        AnnotatedFile file = AnnotationFixtures.annotate(SOURCE);

        for (Token token : file.tokens()) {
            assertThat(token.level()).as(token.toString()).isEqualTo(token.conditions().size());
        }
        assertThat(file.warnings()).isEmpty();
    }

    @Test
    void conditionsListEnclosingOpenersOutermostFirst() {
        AnnotatedFile file = AnnotationFixtures.annotate(SOURCE);
        int classToken = AnnotationFixtures.indexOf(file, "class");
        int function = AnnotationFixtures.indexOf(file, "function");
        int foreach = AnnotationFixtures.indexOf(file, "foreach");
        int tryToken = AnnotationFixtures.indexOf(file, "try");

        Token echo = file.get(AnnotationFixtures.indexOf(file, "echo"));
        assertThat(echo.conditions()).containsExactly(classToken, function, foreach, tryToken);
        assertThat(echo.level()).isEqualTo(4);
        assertThat(file.get(tryToken).level()).isEqualTo(3);
        assertThat(file.get(AnnotationFixtures.indexOf(file, "{", 1)).level()).isZero();
    }

    @Test
    void conditionOpenerAndCloserShareTheOuterLevel() {
        AnnotatedFile file = AnnotationFixtures.annotate("<?php function f() { return 1; }");

        assertThat(file.get(AnnotationFixtures.indexOf(file, "function")).level()).isZero();
        assertThat(file.get(AnnotationFixtures.indexOf(file, "{")).level()).isZero();
        assertThat(file.get(AnnotationFixtures.indexOf(file, "return")).level()).isEqualTo(1);
        assertThat(file.get(AnnotationFixtures.indexOf(file, "}")).level()).isZero();
    }

    @Test
    void closerReachedWithInnerScopeOpenReportsMismatch() {
        TokenStream stream = AnnotationFixtures.lex("<?php a b c d e");
        stream.setScope(1, 1, 1, 7);
        stream.setScope(3, 3, 3, 9);

        new LevelAnnotator().annotate(stream);

        assertThat(stream.get(5).level()).isEqualTo(2);
        assertThat(stream.get(7).level()).isZero();
        assertThat(stream.get(9).conditions()).isEmpty();
        assertThat(stream.warnings()).singleElement()
                .satisfies(warning -> {
                    assertThat(warning.kind()).isEqualTo(StructuralWarning.Kind.LEVEL_MISMATCH);
                    assertThat(warning.tokenIndex()).isEqualTo(3);
                });
    }
}
