package ai.codesniff.lint.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class NestingLevelSniffTest {

    @Test
    void nestingAtLimitPasses() {
        assertThat(SniffFixtures.check(new NestingLevelSniff(), function(5))).isEmpty();
    }

    @Test
    void nestingAboveWarningLimitIsWarned() {
        List<Violation> violations = SniffFixtures.check(new NestingLevelSniff(), function(6));

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.severity()).isEqualTo(Severity.WARNING);
            assertThat(violation.source()).isEqualTo("Generic.Metrics.NestingLevel.TooHigh");
            assertThat(violation.line()).isEqualTo(2);
            assertThat(violation.message()).startsWith("Function's nesting level (6) exceeds 5");
        });
    }

    @Test
    void nestingAboveAbsoluteLimitIsAnError() {
        List<Violation> violations = SniffFixtures.check(new NestingLevelSniff(), function(11));

        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.severity()).isEqualTo(Severity.ERROR);
            assertThat(violation.source()).isEqualTo("Generic.Metrics.NestingLevel.MaxExceeded");
        });
    }

    @Test
    void methodNestingIsMeasuredFromItsOwnLevel() {
        String source = "<?php\nclass A {\n    public function run() {\n        if ($a) { if ($b) { x(); } }\n    }\n}\n";

        List<Violation> violations = SniffFixtures.check(new NestingLevelSniff(1, 3), source);

        assertThat(violations).singleElement()
                .extracting(Violation::message)
                .asString()
                .startsWith("Function's nesting level (2) exceeds 1");
    }

    @Test
    void abstractDeclarationIsIgnored() {
        String source = "<?php\nabstract class A {\n    abstract function run();\n}\n";

        assertThat(SniffFixtures.check(new NestingLevelSniff(1, 1), source)).isEmpty();
    }

    @Test
    void rejectsInconsistentLimits() {
        assertThatThrownBy(() -> new NestingLevelSniff(5, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    private static String function(int depth) {
        return "<?php\nfunction f($a) {\n"
                + "if ($a) {\n".repeat(depth)
                + "x();\n"
                + "}\n".repeat(depth)
                + "}\n";
    }
}
