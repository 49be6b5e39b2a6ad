package ai.codesniff.lint.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ai.codesniff.lint.config.Config;
import ai.codesniff.lint.config.LogFormat;
import ai.codesniff.lint.language.LanguagePolicyLoader;
import ai.codesniff.lint.lexer.PhpLexer;
import ai.codesniff.lint.rules.RuleEngine;
import ai.codesniff.lint.rules.Severity;
import ai.codesniff.lint.rules.Sniff;
import ai.codesniff.lint.rules.SniffFile;
import ai.codesniff.lint.rules.Violation;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.tokenizer.AnnotationPipeline;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunnerTest {

    private static final AnnotationPipeline PIPELINE = new AnnotationPipeline(new PhpLexer(),
            new LanguagePolicyLoader().loadDefault("php"), 4);

    @TempDir
    Path tempDir;

    @Test
    void cleanFilesExitWithZero() throws Exception {
        write("a.php", "<?php\nfunction a() {\n    return 1;\n}\n");

        RunSummary summary = runner(1, RuleEngine.withDefaultSniffs()).run();

        assertThat(summary.reports()).hasSize(1);
        assertThat(summary.reports().get(0).violations()).isEmpty();
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_CLEAN);
    }

    @Test
    void violationsExitWithOne() throws Exception {
        write("mixed.php", "<?php\nfunction a() {}\necho a();\n");

        RunSummary summary = runner(1, RuleEngine.withDefaultSniffs()).run();

        assertThat(summary.warningCount()).isEqualTo(1);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_VIOLATIONS);
    }

    @Test
    void minifiedFileIsSkippedWithWarning() throws Exception {
        Path file = write("min.php", "<?php " + "$a=1;".repeat(100));

        FileReport report = runner(1, RuleEngine.withDefaultSniffs()).check(file);

        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.severity()).isEqualTo(Severity.WARNING);
            assertThat(violation.source()).isEqualTo(Runner.MINIFIED);
        });
        assertThat(report.failed()).isFalse();
    }

    @Test
    void ignoredFileReportsNothing() throws Exception {
        Path file = write("skip.php", "<?php\n// lint:ignoreFile\nfunction a() {}\necho 1;\n");

        assertThat(runner(1, RuleEngine.withDefaultSniffs()).check(file).violations()).isEmpty();
    }

    @Test
    void crashingSniffMarksFileAsFailed() throws Exception {
        write("a.php", "<?php\necho 1;\n");
        Sniff failing = new Sniff() {
            @Override
            public String name() {
                return "Test.Failing";
            }

            @Override
            public Set<TokenKind> register() {
                return Set.of(TokenKind.ECHO);
            }

            @Override
            public int process(SniffFile file, int stackPtr) {
                throw new IllegalStateException("boom");
            }
        };

        RunSummary summary = runner(1, new RuleEngine(List.of(failing))).run();

        assertThat(summary.reports().get(0).failed()).isTrue();
        assertThat(summary.reports().get(0).violations())
                .extracting(Violation::source)
                .containsExactly(Runner.INTERNAL_EXCEPTION);
        assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PROCESSING_ERROR);
    }

    @Test
    void parallelRunKeepsCollectionOrder() throws Exception {
        for (int i = 0; i < 6; i++) {
            write("f" + i + ".php", "<?php\nfunction f" + i + "() {}\n" + (i % 2 == 0 ? "echo 1;\n" : ""));
        }

        RunSummary summary = runner(3, RuleEngine.withDefaultSniffs()).run();

        assertThat(summary.reports())
                .extracting(report -> report.path().getFileName().toString())
                .containsExactly("f0.php", "f1.php", "f2.php", "f3.php", "f4.php", "f5.php");
        assertThat(summary.warningCount()).isEqualTo(3);
    }

    @Test
    void missingPathFailsTheRun() {
        Config config = config(List.of(tempDir.resolve("absent")), 1);

        assertThatThrownBy(() -> new Runner(config, PIPELINE, RuleEngine.withDefaultSniffs()).run())
                .isInstanceOf(IllegalArgumentException.class);
    }

    private Runner runner(int parallelism, RuleEngine engine) {
        return new Runner(config(List.of(tempDir), parallelism), PIPELINE, engine);
    }

    private static Config config(List<Path> paths, int parallelism) {
        return new Config(paths, 4, StandardCharsets.UTF_8, Set.of(), parallelism, Optional.empty(), false,
                LogFormat.TEXT);
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
