package ai.codesniff.lint.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codesniff.lint.config.ConfigLoader;
import ai.codesniff.lint.language.LanguagePolicyLoader;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    @Test
    void cleanRunExitsWithZero() throws Exception {
        Path file = Files.writeString(tempDir.resolve("clean.php"), "<?php\nfunction a() {\n    return 1;\n}\n");

        int exitCode = run(file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Checked 1 file: 0 errors, 0 warnings");
    }

    @Test
    void violationsExitWithOneAndArePrinted() throws Exception {
        Files.writeString(tempDir.resolve("mixed.php"), "<?php\nfunction a() {}\necho a();\n");

        int exitCode = run("--tab-width", "2", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
                .contains("FOUND 1 WARNING AFFECTING 1 LINE")
                .contains("PSR1.Files.SideEffects.FoundWithSymbols");
    }

    @Test
    void customLanguagePolicyIsUsed() throws Exception {
        Path policy = Files.writeString(tempDir.resolve("tiny.properties"), String.join("\n",
                "name=tiny",
                "brackets=OPEN_CURLY_BRACKET:CLOSE_CURLY_BRACKET"));
        Path file = Files.writeString(tempDir.resolve("a.php"), "<?php\n$a = (1;\n");

        int exitCode = run("--language-policy", policy.toString(), file.toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void invalidLanguagePolicyIsAConfigurationError() throws Exception {
        Path policy = Files.writeString(tempDir.resolve("bad.properties"), "name=bad\nscope.openers=NOPE\n");
        Path file = Files.writeString(tempDir.resolve("a.php"), "<?php\n");

        int exitCode = run("--language-policy", policy.toString(), file.toString());

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("Configuration error").contains("NOPE");
    }

    @Test
    void missingPathExitsWithProcessingError() {
        int exitCode = run(tempDir.resolve("absent.php").toString());

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("Path does not exist");
    }

    @Test
    void unknownOptionPrintsUsage() {
        int exitCode = run("--frobnicate", "a.php");

        assertThat(exitCode).isEqualTo(3);
        assertThat(err.toString()).contains("Unknown option").contains("Usage: codesniff");
    }

    @Test
    void helpIsPrintedToStandardOut() {
        int exitCode = run("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Usage: codesniff").contains("--git-modified");
    }

    private int run(String... args) {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                new LanguagePolicyLoader());
        CommandLine commandLine = new CommandLine(new CliArguments());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return application.run(commandLine, args);
    }
}
