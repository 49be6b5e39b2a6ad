package ai.codesniff.lint.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.codesniff.lint.cli.CliArguments;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--tab-width", "2",
                "--encoding", "ISO-8859-1",
                "--extensions", ".PHP,.phtml",
                "--parallel", "3",
                "--language-policy", "policy.properties",
                "--git-modified",
                "--log-format", "json",
                "src", "lib/a.php");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.paths()).containsExactly(Path.of("src"), Path.of("lib/a.php"));
        assertThat(config.tabWidth()).isEqualTo(2);
        assertThat(config.encoding()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(config.extensions()).containsExactlyInAnyOrder("php", "phtml");
        assertThat(config.parallelism()).isEqualTo(3);
        assertThat(config.languagePolicy()).contains(Path.of("policy.properties"));
        assertThat(config.gitModified()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void appliesDefaultsWhenNothingIsSet() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "src");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.tabWidth()).isEqualTo(Config.DEFAULT_TAB_WIDTH);
        assertThat(config.encoding()).isEqualTo(StandardCharsets.UTF_8);
        assertThat(config.extensions()).isEqualTo(Config.DEFAULT_EXTENSIONS);
        assertThat(config.parallelism()).isEqualTo(1);
        assertThat(config.languagePolicy()).isEmpty();
        assertThat(config.gitModified()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TAB_WIDTH, "8",
                ConfigLoader.ENV_ENCODING, "UTF-16",
                ConfigLoader.ENV_EXTENSIONS, "inc",
                ConfigLoader.ENV_PARALLEL, " 4 ",
                ConfigLoader.ENV_LOG_FORMAT, "JSON"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "src");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.tabWidth()).isEqualTo(8);
        assertThat(config.encoding()).isEqualTo(StandardCharsets.UTF_16);
        assertThat(config.extensions()).containsExactly("inc");
        assertThat(config.parallelism()).isEqualTo(4);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(environmentReader.requestedKeys()).contains(ConfigLoader.ENV_TAB_WIDTH, ConfigLoader.ENV_PARALLEL);
    }

    @Test
    void cliValuesWinOverEnvironment() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_TAB_WIDTH, "8"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--tab-width", "0", "src");

        Config config = new ConfigLoader(environmentReader).load(cliArguments);

        assertThat(config.tabWidth()).isZero();
        assertThat(environmentReader.requestedKeys()).doesNotContain(ConfigLoader.ENV_TAB_WIDTH);
    }

    @Test
    void nonNumericEnvironmentValueIsRejected() {
        RecordingEnvironmentReader environmentReader = new RecordingEnvironmentReader(Map.of(
                ConfigLoader.ENV_PARALLEL, "many"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "src");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(environmentReader).load(cliArguments));

        assertThat(thrown)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_PARALLEL);
    }

    @Test
    void unknownEncodingIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--encoding", "klingon", "src");

        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("klingon");
    }

    @Test
    void negativeTabWidthIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--tab-width=-1", "src");

        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("tabWidth");
    }

    @Test
    void zeroParallelismIsRejected() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "--parallel", "0", "src");

        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    private static final class RecordingEnvironmentReader implements EnvironmentReader {

        private final Map<String, String> values;
        private final List<String> requestedKeys = new ArrayList<>();

        private RecordingEnvironmentReader(Map<String, String> values) {
            this.values = values;
        }

        @Override
        public Optional<String> get(String key) {
            requestedKeys.add(key);
            return Optional.ofNullable(values.get(key));
        }

        List<String> requestedKeys() {
            return requestedKeys;
        }
    }
}
