package ai.codesniff.lint.config;

import ai.codesniff.lint.cli.CliArguments;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_TAB_WIDTH = "LINT_TAB_WIDTH";
    static final String ENV_ENCODING = "LINT_ENCODING";
    static final String ENV_EXTENSIONS = "LINT_EXTENSIONS";
    static final String ENV_PARALLEL = "LINT_PARALLEL";
    static final String ENV_LOG_FORMAT = "LINT_LOG_FORMAT";

    private static final int DEFAULT_PARALLELISM = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        int tabWidth = Optional.ofNullable(arguments.tabWidth())
                .or(() -> environment(ENV_TAB_WIDTH).map(raw -> parseInteger(raw, ENV_TAB_WIDTH)))
                .orElse(Config.DEFAULT_TAB_WIDTH);

        Charset encoding = Optional.ofNullable(arguments.encoding())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environment(ENV_ENCODING))
                .map(ConfigLoader::parseCharset)
                .orElse(StandardCharsets.UTF_8);

        Set<String> extensions = Optional.ofNullable(arguments.extensions())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environment(ENV_EXTENSIONS))
                .map(ConfigLoader::parseExtensions)
                .orElse(Config.DEFAULT_EXTENSIONS);

        int parallelism = Optional.ofNullable(arguments.parallel())
                .or(() -> environment(ENV_PARALLEL).map(raw -> parseInteger(raw, ENV_PARALLEL)))
                .orElse(DEFAULT_PARALLELISM);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environment(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);

        List<Path> paths = arguments.paths();
        return new Config(paths, tabWidth, encoding, extensions, parallelism,
                Optional.ofNullable(arguments.languagePolicy()), arguments.gitModified(), logFormat);
    }

    private Optional<String> environment(String key) {
        return environmentReader.get(key).map(String::trim).filter(ConfigLoader::isNotBlank);
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static Charset parseCharset(String raw) {
        try {
            return Charset.forName(raw.trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            throw new IllegalArgumentException("Unknown encoding: " + raw, ex);
        }
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
