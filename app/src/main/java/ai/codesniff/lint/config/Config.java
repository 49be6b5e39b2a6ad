package ai.codesniff.lint.config;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable representation of the run configuration assembled from CLI arguments and environment values.
 *
 * @param tabWidth       columns per tab stop; {@code 0} keeps tabs as single columns
 * @param languagePolicy a policy table to load instead of the bundled one
 * @param gitModified    only check files git reports as modified, added or untracked
 */
public record Config(
        List<Path> paths,
        int tabWidth,
        Charset encoding,
        Set<String> extensions,
        int parallelism,
        Optional<Path> languagePolicy,
        boolean gitModified,
        LogFormat logFormat
) {

    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final Set<String> DEFAULT_EXTENSIONS = Set.of("php", "inc");

    public Config {
        paths = paths == null ? List.of() : List.copyOf(paths);
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("At least one file or directory must be given");
        }
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must be zero or greater");
        }
        Objects.requireNonNull(encoding, "encoding");
        extensions = extensions == null || extensions.isEmpty()
                ? DEFAULT_EXTENSIONS
                : extensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (extensions.isEmpty()) {
            extensions = DEFAULT_EXTENSIONS;
        }
        extensions = Set.copyOf(extensions);
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be greater than zero");
        }
        languagePolicy = languagePolicy == null ? Optional.empty() : languagePolicy;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    private static String normalizeExtension(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }
}
