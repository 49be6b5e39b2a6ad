package ai.codesniff.lint.language;

import ai.codesniff.lint.token.TokenKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a {@link LanguagePolicy} from a {@code .properties} table.
 *
 * <p>Bundled tables live on the classpath under {@code languages/<name>.properties}; a user-supplied table
 * uses the same keys.
 */
public class LanguagePolicyLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LanguagePolicyLoader.class);

    static final String KEY_NAME = "name";
    static final String KEY_BRACKETS = "brackets";
    static final String KEY_PARENTHESIS_OWNERS = "parenthesis.owners";
    static final String KEY_DECLARATION_OWNERS = "parenthesis.declaration-owners";
    static final String KEY_SCOPE_OPENERS = "scope.openers";
    static final String KEY_END_SCOPE_TOKENS = "scope.end-tokens";
    static final String KEY_STATEMENT_TERMINATORS = "statement.terminators";
    static final String KEY_NON_SCOPE_BRACE_PREDECESSORS = "scope.non-opening-brace-predecessors";
    static final String KEY_LINE_LIMIT = "scope.opener-search-line-limit";
    static final String KEY_CLOSING_OWNER = "scope.closing-owner";
    static final String KEY_AMBIGUITY_THRESHOLD = "scope.ambiguous-shared-closer-threshold";

    private static final String RESOURCE_TEMPLATE = "languages/%s.properties";

    public LanguagePolicy loadDefault(String language) {
        Objects.requireNonNull(language, "language");
        String resource = String.format(Locale.ROOT, RESOURCE_TEMPLATE, language.toLowerCase(Locale.ROOT));
        ClassLoader classLoader = LanguagePolicyLoader.class.getClassLoader();
        try (InputStream input = classLoader.getResourceAsStream(resource)) {
            if (input == null) {
                throw new InvalidPolicyException("No bundled language policy for " + language);
            }
            Properties properties = new Properties();
            properties.load(new InputStreamReader(input, StandardCharsets.UTF_8));
            LOGGER.debug("Loaded bundled language policy {}", resource);
            return parse(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read language policy " + resource, ex);
        }
    }

    public LanguagePolicy load(Path file) {
        Objects.requireNonNull(file, "file");
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Properties properties = new Properties();
            properties.load(reader);
            LOGGER.debug("Loaded language policy from {}", file);
            return parse(properties);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read language policy " + file, ex);
        }
    }

    public LanguagePolicy parse(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        String name = value(properties, KEY_NAME)
                .orElseThrow(() -> new InvalidPolicyException("Language policy must declare '" + KEY_NAME + "'"));
        LanguagePolicy.Builder builder = LanguagePolicy.builder(name);

        value(properties, KEY_BRACKETS).ifPresent(raw -> {
            for (String pair : raw.split(",")) {
                if (pair.isBlank()) {
                    continue;
                }
                String[] parts = pair.split(":");
                if (parts.length != 2) {
                    throw new InvalidPolicyException("Bracket pair must look like OPENER:CLOSER but was '" + pair.trim() + "'");
                }
                builder.bracket(kind(parts[0], KEY_BRACKETS), kind(parts[1], KEY_BRACKETS));
            }
        });

        builder.parenthesisOwners(kinds(properties, KEY_PARENTHESIS_OWNERS));
        builder.declarationOwners(kinds(properties, KEY_DECLARATION_OWNERS));
        builder.endScopeTokens(kinds(properties, KEY_END_SCOPE_TOKENS));
        builder.statementTerminators(kinds(properties, KEY_STATEMENT_TERMINATORS));
        builder.nonScopeBracePredecessors(kinds(properties, KEY_NON_SCOPE_BRACE_PREDECESSORS));

        for (TokenKind opener : kinds(properties, KEY_SCOPE_OPENERS)) {
            builder.scopeOpener(scopeRule(properties, opener));
        }

        value(properties, KEY_LINE_LIMIT)
                .map(raw -> integer(raw, KEY_LINE_LIMIT))
                .ifPresent(builder::openerSearchLineLimit);
        value(properties, KEY_CLOSING_OWNER)
                .map(ClosingOwnerPolicy::from)
                .ifPresent(builder::closingOwnerPolicy);
        value(properties, KEY_AMBIGUITY_THRESHOLD)
                .map(raw -> integer(raw, KEY_AMBIGUITY_THRESHOLD))
                .ifPresent(builder::ambiguousSharedCloserThreshold);

        return builder.build();
    }

    private ScopeOpenerRule scopeRule(Properties properties, TokenKind opener) {
        String prefix = "scope." + opener.name() + ".";
        Set<TokenKind> start = kinds(properties, prefix + "start");
        Set<TokenKind> end = kinds(properties, prefix + "end");
        boolean strict = flag(properties, prefix + "strict");
        boolean shared = flag(properties, prefix + "shared");
        boolean braceless = flag(properties, prefix + "braceless");
        Optional<TokenKind> trailer = value(properties, prefix + "trailer").map(raw -> kind(raw, prefix + "trailer"));
        Set<TokenKind> notFollowedBy = kinds(properties, prefix + "not-followed-by");
        return new ScopeOpenerRule(opener, start, end, strict, shared, braceless, trailer, notFollowedBy);
    }

    private static Optional<String> value(Properties properties, String key) {
        return Optional.ofNullable(properties.getProperty(key))
                .map(String::trim)
                .filter(raw -> !raw.isEmpty());
    }

    private static Set<TokenKind> kinds(Properties properties, String key) {
        Set<TokenKind> kinds = EnumSet.noneOf(TokenKind.class);
        value(properties, key).ifPresent(raw -> Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .map(part -> kind(part, key))
                .forEach(kinds::add));
        return kinds;
    }

    private static TokenKind kind(String raw, String key) {
        try {
            return TokenKind.from(raw);
        } catch (IllegalArgumentException ex) {
            throw new InvalidPolicyException("Invalid token kind in '" + key + "': " + raw.trim(), ex);
        }
    }

    private static boolean flag(Properties properties, String key) {
        return value(properties, key)
                .map(raw -> raw.equalsIgnoreCase("true") || raw.equals("1"))
                .orElse(false);
    }

    private static int integer(String raw, String key) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidPolicyException("'" + key + "' must be an integer but was " + raw, ex);
        }
    }
}
