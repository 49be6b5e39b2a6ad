package ai.codesniff.lint.token;

import java.util.Locale;
import java.util.Objects;

/**
 * Recoverable structural problem attached to a token index.
 */
public record StructuralWarning(Kind kind, int tokenIndex, String message) {

    public StructuralWarning {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        if (tokenIndex < 0) {
            throw new IllegalArgumentException("tokenIndex must be greater than or equal to zero");
        }
    }

    public enum Kind {
        UNMATCHED_CLOSER,
        UNCLOSED_OPENER,
        MISMATCHED_BRACKET,
        UNRESOLVED_SCOPE,
        AMBIGUOUS_SHARED_CLOSER,
        LEVEL_MISMATCH;

        /**
         * Camel-cased name used in violation codes, e.g. {@code UnmatchedCloser}.
         */
        public String code() {
            StringBuilder builder = new StringBuilder();
            for (String part : name().split("_")) {
                builder.append(part.charAt(0)).append(part.substring(1).toLowerCase(Locale.ROOT));
            }
            return builder.toString();
        }
    }
}
