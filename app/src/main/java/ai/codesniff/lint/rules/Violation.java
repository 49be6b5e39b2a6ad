package ai.codesniff.lint.rules;

import java.util.Objects;

/**
 * A single message reported against a file.
 *
 * @param source fully qualified code, e.g. {@code PSR1.Files.SideEffects.FoundWithSymbols}
 */
public record Violation(Severity severity, int line, int column, String message, String source) {

    public Violation {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(source, "source");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("line and column are 1-based");
        }
    }
}
