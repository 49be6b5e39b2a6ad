package ai.codesniff.lint.token;

import java.util.Objects;

/**
 * Token as produced by a lexer, before any structural annotation.
 *
 * @param kind   category of the token
 * @param text   source text covered by the token
 * @param offset character offset of the first character in the source
 */
public record RawToken(TokenKind kind, String text, int offset) {

    public RawToken {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be greater than or equal to zero");
        }
    }
}
