package ai.codesniff.lint.lexer;

import ai.codesniff.lint.token.RawToken;
import java.util.List;

/**
 * Turns source text into a flat token list covering the whole input with no gaps or overlaps.
 *
 * <p>Implementations must not fail on malformed input; unrecognised characters become tokens of their own.
 */
@FunctionalInterface
public interface Lexer {

    List<RawToken> tokenize(String content);
}
