package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.TokenKind;
import java.util.Set;

/**
 * A rule that listens for token kinds and inspects the annotated stream around them.
 */
public interface Sniff {

    /**
     * Dotted name used as the prefix of every code the sniff reports, e.g. {@code Squiz.PHP.EmbeddedPhp}.
     */
    String name();

    Set<TokenKind> register();

    /**
     * Inspects the token at {@code stackPtr}.
     *
     * @return the index at which this sniff wants to be called next; {@code file.numTokens()} skips the rest
     *         of the file, anything at or below {@code stackPtr} means no skipping
     */
    int process(SniffFile file, int stackPtr);
}
