package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.token.TokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the lines that suppression comments switch off.
 *
 * <ul>
 *     <li>{@code lint:ignoreFile} suppresses the whole file;</li>
 *     <li>{@code lint:disable} ... {@code lint:enable} suppresses the lines in between, inclusive;</li>
 *     <li>{@code lint:ignore} suppresses its own line when it trails code, otherwise the next line.</li>
 * </ul>
 * Must run after {@link PositionAnnotator}.
 */
public final class SuppressionAnnotator implements AnnotationStage {

    private static final Logger LOGGER = LoggerFactory.getLogger(SuppressionAnnotator.class);

    static final String IGNORE_FILE = "lint:ignoreFile";
    static final String DISABLE = "lint:disable";
    static final String ENABLE = "lint:enable";
    static final String IGNORE = "lint:ignore";

    @Override
    public String name() {
        return "suppressions";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        int disabledFrom = -1;
        int lastLine = 0;
        for (int i = 0; i < stream.size(); i++) {
            int line = stream.get(i).line();
            lastLine = Math.max(lastLine, line);
            TokenKind kind = stream.kind(i);
            if (kind != TokenKind.COMMENT && kind != TokenKind.DOC_COMMENT) {
                continue;
            }
            String text = stream.content(i);
            if (text.contains(IGNORE_FILE)) {
                LOGGER.debug("File suppressed by comment on line {}", line);
                stream.ignoreFile();
            } else if (text.contains(DISABLE)) {
                if (disabledFrom < 0) {
                    disabledFrom = line;
                }
            } else if (text.contains(ENABLE)) {
                if (disabledFrom >= 0) {
                    ignoreRange(stream, disabledFrom, line);
                    disabledFrom = -1;
                }
            } else if (text.contains(IGNORE)) {
                stream.ignoreLine(trailsCode(stream, i) ? line : line + 1);
            }
        }
        if (disabledFrom >= 0) {
            ignoreRange(stream, disabledFrom, lastLine);
        }
        return stream;
    }

    private static boolean trailsCode(TokenStream stream, int commentIndex) {
        int line = stream.get(commentIndex).line();
        for (int i = commentIndex - 1; i >= 0 && stream.get(i).line() == line; i--) {
            TokenKind kind = stream.kind(i);
            if (!kind.isEmpty() && kind != TokenKind.OPEN_TAG && kind != TokenKind.INLINE_HTML) {
                return true;
            }
        }
        return false;
    }

    private static void ignoreRange(TokenStream stream, int from, int to) {
        for (int line = from; line <= to; line++) {
            stream.ignoreLine(line);
        }
    }
}
