package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenKind;
import java.util.Set;

/**
 * Checks the layout of code blocks embedded in inline HTML.
 *
 * <p>A block on a single line needs exactly one space after the open tag and before the close tag and must end
 * with a semicolon. A block spanning lines puts its open tag and its close tag on lines of their own.
 */
public class EmbeddedCodeSniff implements Sniff {

    @Override
    public String name() {
        return "Squiz.PHP.EmbeddedPhp";
    }

    @Override
    public Set<TokenKind> register() {
        return Set.of(TokenKind.OPEN_TAG, TokenKind.OPEN_TAG_WITH_ECHO);
    }

    @Override
    public int process(SniffFile file, int stackPtr) {
        int closeTag = file.findNext(TokenKind.CLOSE_TAG, stackPtr);
        if (stackPtr == 0 && closeTag == SniffFile.NOT_FOUND) {
            // A plain source file, nothing is embedded.
            return stackPtr;
        }
        if (closeTag != SniffFile.NOT_FOUND && file.token(stackPtr).line() == file.token(closeTag).line()) {
            validateInline(file, stackPtr, closeTag);
        } else {
            validateMultiline(file, stackPtr, closeTag);
        }
        return stackPtr;
    }

    private void validateMultiline(SniffFile file, int openTag, int closeTag) {
        int limit = closeTag == SniffFile.NOT_FOUND ? file.numTokens() : closeTag;
        int firstContent = file.findNext(Set.of(TokenKind.WHITESPACE), openTag + 1, limit, true);
        if (firstContent == SniffFile.NOT_FOUND) {
            file.addError("Empty embedded PHP tag found", openTag, "Empty");
            return;
        }

        int previous = openTag - 1;
        if (previous >= 0 && file.token(previous).kind() == TokenKind.INLINE_HTML
                && file.token(previous).line() == file.token(openTag).line()
                && !file.token(previous).content().isBlank()) {
            file.addError("Opening PHP tag must be on a line by itself", openTag, "ContentBeforeOpen");
        }

        if (file.token(firstContent).line() == file.token(openTag).line()) {
            file.addError("Opening PHP tag must be on a line by itself", openTag, "ContentAfterOpen");
        }

        if (closeTag == SniffFile.NOT_FOUND) {
            return;
        }
        int lastContent = file.findPrevious(Set.of(TokenKind.WHITESPACE), closeTag - 1, openTag + 1, true);
        if (lastContent != SniffFile.NOT_FOUND && file.token(lastContent).line() == file.token(closeTag).line()) {
            file.addError("Closing PHP tag must be on a line by itself", closeTag, "ContentBeforeEnd");
        }
        int next = closeTag + 1;
        if (next < file.numTokens() && file.token(next).kind() == TokenKind.INLINE_HTML
                && file.token(next).line() == file.token(closeTag).line()
                && !file.token(closeTag).content().endsWith("\n")
                && !file.token(next).content().isBlank()) {
            file.addError("Closing PHP tag must be on a line by itself", closeTag, "ContentAfterEnd");
        }
    }

    private void validateInline(SniffFile file, int openTag, int closeTag) {
        Token open = file.token(openTag);
        int firstContent = file.findNext(Set.of(TokenKind.WHITESPACE), openTag + 1, closeTag, true);
        if (firstContent == SniffFile.NOT_FOUND) {
            file.addError("Empty embedded PHP tag found", openTag, "Empty");
            return;
        }

        int spacesAfterOpen = trailingSpaces(open.content());
        if (openTag + 1 < closeTag && file.token(openTag + 1).kind() == TokenKind.WHITESPACE) {
            spacesAfterOpen += file.token(openTag + 1).length();
        }
        if (spacesAfterOpen != 1) {
            file.addError("Expected 1 space after opening PHP tag; %s found", openTag, "SpacingAfterOpen",
                    spacesAfterOpen);
        }

        int spacesBeforeClose = 0;
        if (file.token(closeTag - 1).kind() == TokenKind.WHITESPACE) {
            spacesBeforeClose = file.token(closeTag - 1).length();
        }
        if (spacesBeforeClose != 1) {
            file.addError("Expected 1 space before closing PHP tag; %s found", closeTag, "SpacingBeforeClose",
                    spacesBeforeClose);
        }

        if (open.kind() == TokenKind.OPEN_TAG) {
            int lastContent = file.previousNonEmpty(closeTag - 1);
            if (lastContent != openTag && file.token(lastContent).kind() != TokenKind.SEMICOLON) {
                file.addError("Inline PHP statement must end with a semicolon", closeTag, "NoSemicolon");
            }
        }
    }

    private static int trailingSpaces(String tag) {
        int count = 0;
        for (int i = tag.length() - 1; i >= 0 && tag.charAt(i) == ' '; i--) {
            count++;
        }
        return count;
    }
}
