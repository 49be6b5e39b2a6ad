package ai.codesniff.lint.lexer;

import ai.codesniff.lint.token.RawToken;
import ai.codesniff.lint.token.TokenKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexer for PHP-flavoured source: inline HTML around {@code <?php ... ?>} blocks, C-style punctuation,
 * case-insensitive keywords and {@code $variables}.
 *
 * <p>Whitespace, comments, strings and inline HTML are split so that every token ends at the first line
 * terminator it contains. Unterminated comments and strings run to the end of the input.
 */
public class PhpLexer implements Lexer {

    private static final String OPEN_TAG = "<?php";
    private static final String OPEN_TAG_WITH_ECHO = "<?=";
    private static final String CLOSE_TAG = "?>";

    private static final Map<String, TokenKind> PUNCTUATION_3 = Map.ofEntries(
            Map.entry("?->", TokenKind.NULLSAFE_OBJECT_OPERATOR),
            Map.entry("===", TokenKind.OPERATOR),
            Map.entry("!==", TokenKind.OPERATOR),
            Map.entry("<=>", TokenKind.OPERATOR),
            Map.entry("...", TokenKind.OPERATOR),
            Map.entry("**=", TokenKind.ASSIGNMENT),
            Map.entry("??=", TokenKind.ASSIGNMENT),
            Map.entry("<<=", TokenKind.ASSIGNMENT),
            Map.entry(">>=", TokenKind.ASSIGNMENT));

    private static final Map<String, TokenKind> PUNCTUATION_2 = Map.ofEntries(
            Map.entry("->", TokenKind.OBJECT_OPERATOR),
            Map.entry("=>", TokenKind.DOUBLE_ARROW),
            Map.entry("::", TokenKind.DOUBLE_COLON),
            Map.entry("==", TokenKind.OPERATOR),
            Map.entry("!=", TokenKind.OPERATOR),
            Map.entry("<>", TokenKind.OPERATOR),
            Map.entry("<=", TokenKind.OPERATOR),
            Map.entry(">=", TokenKind.OPERATOR),
            Map.entry("&&", TokenKind.OPERATOR),
            Map.entry("||", TokenKind.OPERATOR),
            Map.entry("??", TokenKind.OPERATOR),
            Map.entry("++", TokenKind.OPERATOR),
            Map.entry("--", TokenKind.OPERATOR),
            Map.entry("**", TokenKind.OPERATOR),
            Map.entry("<<", TokenKind.OPERATOR),
            Map.entry(">>", TokenKind.OPERATOR),
            Map.entry("+=", TokenKind.ASSIGNMENT),
            Map.entry("-=", TokenKind.ASSIGNMENT),
            Map.entry("*=", TokenKind.ASSIGNMENT),
            Map.entry("/=", TokenKind.ASSIGNMENT),
            Map.entry(".=", TokenKind.ASSIGNMENT),
            Map.entry("%=", TokenKind.ASSIGNMENT),
            Map.entry("&=", TokenKind.ASSIGNMENT),
            Map.entry("|=", TokenKind.ASSIGNMENT),
            Map.entry("^=", TokenKind.ASSIGNMENT));

    private static final Map<Character, TokenKind> PUNCTUATION_1 = Map.ofEntries(
            Map.entry('{', TokenKind.OPEN_CURLY_BRACKET),
            Map.entry('}', TokenKind.CLOSE_CURLY_BRACKET),
            Map.entry('[', TokenKind.OPEN_SQUARE_BRACKET),
            Map.entry(']', TokenKind.CLOSE_SQUARE_BRACKET),
            Map.entry('(', TokenKind.OPEN_PARENTHESIS),
            Map.entry(')', TokenKind.CLOSE_PARENTHESIS),
            Map.entry(';', TokenKind.SEMICOLON),
            Map.entry(',', TokenKind.COMMA),
            Map.entry(':', TokenKind.COLON),
            Map.entry('=', TokenKind.EQUAL),
            Map.entry('?', TokenKind.INLINE_THEN),
            Map.entry('\\', TokenKind.NS_SEPARATOR),
            Map.entry('+', TokenKind.OPERATOR),
            Map.entry('-', TokenKind.OPERATOR),
            Map.entry('*', TokenKind.OPERATOR),
            Map.entry('/', TokenKind.OPERATOR),
            Map.entry('%', TokenKind.OPERATOR),
            Map.entry('.', TokenKind.OPERATOR),
            Map.entry('<', TokenKind.OPERATOR),
            Map.entry('>', TokenKind.OPERATOR),
            Map.entry('!', TokenKind.OPERATOR),
            Map.entry('&', TokenKind.OPERATOR),
            Map.entry('|', TokenKind.OPERATOR),
            Map.entry('^', TokenKind.OPERATOR),
            Map.entry('~', TokenKind.OPERATOR),
            Map.entry('@', TokenKind.OPERATOR),
            Map.entry('$', TokenKind.OPERATOR),
            Map.entry('#', TokenKind.OPERATOR));

    @Override
    public List<RawToken> tokenize(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return new Scan(content).run();
    }

    private static final class Scan {

        private final String source;
        private final int length;
        private final List<RawToken> tokens = new ArrayList<>();
        private int pos;
        private TokenKind lastSignificant;

        private Scan(String source) {
            this.source = source;
            this.length = source.length();
        }

        private List<RawToken> run() {
            while (pos < length) {
                scanInlineHtml();
                if (pos < length) {
                    scanCode();
                }
            }
            return tokens;
        }

        private void scanInlineHtml() {
            int tagStart = findOpenTag(pos);
            int end = tagStart < 0 ? length : tagStart;
            if (end > pos) {
                emitSplit(TokenKind.INLINE_HTML, pos, end);
            }
            pos = end;
            if (tagStart < 0) {
                return;
            }
            if (source.startsWith(OPEN_TAG_WITH_ECHO, pos)) {
                emit(TokenKind.OPEN_TAG_WITH_ECHO, pos, pos + OPEN_TAG_WITH_ECHO.length());
                return;
            }
            int tagEnd = pos + OPEN_TAG.length();
            if (tagEnd < length && source.charAt(tagEnd) == '\r' && tagEnd + 1 < length && source.charAt(tagEnd + 1) == '\n') {
                tagEnd += 2;
            } else if (tagEnd < length && Character.isWhitespace(source.charAt(tagEnd))) {
                tagEnd++;
            }
            emit(TokenKind.OPEN_TAG, pos, tagEnd);
        }

        private int findOpenTag(int from) {
            int candidate = source.indexOf("<?", from);
            while (candidate >= 0) {
                if (source.startsWith(OPEN_TAG_WITH_ECHO, candidate)) {
                    return candidate;
                }
                if (source.regionMatches(true, candidate, OPEN_TAG, 0, OPEN_TAG.length())) {
                    int after = candidate + OPEN_TAG.length();
                    if (after >= length || Character.isWhitespace(source.charAt(after))) {
                        return candidate;
                    }
                }
                candidate = source.indexOf("<?", candidate + 2);
            }
            return -1;
        }

        private void scanCode() {
            while (pos < length) {
                char ch = source.charAt(pos);
                if (source.startsWith(CLOSE_TAG, pos)) {
                    int end = pos + CLOSE_TAG.length();
                    end = skipLineTerminator(end);
                    emit(TokenKind.CLOSE_TAG, pos, end);
                    return;
                }
                if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\n' || ch == '\f') {
                    scanWhitespace();
                } else if (source.startsWith("//", pos) || (ch == '#' && !source.startsWith("#[", pos))) {
                    scanLineComment();
                } else if (source.startsWith("/*", pos)) {
                    scanBlockComment();
                } else if (ch == '$' && pos + 1 < length && isIdentifierStart(source.charAt(pos + 1))) {
                    int end = scanIdentifierEnd(pos + 1);
                    emit(TokenKind.VARIABLE, pos, end);
                } else if (isIdentifierStart(ch)) {
                    scanWord();
                } else if (Character.isDigit(ch)) {
                    scanNumber();
                } else if (ch == '\'' || ch == '"') {
                    scanString(ch);
                } else {
                    scanPunctuation();
                }
            }
        }

        private void scanWhitespace() {
            int end = pos;
            while (end < length) {
                char ch = source.charAt(end);
                if (ch == '\n') {
                    end++;
                    break;
                }
                if (ch != ' ' && ch != '\t' && ch != '\r' && ch != '\f') {
                    break;
                }
                end++;
            }
            emit(TokenKind.WHITESPACE, pos, end);
        }

        private void scanLineComment() {
            int end = pos;
            while (end < length) {
                char ch = source.charAt(end);
                if (ch == '\n') {
                    end++;
                    break;
                }
                if (source.startsWith(CLOSE_TAG, end)) {
                    break;
                }
                end++;
            }
            emit(TokenKind.COMMENT, pos, end);
        }

        private void scanBlockComment() {
            TokenKind kind = source.startsWith("/**", pos) && !source.startsWith("/**/", pos)
                    ? TokenKind.DOC_COMMENT
                    : TokenKind.COMMENT;
            int close = source.indexOf("*/", pos + 2);
            int end = close < 0 ? length : close + 2;
            emitSplit(kind, pos, end);
        }

        private void scanWord() {
            int end = scanIdentifierEnd(pos);
            String word = source.substring(pos, end);
            TokenKind kind = TokenKind.IDENTIFIER;
            if (!isMemberAccess(lastSignificant)) {
                kind = TokenKind.keyword(word).orElse(TokenKind.IDENTIFIER);
            }
            emit(kind, pos, end);
        }

        private void scanNumber() {
            int end = pos;
            while (end < length) {
                char ch = source.charAt(end);
                if (Character.isLetterOrDigit(ch) || ch == '_') {
                    end++;
                } else if (ch == '.' && end + 1 < length && Character.isDigit(source.charAt(end + 1))) {
                    end++;
                } else {
                    break;
                }
            }
            emit(TokenKind.NUMBER, pos, end);
        }

        private void scanString(char quote) {
            int end = pos + 1;
            while (end < length) {
                char ch = source.charAt(end);
                if (ch == '\\') {
                    end += 2;
                    continue;
                }
                end++;
                if (ch == quote) {
                    break;
                }
            }
            end = Math.min(end, length);
            emitSplit(quote == '\'' ? TokenKind.CONSTANT_STRING : TokenKind.DOUBLE_QUOTED_STRING, pos, end);
        }

        private void scanPunctuation() {
            if (pos + 3 <= length) {
                TokenKind kind = PUNCTUATION_3.get(source.substring(pos, pos + 3));
                if (kind != null) {
                    emit(kind, pos, pos + 3);
                    return;
                }
            }
            if (pos + 2 <= length) {
                TokenKind kind = PUNCTUATION_2.get(source.substring(pos, pos + 2));
                if (kind != null) {
                    emit(kind, pos, pos + 2);
                    return;
                }
            }
            int width = Character.charCount(source.codePointAt(pos));
            TokenKind kind = PUNCTUATION_1.getOrDefault(source.charAt(pos), TokenKind.UNKNOWN);
            emit(kind, pos, pos + width);
        }

        private int scanIdentifierEnd(int from) {
            int end = from;
            while (end < length && isIdentifierPart(source.charAt(end))) {
                end++;
            }
            return end;
        }

        private int skipLineTerminator(int from) {
            if (from < length && source.charAt(from) == '\n') {
                return from + 1;
            }
            if (from + 1 < length && source.charAt(from) == '\r' && source.charAt(from + 1) == '\n') {
                return from + 2;
            }
            return from;
        }

        private void emitSplit(TokenKind kind, int start, int end) {
            int pieceStart = start;
            for (int i = start; i < end; i++) {
                if (source.charAt(i) == '\n') {
                    emit(kind, pieceStart, i + 1);
                    pieceStart = i + 1;
                }
            }
            if (pieceStart < end) {
                emit(kind, pieceStart, end);
            }
            pos = end;
        }

        private void emit(TokenKind kind, int start, int end) {
            tokens.add(new RawToken(kind, source.substring(start, end), start));
            pos = end;
            if (!kind.isEmpty()) {
                lastSignificant = kind;
            }
        }

        private static boolean isMemberAccess(TokenKind kind) {
            return kind == TokenKind.OBJECT_OPERATOR
                    || kind == TokenKind.NULLSAFE_OBJECT_OPERATOR
                    || kind == TokenKind.DOUBLE_COLON;
        }

        private static boolean isIdentifierStart(char ch) {
            return ch == '_' || Character.isLetter(ch) || ch >= 0x80;
        }

        private static boolean isIdentifierPart(char ch) {
            return isIdentifierStart(ch) || Character.isDigit(ch);
        }
    }
}
