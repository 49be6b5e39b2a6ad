package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenKind;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * A file should declare new symbols and cause no other side effects, or execute logic with side effects, but
 * not both.
 */
public class SideEffectsSniff implements Sniff {

    private static final Set<TokenKind> SYMBOLS = EnumSet.of(
            TokenKind.CLASS, TokenKind.INTERFACE, TokenKind.TRAIT, TokenKind.ENUM, TokenKind.FUNCTION);
    private static final Set<TokenKind> CONDITIONS = EnumSet.of(TokenKind.IF, TokenKind.ELSEIF, TokenKind.ELSE);
    private static final Set<TokenKind> PREFIXES = EnumSet.of(
            TokenKind.ABSTRACT, TokenKind.FINAL, TokenKind.READONLY, TokenKind.STATIC,
            TokenKind.PUBLIC, TokenKind.PROTECTED, TokenKind.PRIVATE);
    private static final Set<TokenKind> IGNORED = EnumSet.of(
            TokenKind.OPEN_TAG, TokenKind.OPEN_TAG_WITH_ECHO, TokenKind.CLOSE_TAG);
    private static final Set<TokenKind> STATEMENT_END = EnumSet.of(TokenKind.SEMICOLON, TokenKind.CLOSE_TAG);

    @Override
    public String name() {
        return "PSR1.Files.SideEffects";
    }

    @Override
    public Set<TokenKind> register() {
        return Set.of(TokenKind.OPEN_TAG);
    }

    @Override
    public int process(SniffFile file, int stackPtr) {
        Conflict result = searchForConflict(file, 0, file.numTokens() - 1);
        if (result.symbol() >= 0 && result.effect() >= 0) {
            file.addWarning("A file should declare new symbols (classes, functions, constants, etc.) and cause no "
                            + "other side effects, or it should execute logic with side effects, but should not do "
                            + "both. The first symbol is defined on line %s and the first side effect is on line %s.",
                    0, "FoundWithSymbols",
                    file.token(result.symbol()).line(), file.token(result.effect()).line());
        }
        return file.numTokens();
    }

    /**
     * First symbol and first side effect in {@code [start, end]}; {@code -1} when none was found.
     */
    Conflict searchForConflict(SniffFile file, int start, int end) {
        int firstSymbol = -1;
        int firstEffect = -1;
        for (int i = start; i <= end; i++) {
            Token token = file.token(i);
            TokenKind kind = token.kind();
            if (kind.isEmpty() || IGNORED.contains(kind) || PREFIXES.contains(kind)) {
                continue;
            }
            if (kind == TokenKind.INLINE_HTML) {
                if (token.content().isBlank()) {
                    continue;
                }
                if (firstEffect < 0) {
                    firstEffect = i;
                }
                continue;
            }

            if (kind == TokenKind.CLOSE_CURLY_BRACKET && closesBlockNamespace(file, token)) {
                continue;
            }
            if (isAttributeStart(file, i)) {
                i = file.token(i + 1).bracketPartner().getAsInt();
                continue;
            }

            if (kind == TokenKind.NAMESPACE) {
                int next = file.findNext(EnumSet.of(TokenKind.SEMICOLON, TokenKind.OPEN_CURLY_BRACKET), i + 1,
                        file.numTokens(), false);
                i = next == SniffFile.NOT_FOUND ? i : next;
                continue;
            }
            if (kind == TokenKind.USE || (kind == TokenKind.DECLARE && token.scopeOpener().isEmpty())) {
                i = endOfStatement(file, i);
                continue;
            }

            if (SYMBOLS.contains(kind) && token.scopeCloser().isPresent()) {
                if (firstSymbol < 0) {
                    firstSymbol = i;
                }
                i = token.scopeCloser().getAsInt();
                continue;
            }
            if (kind == TokenKind.CONST || isDefineCall(file, i)) {
                if (firstSymbol < 0) {
                    firstSymbol = i;
                }
                i = endOfStatement(file, i);
                continue;
            }

            if (CONDITIONS.contains(kind) && token.scopeOpener().isPresent() && token.scopeCloser().isPresent()) {
                Conflict nested = searchForConflict(file, token.scopeOpener().getAsInt() + 1,
                        token.scopeCloser().getAsInt() - 1);
                if (nested.symbol() >= 0) {
                    if (firstSymbol < 0) {
                        firstSymbol = nested.symbol();
                    }
                    if (nested.effect() >= 0) {
                        firstEffect = nested.effect();
                        break;
                    }
                } else if (nested.effect() >= 0 && firstEffect < 0) {
                    firstEffect = nested.effect();
                }
                i = token.scopeCloser().getAsInt();
                continue;
            }

            if (firstEffect < 0) {
                firstEffect = i;
            }
            if (firstSymbol >= 0) {
                break;
            }
            i = endOfStatement(file, i);
        }
        return new Conflict(firstSymbol, firstEffect);
    }

    private static boolean isDefineCall(SniffFile file, int index) {
        Token token = file.token(index);
        if (token.kind() != TokenKind.IDENTIFIER || !"define".equals(token.content().toLowerCase(Locale.ROOT))) {
            return false;
        }
        int previous = file.previousNonEmpty(index - 1);
        if (previous == SniffFile.NOT_FOUND) {
            return true;
        }
        TokenKind kind = file.token(previous).kind();
        return kind != TokenKind.OBJECT_OPERATOR && kind != TokenKind.NULLSAFE_OBJECT_OPERATOR
                && kind != TokenKind.DOUBLE_COLON && kind != TokenKind.FUNCTION;
    }

    private static boolean closesBlockNamespace(SniffFile file, Token token) {
        return token.scopeCondition().isPresent()
                && file.token(token.scopeCondition().getAsInt()).kind() == TokenKind.NAMESPACE;
    }

    private static boolean isAttributeStart(SniffFile file, int index) {
        if (index + 1 >= file.numTokens() || !"#".equals(file.token(index).content())) {
            return false;
        }
        Token next = file.token(index + 1);
        return next.kind() == TokenKind.OPEN_SQUARE_BRACKET && next.bracketPartner().isPresent();
    }

    private static int endOfStatement(SniffFile file, int index) {
        int end = file.findNext(STATEMENT_END, index + 1, file.numTokens(), false);
        return end == SniffFile.NOT_FOUND ? index : end;
    }

    record Conflict(int symbol, int effect) {
    }
}
