package ai.codesniff.lint.token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owned, index-addressed token buffer that the annotation stages fill in place.
 *
 * <p>A stream belongs to exactly one pipeline run. Indices are stable for that run; re-tokenizing produces a
 * new stream.
 */
public final class TokenStream {

    public static final int NONE = Token.NONE;

    private final List<Token> tokens;
    private final List<Token> readOnlyTokens;
    private final List<StructuralWarning> warnings = new ArrayList<>();
    private final Set<Integer> ignoredLines = new TreeSet<>();
    private boolean fileIgnored;

    private TokenStream(List<Token> tokens) {
        this.tokens = tokens;
        this.readOnlyTokens = Collections.unmodifiableList(tokens);
    }

    public static TokenStream of(List<RawToken> rawTokens) {
        Objects.requireNonNull(rawTokens, "rawTokens");
        List<Token> tokens = new ArrayList<>(rawTokens.size());
        for (RawToken raw : rawTokens) {
            tokens.add(new Token(raw));
        }
        return new TokenStream(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public TokenKind kind(int index) {
        return tokens.get(index).kind();
    }

    public String content(int index) {
        return tokens.get(index).content();
    }

    public List<Token> tokens() {
        return readOnlyTokens;
    }

    /**
     * Index of the first non-whitespace, non-comment token at or after {@code from}, or {@link #NONE}.
     */
    public int nextNonEmpty(int from) {
        for (int i = Math.max(from, 0); i < tokens.size(); i++) {
            if (!tokens.get(i).kind().isEmpty()) {
                return i;
            }
        }
        return NONE;
    }

    /**
     * Index of the last non-whitespace, non-comment token at or before {@code from}, or {@link #NONE}.
     */
    public int previousNonEmpty(int from) {
        for (int i = Math.min(from, tokens.size() - 1); i >= 0; i--) {
            if (!tokens.get(i).kind().isEmpty()) {
                return i;
            }
        }
        return NONE;
    }

    // Position data

    public void setPosition(int index, int line, int column, int length) {
        tokens.get(index).position(line, column, length);
    }

    public void replaceContent(int index, String content, int length) {
        Token token = tokens.get(index);
        String original = token.content();
        token.content(content, original.equals(content) ? null : original, length);
    }

    // Brackets and parentheses

    public int bracketPartner(int index) {
        return tokens.get(index).bracketPartner;
    }

    public void linkBrackets(int opener, int closer) {
        tokens.get(opener).bracketPartner(closer);
        tokens.get(closer).bracketPartner(opener);
    }

    public void setParenthesisStack(int index, List<Integer> stack) {
        tokens.get(index).parenthesisStack(stack);
    }

    public void setParenthesisOwner(int index, int owner) {
        tokens.get(index).parenthesisOwner(owner);
    }

    public int parenthesisOwner(int index) {
        return tokens.get(index).parenthesisOwner;
    }

    public void setOwnedParenthesis(int owner, int opener, int closer) {
        tokens.get(owner).ownedParenthesis(opener, closer);
    }

    public int ownedParenthesisCloser(int owner) {
        return tokens.get(owner).parenthesisCloser;
    }

    public int ownedParenthesisOpener(int owner) {
        return tokens.get(owner).parenthesisOpener;
    }

    // Scopes

    public int scopeCondition(int index) {
        return tokens.get(index).scopeCondition;
    }

    public int scopeOpener(int index) {
        return tokens.get(index).scopeOpener;
    }

    public int scopeCloser(int index) {
        return tokens.get(index).scopeCloser;
    }

    public void setScope(int index, int condition, int opener, int closer) {
        tokens.get(index).scope(condition, opener, closer);
    }

    public void setLevel(int index, int level, List<Integer> conditions) {
        tokens.get(index).level(level, conditions);
    }

    // Warnings and suppression

    public void addWarning(StructuralWarning.Kind kind, int index, String message) {
        warnings.add(new StructuralWarning(kind, index, message));
    }

    public List<StructuralWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public void ignoreLine(int line) {
        ignoredLines.add(line);
    }

    public Set<Integer> ignoredLines() {
        return Collections.unmodifiableSet(ignoredLines);
    }

    public void ignoreFile() {
        fileIgnored = true;
    }

    public boolean fileIgnored() {
        return fileIgnored;
    }
}
