package ai.codesniff.lint.token;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A single token of the stream together with the structural metadata filled in by the annotation pipeline.
 *
 * <p>Cross references are plain indices into the owning {@link TokenStream}. Rules only see the getters;
 * the fields are written through {@link TokenStream} while the pipeline owns the stream.
 */
public final class Token {

    static final int NONE = -1;

    private final TokenKind kind;
    private final int offset;
    private String content;
    private String originalContent;
    private int length;
    private int line;
    private int column;

    int bracketPartner = NONE;
    private List<Integer> parenthesisStack = List.of();
    int parenthesisOwner = NONE;
    int parenthesisOpener = NONE;
    int parenthesisCloser = NONE;

    int scopeCondition = NONE;
    int scopeOpener = NONE;
    int scopeCloser = NONE;

    private int level;
    private List<Integer> conditions = List.of();

    Token(RawToken raw) {
        this.kind = raw.kind();
        this.offset = raw.offset();
        this.content = raw.text();
        this.length = raw.text().length();
    }

    public TokenKind kind() {
        return kind;
    }

    public int offset() {
        return offset;
    }

    /**
     * Normalized content, with tabs expanded when the position pass replaced them.
     */
    public String content() {
        return content;
    }

    /**
     * Content before tab expansion; present only when expansion changed the text.
     */
    public Optional<String> originalContent() {
        return Optional.ofNullable(originalContent);
    }

    /**
     * Display width of the content, excluding any trailing line terminator.
     */
    public int length() {
        return length;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public OptionalInt bracketPartner() {
        return optional(bracketPartner);
    }

    /**
     * Opener indices of the parenthesis pairs enclosing this token, innermost last.
     */
    public List<Integer> parenthesisStack() {
        return parenthesisStack;
    }

    public OptionalInt parenthesisOwner() {
        return optional(parenthesisOwner);
    }

    /**
     * On an owner token: the opening parenthesis of the group it owns.
     */
    public OptionalInt parenthesisOpener() {
        return optional(parenthesisOpener);
    }

    /**
     * On an owner token: the closing parenthesis of the group it owns.
     */
    public OptionalInt parenthesisCloser() {
        return optional(parenthesisCloser);
    }

    public OptionalInt scopeCondition() {
        return optional(scopeCondition);
    }

    public OptionalInt scopeOpener() {
        return optional(scopeOpener);
    }

    public OptionalInt scopeCloser() {
        return optional(scopeCloser);
    }

    public int level() {
        return level;
    }

    /**
     * Scope-opener indices enclosing this token, outermost first.
     */
    public List<Integer> conditions() {
        return conditions;
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    void content(String newContent, String original, int newLength) {
        this.originalContent = original;
        this.content = newContent;
        this.length = newLength;
    }

    void position(int line, int column, int length) {
        this.line = line;
        this.column = column;
        this.length = length;
    }

    void bracketPartner(int partner) {
        this.bracketPartner = partner;
    }

    void parenthesisStack(List<Integer> stack) {
        this.parenthesisStack = stack;
    }

    void parenthesisOwner(int owner) {
        this.parenthesisOwner = owner;
    }

    void ownedParenthesis(int opener, int closer) {
        this.parenthesisOpener = opener;
        this.parenthesisCloser = closer;
    }

    void scope(int condition, int opener, int closer) {
        this.scopeCondition = condition;
        this.scopeOpener = opener;
        this.scopeCloser = closer;
    }

    void level(int level, List<Integer> conditions) {
        this.level = level;
        this.conditions = conditions;
    }

    private static OptionalInt optional(int value) {
        return value == NONE ? OptionalInt.empty() : OptionalInt.of(value);
    }

    @Override
    public String toString() {
        return kind + "[" + line + ":" + column + "] '" + content.replace("\n", "\\n") + "'";
    }
}
