package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.tokenizer.AnnotatedFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * What a sniff sees of one file: the annotated tokens plus a place to report violations.
 */
public final class SniffFile {

    public static final int NOT_FOUND = -1;

    private final Path path;
    private final AnnotatedFile annotated;
    private final List<Violation> violations = new ArrayList<>();
    private String activeSniff = "Internal";

    public SniffFile(Path path, AnnotatedFile annotated) {
        this.path = Objects.requireNonNull(path, "path");
        this.annotated = Objects.requireNonNull(annotated, "annotated");
    }

    public Path path() {
        return path;
    }

    public List<Token> tokens() {
        return annotated.tokens();
    }

    public Token token(int index) {
        return annotated.get(index);
    }

    public int numTokens() {
        return annotated.size();
    }

    public List<StructuralWarning> structuralWarnings() {
        return annotated.warnings();
    }

    /**
     * First index in {@code [start, end)} whose kind is in {@code kinds}, or not in it when {@code exclude}.
     */
    public int findNext(Set<TokenKind> kinds, int start, int end, boolean exclude) {
        int limit = Math.min(end, numTokens());
        for (int i = Math.max(start, 0); i < limit; i++) {
            if (kinds.contains(token(i).kind()) != exclude) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public int findNext(TokenKind kind, int start) {
        return findNext(Set.of(kind), start, numTokens(), false);
    }

    /**
     * Last index in {@code [end, start]} whose kind is in {@code kinds}, or not in it when {@code exclude}.
     */
    public int findPrevious(Set<TokenKind> kinds, int start, int end, boolean exclude) {
        for (int i = Math.min(start, numTokens() - 1); i >= Math.max(end, 0); i--) {
            if (kinds.contains(token(i).kind()) != exclude) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public int nextNonEmpty(int start) {
        for (int i = Math.max(start, 0); i < numTokens(); i++) {
            if (!token(i).kind().isEmpty()) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public int previousNonEmpty(int start) {
        for (int i = Math.min(start, numTokens() - 1); i >= 0; i--) {
            if (!token(i).kind().isEmpty()) {
                return i;
            }
        }
        return NOT_FOUND;
    }

    public boolean addError(String message, int stackPtr, String code, Object... args) {
        return add(Severity.ERROR, message, stackPtr, code, args);
    }

    public boolean addWarning(String message, int stackPtr, String code, Object... args) {
        return add(Severity.WARNING, message, stackPtr, code, args);
    }

    /**
     * Records a violation that no suppression comment can hide.
     */
    public void addErrorOnLine(String message, int line, String source) {
        violations.add(new Violation(Severity.ERROR, line, 1, message, source));
    }

    public List<Violation> violations() {
        return Collections.unmodifiableList(violations);
    }

    void activeSniff(String name) {
        this.activeSniff = name;
    }

    private boolean add(Severity severity, String message, int stackPtr, String code, Object... args) {
        int line = 1;
        int column = 1;
        if (stackPtr >= 0 && stackPtr < numTokens()) {
            line = Math.max(token(stackPtr).line(), 1);
            column = Math.max(token(stackPtr).column(), 1);
        }
        if (annotated.isLineIgnored(line)) {
            return false;
        }
        String text = args == null || args.length == 0 ? message : String.format(Locale.ROOT, message, args);
        violations.add(new Violation(severity, line, column, text, activeSniff + "." + code));
        return true;
    }
}
