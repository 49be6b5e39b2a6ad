package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenKind;
import java.util.Set;

/**
 * Flags functions whose bodies nest too deeply.
 */
public class NestingLevelSniff implements Sniff {

    static final int DEFAULT_NESTING_LEVEL = 5;
    static final int DEFAULT_ABSOLUTE_NESTING_LEVEL = 10;

    private final int nestingLevel;
    private final int absoluteNestingLevel;

    public NestingLevelSniff() {
        this(DEFAULT_NESTING_LEVEL, DEFAULT_ABSOLUTE_NESTING_LEVEL);
    }

    public NestingLevelSniff(int nestingLevel, int absoluteNestingLevel) {
        if (nestingLevel < 1 || absoluteNestingLevel < nestingLevel) {
            throw new IllegalArgumentException("nesting limits must satisfy 1 <= warning <= error");
        }
        this.nestingLevel = nestingLevel;
        this.absoluteNestingLevel = absoluteNestingLevel;
    }

    @Override
    public String name() {
        return "Generic.Metrics.NestingLevel";
    }

    @Override
    public Set<TokenKind> register() {
        return Set.of(TokenKind.FUNCTION);
    }

    @Override
    public int process(SniffFile file, int stackPtr) {
        Token function = file.token(stackPtr);
        if (function.scopeOpener().isEmpty() || function.scopeCloser().isEmpty()) {
            return stackPtr;
        }
        int opener = function.scopeOpener().getAsInt();
        int closer = function.scopeCloser().getAsInt();

        int deepest = 0;
        for (int i = opener + 1; i < closer; i++) {
            deepest = Math.max(deepest, file.token(i).level());
        }
        int nesting = deepest - function.level() - 1;

        if (nesting > absoluteNestingLevel) {
            file.addError("Function's nesting level (%s) exceeds allowed maximum of %s", stackPtr, "MaxExceeded",
                    nesting, absoluteNestingLevel);
        } else if (nesting > nestingLevel) {
            file.addWarning("Function's nesting level (%s) exceeds %s; consider refactoring the function", stackPtr,
                    "TooHigh", nesting, nestingLevel);
        }
        return stackPtr;
    }
}
