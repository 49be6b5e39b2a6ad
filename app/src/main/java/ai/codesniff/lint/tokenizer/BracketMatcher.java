package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.token.TokenStream;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Pairs bracket tokens with a single stack. A closer always pops; it is linked only when the popped opener
 * expects exactly its kind, otherwise both tokens stay unpartnered and scanning goes on.
 */
public final class BracketMatcher implements AnnotationStage {

    private final LanguagePolicy policy;

    public BracketMatcher(LanguagePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public String name() {
        return "bracket-map";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        Deque<Integer> openers = new ArrayDeque<>();
        for (int i = 0; i < stream.size(); i++) {
            TokenKind kind = stream.kind(i);
            if (policy.isBracketOpener(kind)) {
                openers.push(i);
                continue;
            }
            if (!policy.isBracketCloser(kind)) {
                continue;
            }
            if (openers.isEmpty()) {
                stream.addWarning(StructuralWarning.Kind.UNMATCHED_CLOSER, i,
                        "Closing " + describe(stream, i) + " has no opener");
                continue;
            }
            int opener = openers.pop();
            Optional<TokenKind> expected = policy.closerFor(stream.kind(opener));
            if (expected.isPresent() && expected.get() == kind) {
                stream.linkBrackets(opener, i);
            } else {
                stream.addWarning(StructuralWarning.Kind.MISMATCHED_BRACKET, i,
                        "Closing " + describe(stream, i) + " does not match " + describe(stream, opener)
                                + " on line " + stream.get(opener).line());
            }
        }
        while (!openers.isEmpty()) {
            int opener = openers.pop();
            stream.addWarning(StructuralWarning.Kind.UNCLOSED_OPENER, opener,
                    "Opening " + describe(stream, opener) + " is never closed");
        }
        return stream;
    }

    private static String describe(TokenStream stream, int index) {
        return "'" + stream.content(index) + "'";
    }
}
