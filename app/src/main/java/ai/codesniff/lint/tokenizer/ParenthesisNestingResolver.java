package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.token.TokenStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Gives every token the stack of parenthesis pairs around it and links each pair to the token that owns it.
 *
 * <p>Only matched pairs count. The parentheses of a pair are not inside that pair.
 */
public final class ParenthesisNestingResolver implements AnnotationStage {

    private final LanguagePolicy policy;

    public ParenthesisNestingResolver(LanguagePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public String name() {
        return "parenthesis-map";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        List<Integer> open = new ArrayList<>();
        List<Integer> snapshot = List.of();
        for (int i = 0; i < stream.size(); i++) {
            TokenKind kind = stream.kind(i);
            int partner = stream.bracketPartner(i);

            if (kind == TokenKind.OPEN_PARENTHESIS && partner > i) {
                stream.setParenthesisStack(i, snapshot);
                int owner = findOwner(stream, i);
                stream.setParenthesisOwner(i, owner);
                if (owner != TokenStream.NONE && stream.ownedParenthesisOpener(owner) == TokenStream.NONE) {
                    stream.setOwnedParenthesis(owner, i, partner);
                }
                open.add(i);
                snapshot = List.copyOf(open);
                continue;
            }

            if (kind == TokenKind.CLOSE_PARENTHESIS && partner != TokenStream.NONE
                    && !open.isEmpty() && open.get(open.size() - 1) == partner) {
                open.remove(open.size() - 1);
                snapshot = List.copyOf(open);
                stream.setParenthesisStack(i, snapshot);
                stream.setParenthesisOwner(i, stream.parenthesisOwner(partner));
                continue;
            }

            stream.setParenthesisStack(i, snapshot);
            if (!open.isEmpty()) {
                stream.setParenthesisOwner(i, stream.parenthesisOwner(open.get(open.size() - 1)));
            }
        }
        return stream;
    }

    /**
     * The token owning the parenthesis at {@code opener}: the nearest code token before it when the policy
     * lets that kind own parentheses. A declared name hands ownership to its declaring keyword.
     */
    int findOwner(TokenStream stream, int opener) {
        int previous = stream.previousNonEmpty(opener - 1);
        if (previous == TokenStream.NONE) {
            return TokenStream.NONE;
        }
        TokenKind kind = stream.kind(previous);
        if (kind == TokenKind.IDENTIFIER) {
            int declaration = stream.previousNonEmpty(previous - 1);
            if (declaration != TokenStream.NONE && isReference(stream, declaration)) {
                declaration = stream.previousNonEmpty(declaration - 1);
            }
            if (declaration != TokenStream.NONE && policy.declarationOwners().contains(stream.kind(declaration))) {
                return declaration;
            }
        }
        return policy.parenthesisOwners().contains(kind) ? previous : TokenStream.NONE;
    }

    private static boolean isReference(TokenStream stream, int index) {
        return stream.kind(index) == TokenKind.OPERATOR && "&".equals(stream.content(index));
    }
}
