package ai.codesniff.lint.language;

import ai.codesniff.lint.token.TokenKind;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * How one kind of scope-opener finds its body.
 *
 * @param kind          the scope-opening token kind
 * @param start         kinds that open the body ({@code {} or {@code :} for alternate syntax)
 * @param end           kinds that close the body
 * @param strict        keep searching for the body past the line limit
 * @param shared        several openers of this kind may share one closer ({@code case} labels)
 * @param braceless     the body may be a single statement without a start token
 * @param trailer       kind that directly follows the closer and belongs to this construct ({@code do ... while})
 * @param notFollowedBy kinds that, directly after the opener, mean the token is not opening a scope at all
 */
public record ScopeOpenerRule(TokenKind kind,
                              Set<TokenKind> start,
                              Set<TokenKind> end,
                              boolean strict,
                              boolean shared,
                              boolean braceless,
                              Optional<TokenKind> trailer,
                              Set<TokenKind> notFollowedBy) {

    public ScopeOpenerRule {
        Objects.requireNonNull(kind, "kind");
        start = Set.copyOf(Objects.requireNonNull(start, "start"));
        end = Set.copyOf(Objects.requireNonNull(end, "end"));
        trailer = trailer == null ? Optional.empty() : trailer;
        notFollowedBy = notFollowedBy == null ? Set.of() : Set.copyOf(notFollowedBy);
        if (start.isEmpty()) {
            throw new InvalidPolicyException("Scope opener " + kind + " must declare at least one start token");
        }
        if (end.isEmpty()) {
            throw new InvalidPolicyException("Scope opener " + kind + " must declare at least one end token");
        }
    }

    public boolean startsWith(TokenKind candidate) {
        return start.contains(candidate);
    }

    public boolean endsWith(TokenKind candidate) {
        return end.contains(candidate);
    }
}
