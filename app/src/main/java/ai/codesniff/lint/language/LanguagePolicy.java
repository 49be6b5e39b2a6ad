package ai.codesniff.lint.language;

import ai.codesniff.lint.token.TokenKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only structural tables of one language: bracket pairs, parenthesis owners and scope-opener rules.
 *
 * <p>Loaded once and shared by every pipeline run.
 */
public record LanguagePolicy(String name,
                             Map<TokenKind, TokenKind> bracketPairs,
                             Set<TokenKind> parenthesisOwners,
                             Set<TokenKind> declarationOwners,
                             Map<TokenKind, ScopeOpenerRule> scopeOpeners,
                             Set<TokenKind> endScopeTokens,
                             Set<TokenKind> statementTerminators,
                             Set<TokenKind> nonScopeBracePredecessors,
                             int openerSearchLineLimit,
                             ClosingOwnerPolicy closingOwnerPolicy,
                             int ambiguousSharedCloserThreshold) {

    public static final int DEFAULT_OPENER_SEARCH_LINE_LIMIT = 30;
    public static final int DEFAULT_AMBIGUOUS_SHARED_CLOSER_THRESHOLD = 3;

    public LanguagePolicy {
        if (name == null || name.isBlank()) {
            throw new InvalidPolicyException("Language policy must have a name");
        }
        bracketPairs = Collections.unmodifiableMap(new EnumMap<>(Objects.requireNonNull(bracketPairs, "bracketPairs")));
        parenthesisOwners = immutable(parenthesisOwners);
        declarationOwners = immutable(declarationOwners);
        scopeOpeners = Collections.unmodifiableMap(scopeOpeners == null || scopeOpeners.isEmpty()
                ? new EnumMap<>(TokenKind.class)
                : new EnumMap<>(scopeOpeners));
        endScopeTokens = immutable(endScopeTokens);
        statementTerminators = immutable(statementTerminators);
        nonScopeBracePredecessors = immutable(nonScopeBracePredecessors);
        closingOwnerPolicy = closingOwnerPolicy == null ? ClosingOwnerPolicy.INNERMOST : closingOwnerPolicy;
        if (openerSearchLineLimit <= 0) {
            throw new InvalidPolicyException("Opener search line limit must be positive: " + openerSearchLineLimit);
        }
        if (ambiguousSharedCloserThreshold < 2) {
            throw new InvalidPolicyException(
                    "Ambiguous shared closer threshold must be at least 2: " + ambiguousSharedCloserThreshold);
        }
        validateBrackets(bracketPairs);
        for (Map.Entry<TokenKind, ScopeOpenerRule> entry : scopeOpeners.entrySet()) {
            if (entry.getKey() != entry.getValue().kind()) {
                throw new InvalidPolicyException("Scope rule registered under " + entry.getKey()
                        + " describes " + entry.getValue().kind());
            }
        }
    }

    private static void validateBrackets(Map<TokenKind, TokenKind> pairs) {
        Set<TokenKind> closers = EnumSet.noneOf(TokenKind.class);
        for (Map.Entry<TokenKind, TokenKind> pair : pairs.entrySet()) {
            if (pair.getKey() == pair.getValue()) {
                throw new InvalidPolicyException("Bracket opener and closer must differ: " + pair.getKey());
            }
            if (!closers.add(pair.getValue())) {
                throw new InvalidPolicyException("Bracket closer used by two openers: " + pair.getValue());
            }
        }
        for (TokenKind closer : closers) {
            if (pairs.containsKey(closer)) {
                throw new InvalidPolicyException("Token kind is both a bracket opener and closer: " + closer);
            }
        }
    }

    private static Set<TokenKind> immutable(Set<TokenKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            return Collections.unmodifiableSet(EnumSet.noneOf(TokenKind.class));
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    }

    public boolean isBracketOpener(TokenKind kind) {
        return bracketPairs.containsKey(kind);
    }

    public boolean isBracketCloser(TokenKind kind) {
        return bracketPairs.containsValue(kind);
    }

    public Optional<TokenKind> closerFor(TokenKind opener) {
        return Optional.ofNullable(bracketPairs.get(opener));
    }

    public boolean isScopeOpener(TokenKind kind) {
        return scopeOpeners.containsKey(kind);
    }

    public Optional<ScopeOpenerRule> rule(TokenKind kind) {
        return Optional.ofNullable(scopeOpeners.get(kind));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Mutable assembly of a policy; used by the loader and by tests that need a small custom table.
     */
    public static final class Builder {
        private final String name;
        private final Map<TokenKind, TokenKind> bracketPairs = new EnumMap<>(TokenKind.class);
        private final Set<TokenKind> parenthesisOwners = EnumSet.noneOf(TokenKind.class);
        private final Set<TokenKind> declarationOwners = EnumSet.noneOf(TokenKind.class);
        private final Map<TokenKind, ScopeOpenerRule> scopeOpeners = new EnumMap<>(TokenKind.class);
        private final Set<TokenKind> endScopeTokens = EnumSet.noneOf(TokenKind.class);
        private final Set<TokenKind> statementTerminators = EnumSet.noneOf(TokenKind.class);
        private final Set<TokenKind> nonScopeBracePredecessors = EnumSet.noneOf(TokenKind.class);
        private int openerSearchLineLimit = DEFAULT_OPENER_SEARCH_LINE_LIMIT;
        private ClosingOwnerPolicy closingOwnerPolicy = ClosingOwnerPolicy.INNERMOST;
        private int ambiguousSharedCloserThreshold = DEFAULT_AMBIGUOUS_SHARED_CLOSER_THRESHOLD;

        private Builder(String name) {
            this.name = name;
        }

        public Builder bracket(TokenKind opener, TokenKind closer) {
            bracketPairs.put(opener, closer);
            return this;
        }

        public Builder parenthesisOwners(Set<TokenKind> kinds) {
            parenthesisOwners.addAll(kinds);
            return this;
        }

        public Builder declarationOwners(Set<TokenKind> kinds) {
            declarationOwners.addAll(kinds);
            return this;
        }

        public Builder scopeOpener(ScopeOpenerRule rule) {
            scopeOpeners.put(rule.kind(), rule);
            return this;
        }

        public Builder endScopeTokens(Set<TokenKind> kinds) {
            endScopeTokens.addAll(kinds);
            return this;
        }

        public Builder statementTerminators(Set<TokenKind> kinds) {
            statementTerminators.addAll(kinds);
            return this;
        }

        public Builder nonScopeBracePredecessors(Set<TokenKind> kinds) {
            nonScopeBracePredecessors.addAll(kinds);
            return this;
        }

        public Builder openerSearchLineLimit(int limit) {
            this.openerSearchLineLimit = limit;
            return this;
        }

        public Builder closingOwnerPolicy(ClosingOwnerPolicy policy) {
            this.closingOwnerPolicy = policy;
            return this;
        }

        public Builder ambiguousSharedCloserThreshold(int threshold) {
            this.ambiguousSharedCloserThreshold = threshold;
            return this;
        }

        public LanguagePolicy build() {
            return new LanguagePolicy(name, bracketPairs, parenthesisOwners, declarationOwners, scopeOpeners,
                    endScopeTokens, statementTerminators, nonScopeBracePredecessors, openerSearchLineLimit,
                    closingOwnerPolicy, ambiguousSharedCloserThreshold);
        }
    }
}
