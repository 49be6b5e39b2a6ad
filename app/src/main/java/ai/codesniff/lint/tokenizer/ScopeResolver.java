package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.language.ClosingOwnerPolicy;
import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.language.ScopeOpenerRule;
import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.token.TokenStream;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the body of every scope-opener and records condition, opener and closer on the tokens bounding it.
 *
 * <p>Openers are resolved innermost first: a frame that meets another scope-opener suspends until that one is
 * resolved and continues after the region it consumed. Frames live on an explicit stack so that deeply nested
 * input cannot exhaust the call stack. Each opener is resolved at most once per run.
 *
 * <p>Requires bracket partners and parenthesis stacks from the earlier stages.
 */
public final class ScopeResolver implements AnnotationStage {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScopeResolver.class);

    private static final int NONE = TokenStream.NONE;
    private static final int CONTINUE = -2;
    private static final int DESCEND = Integer.MIN_VALUE;

    private final LanguagePolicy policy;

    public ScopeResolver(LanguagePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    @Override
    public String name() {
        return "scope-map";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        new Resolution(stream).run();
        return stream;
    }

    private enum ChildMode {
        /** The child sits somewhere inside the region being scanned. */
        NESTED,
        /** The child is the single statement forming a braceless body. */
        BRACELESS_BODY
    }

    private static final class Frame {
        final int stackPtr;
        final ScopeOpenerRule rule;
        final int headEnd;
        final int startLine;
        final int depth;
        final int originalIgnore;
        int opener = NONE;
        int position;
        boolean started;
        boolean bodyStarted;
        int child = NONE;
        int childResult = NONE;
        ChildMode childMode;
        int armCloser = NONE;

        Frame(int stackPtr, ScopeOpenerRule rule, int headEnd, int startLine, int depth, int originalIgnore) {
            this.stackPtr = stackPtr;
            this.rule = rule;
            this.headEnd = headEnd;
            this.startLine = startLine;
            this.depth = depth;
            this.originalIgnore = originalIgnore;
            this.position = stackPtr;
        }
    }

    private final class Resolution {
        private final TokenStream stream;
        private final boolean[] attempted;
        private final int[] results;
        private final Map<Integer, Set<Integer>> closerOwners = new TreeMap<>();
        private int ignore;

        Resolution(TokenStream stream) {
            this.stream = stream;
            this.attempted = new boolean[stream.size()];
            this.results = new int[stream.size()];
            Arrays.fill(results, NONE);
        }

        void run() {
            for (int i = 0; i < stream.size(); i++) {
                if (policy.isScopeOpener(stream.kind(i)) && !attempted[i]) {
                    ignore = 0;
                    resolve(i);
                }
            }
            reportAmbiguousClosers();
        }

        private void resolve(int root) {
            Deque<Frame> frames = new ArrayDeque<>();
            attempted[root] = true;
            frames.push(frame(root));
            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                int outcome = advance(frame);
                if (outcome == DESCEND) {
                    int child = frame.child;
                    if (attempted[child]) {
                        frame.childResult = results[child];
                    } else {
                        attempted[child] = true;
                        frames.push(frame(child));
                    }
                    continue;
                }
                frames.pop();
                results[frame.stackPtr] = outcome;
                if (!frames.isEmpty()) {
                    frames.peek().childResult = outcome;
                }
            }
        }

        private Frame frame(int stackPtr) {
            ScopeOpenerRule rule = policy.rule(stream.kind(stackPtr))
                    .orElseThrow(() -> new IllegalStateException("No scope rule for " + stream.kind(stackPtr)));
            int headEnd = stackPtr;
            int parenOpener = stream.ownedParenthesisOpener(stackPtr);
            if (parenOpener != NONE && parenOpener > stackPtr) {
                headEnd = stream.ownedParenthesisCloser(stackPtr);
            }
            return new Frame(stackPtr, rule, headEnd, stream.get(headEnd).line(),
                    stream.get(stackPtr).parenthesisStack().size(), ignore);
        }

        private int advance(Frame frame) {
            if (frame.child != NONE && frame.childResult != NONE) {
                int child = frame.child;
                int returned = frame.childResult;
                frame.child = NONE;
                frame.childResult = NONE;
                if (frame.childMode == ChildMode.BRACELESS_BODY) {
                    return finishBraceless(frame, child);
                }
                frame.position = returned;
                if (frame.opener != NONE && stream.kind(frame.opener) == TokenKind.OPEN_CURLY_BRACKET) {
                    int partner = stream.bracketPartner(frame.opener);
                    if (frame.position >= partner) {
                        frame.position = partner - 1;
                    }
                }
            } else if (!frame.started) {
                frame.started = true;
                int next = stream.nextNonEmpty(frame.stackPtr + 1);
                if (next != NONE && frame.rule.notFollowedBy().contains(stream.kind(next))) {
                    return frame.stackPtr;
                }
            }

            for (int i = frame.position + 1; i < stream.size(); i++) {
                frame.position = i;
                int outcome = frame.opener == NONE ? seekBody(frame, i) : scanBody(frame, i);
                if (outcome != CONTINUE) {
                    return outcome;
                }
            }
            if (frame.opener == NONE) {
                return giveUp(frame, "no body found before the end of the file");
            }
            return giveUp(frame, "body opened on line " + stream.get(frame.opener).line() + " is never closed");
        }

        private int seekBody(Frame frame, int i) {
            TokenKind kind = stream.kind(i);

            if (policy.isBracketCloser(kind)) {
                int partner = stream.bracketPartner(i);
                if (partner != NONE && partner < frame.stackPtr) {
                    return giveUp(frame, "enclosing block ends on line " + stream.get(i).line() + " before a body");
                }
            }

            if (i <= frame.headEnd) {
                return policy.isScopeOpener(kind) ? descend(frame, i, ChildMode.NESTED) : CONTINUE;
            }

            if (!frame.rule.strict() && !frame.bodyStarted
                    && stream.get(i).line() > frame.startLine + policy.openerSearchLineLimit()) {
                return giveUp(frame, "no body within " + policy.openerSearchLineLimit() + " lines");
            }

            if (frame.rule.startsWith(kind) && acceptsStart(frame, i, kind)) {
                if (kind == TokenKind.OPEN_CURLY_BRACKET && stream.bracketPartner(i) == NONE) {
                    return giveUp(frame, "body brace on line " + stream.get(i).line() + " is never closed");
                }
                frame.opener = i;
                return CONTINUE;
            }

            if (policy.isScopeOpener(kind)) {
                if (stream.previousNonEmpty(i - 1) == frame.headEnd) {
                    if (frame.rule.braceless()) {
                        return descend(frame, i, ChildMode.BRACELESS_BODY);
                    }
                    return giveUp(frame, "found '" + stream.content(i) + "' before the body");
                }
                return descend(frame, i, ChildMode.NESTED);
            }

            if (policy.statementTerminators().contains(kind)
                    && stream.get(i).parenthesisStack().size() == frame.depth) {
                if (frame.rule.braceless()) {
                    return endBraceless(frame, i);
                }
                // Declaration without a body.
                ignore = frame.originalIgnore;
                return i;
            }

            if (!kind.isEmpty()) {
                frame.bodyStarted = true;
            }
            return CONTINUE;
        }

        private boolean acceptsStart(Frame frame, int i, TokenKind kind) {
            int previous = stream.previousNonEmpty(i - 1);
            if (kind == TokenKind.OPEN_CURLY_BRACKET) {
                return previous == NONE || !policy.nonScopeBracePredecessors().contains(stream.kind(previous));
            }
            return previous == frame.headEnd || frame.rule.shared();
        }

        private int scanBody(Frame frame, int i) {
            TokenKind kind = stream.kind(i);
            boolean curly = stream.kind(frame.opener) == TokenKind.OPEN_CURLY_BRACKET;

            if (!curly && frame.rule.shared() && kind == TokenKind.OPEN_CURLY_BRACKET
                    && stream.previousNonEmpty(i - 1) == frame.opener && stream.bracketPartner(i) != NONE) {
                // case 1: { ... } is bounded by its braces.
                frame.opener = i;
                return CONTINUE;
            }

            if (curly) {
                if (kind == TokenKind.CLOSE_CURLY_BRACKET && stream.bracketPartner(i) == frame.opener) {
                    return close(frame, i);
                }
            } else if (frame.rule.endsWith(kind)
                    && (stream.scopeOpener(i) == NONE || frame.rule.shared())) {
                if (kind == TokenKind.CLOSE_CURLY_BRACKET && ignore > 0) {
                    ignore--;
                    return CONTINUE;
                }
                return close(frame, i);
            }

            if (policy.isScopeOpener(kind)) {
                return descend(frame, i, ChildMode.NESTED);
            }

            if (curly) {
                return CONTINUE;
            }
            if (kind == TokenKind.OPEN_CURLY_BRACKET) {
                ignore++;
                return CONTINUE;
            }
            if (kind == TokenKind.CLOSE_CURLY_BRACKET) {
                if (ignore > 0) {
                    ignore--;
                    return CONTINUE;
                }
                return pretendClose(frame, i);
            }
            if (policy.endScopeTokens().contains(kind) && stream.scopeCondition(i) == NONE) {
                return pretendClose(frame, i);
            }
            return CONTINUE;
        }

        private int descend(Frame frame, int child, ChildMode mode) {
            frame.child = child;
            frame.childMode = mode;
            return DESCEND;
        }

        private int close(Frame frame, int closer) {
            record(frame, frame.opener, closer, true);
            markTrailer(frame, closer);
            if (frame.rule.shared()) {
                ignore = frame.originalIgnore;
                return stream.kind(frame.opener) == TokenKind.OPEN_CURLY_BRACKET ? closer : frame.opener;
            }
            return policy.isScopeOpener(stream.kind(closer)) ? closer - 1 : closer;
        }

        /**
         * The body ends where an enclosing construct ends; the token itself belongs to that construct.
         */
        private int pretendClose(Frame frame, int closer) {
            record(frame, frame.opener, closer, false);
            return closer - 1;
        }

        /**
         * The single statement forming a braceless body has resolved. An {@code if} statement keeps its
         * {@code else}/{@code elseif} arms, so the body runs on through them.
         */
        private int finishBraceless(Frame frame, int child) {
            int closer = stream.scopeCloser(child);
            if (closer == NONE) {
                if (frame.armCloser == NONE) {
                    return giveUp(frame, "braceless body starting on line " + stream.get(child).line()
                            + " does not resolve");
                }
                return endBraceless(frame, frame.armCloser);
            }
            ScopeOpenerRule childRule = policy.rule(stream.kind(child)).orElseThrow();
            closer = throughTrailer(childRule, closer);

            int next = policy.isScopeOpener(stream.kind(closer)) ? closer : stream.nextNonEmpty(closer + 1);
            if (next != NONE && continuesStatement(frame, childRule, next)) {
                frame.armCloser = closer;
                return descend(frame, next, ChildMode.BRACELESS_BODY);
            }
            return endBraceless(frame, closer);
        }

        /**
         * A later arm of the same kind as the frame belongs to the frame's own chain, so {@code else if ... else}
         * stays flat.
         */
        private boolean continuesStatement(Frame frame, ScopeOpenerRule childRule, int next) {
            TokenKind kind = stream.kind(next);
            return childRule.endsWith(kind) && policy.isScopeOpener(kind) && kind != frame.rule.kind();
        }

        private int endBraceless(Frame frame, int closer) {
            closer = throughTrailer(frame.rule, closer);
            record(frame, NONE, closer, true);
            return policy.isScopeOpener(stream.kind(closer)) ? closer - 1 : closer;
        }

        /**
         * Extends a closer over {@code while (...);} after a {@code do} body.
         */
        private int throughTrailer(ScopeOpenerRule rule, int closer) {
            if (rule.trailer().isEmpty()) {
                return closer;
            }
            int trailer = stream.nextNonEmpty(closer + 1);
            if (trailer == NONE || stream.kind(trailer) != rule.trailer().get()) {
                return closer;
            }
            int parenCloser = stream.ownedParenthesisCloser(trailer);
            int terminator = parenCloser == NONE ? NONE : stream.nextNonEmpty(parenCloser + 1);
            if (terminator == NONE || !policy.statementTerminators().contains(stream.kind(terminator))) {
                return closer;
            }
            skip(trailer);
            return terminator;
        }

        private void markTrailer(Frame frame, int closer) {
            if (frame.rule.trailer().isEmpty()) {
                return;
            }
            int trailer = stream.nextNonEmpty(closer + 1);
            if (trailer != NONE && stream.kind(trailer) == frame.rule.trailer().get()) {
                skip(trailer);
            }
        }

        private void skip(int trailer) {
            if (!attempted[trailer]) {
                attempted[trailer] = true;
                results[trailer] = trailer;
            }
        }

        private void record(Frame frame, int opener, int closer, boolean ownsCloser) {
            int condition = frame.stackPtr;
            stream.setScope(condition, condition, opener, closer);
            if (opener != NONE) {
                stream.setScope(opener, condition, opener, closer);
            }
            if (!frame.rule.shared()) {
                closerOwners.computeIfAbsent(closer, key -> new LinkedHashSet<>()).add(condition);
            }
            if (ownsCloser && !policy.isScopeOpener(stream.kind(closer))
                    && (stream.scopeCondition(closer) == NONE
                    || policy.closingOwnerPolicy() == ClosingOwnerPolicy.OUTERMOST)) {
                stream.setScope(closer, condition, opener, closer);
            }
            LOGGER.trace("Scope of {} at {} closes at {}", stream.kind(condition), condition, closer);
        }

        private int giveUp(Frame frame, String reason) {
            ignore = frame.originalIgnore;
            stream.addWarning(StructuralWarning.Kind.UNRESOLVED_SCOPE, frame.stackPtr,
                    "Scope of '" + stream.content(frame.stackPtr) + "' on line " + stream.get(frame.stackPtr).line()
                            + " is unresolved: " + reason);
            return frame.stackPtr;
        }

        private void reportAmbiguousClosers() {
            for (Map.Entry<Integer, Set<Integer>> entry : closerOwners.entrySet()) {
                Set<Integer> owners = entry.getValue();
                if (owners.size() < policy.ambiguousSharedCloserThreshold()) {
                    continue;
                }
                String openers = owners.stream()
                        .map(owner -> "'" + stream.content(owner) + "'@" + stream.get(owner).line())
                        .collect(Collectors.joining(", "));
                stream.addWarning(StructuralWarning.Kind.AMBIGUOUS_SHARED_CLOSER, entry.getKey(),
                        owners.size() + " scopes close at the same token: " + openers);
            }
        }
    }
}
