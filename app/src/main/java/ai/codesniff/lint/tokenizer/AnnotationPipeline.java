package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.lexer.Lexer;
import ai.codesniff.lint.token.TokenStream;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tokenizes content and runs the annotation stages in their fixed order.
 *
 * <p>The pipeline holds configuration only; every {@link #annotate(String)} call works on a fresh stream, so one
 * instance may serve several threads.
 */
public final class AnnotationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnnotationPipeline.class);

    private final Lexer lexer;
    private final List<AnnotationStage> stages;

    public AnnotationPipeline(Lexer lexer, LanguagePolicy policy, int tabWidth) {
        this.lexer = Objects.requireNonNull(lexer, "lexer");
        Objects.requireNonNull(policy, "policy");
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must be zero or greater");
        }
        this.stages = List.of(
                new PositionAnnotator(tabWidth),
                new SuppressionAnnotator(),
                new BracketMatcher(policy),
                new ParenthesisNestingResolver(policy),
                new ScopeResolver(policy),
                new LevelAnnotator());
    }

    public AnnotatedFile annotate(String content) {
        Objects.requireNonNull(content, "content");
        TokenStream stream = TokenStream.of(lexer.tokenize(content));
        LOGGER.debug("Tokenized {} characters into {} tokens", content.length(), stream.size());
        for (AnnotationStage stage : stages) {
            long started = System.nanoTime();
            int warningsBefore = stream.warnings().size();
            stream = stage.annotate(stream);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Stage {} finished in {} us with {} new structural warnings", stage.name(),
                        (System.nanoTime() - started) / 1_000, stream.warnings().size() - warningsBefore);
            }
        }
        return AnnotatedFile.of(stream);
    }

    List<AnnotationStage> stages() {
        return stages;
    }
}
