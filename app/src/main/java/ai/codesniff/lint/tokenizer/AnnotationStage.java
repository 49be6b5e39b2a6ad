package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.token.TokenStream;

/**
 * One pass of the annotation pipeline. A stage takes the stream over, fills in its fields and hands the same
 * stream on; it never removes tokens or touches fields owned by later stages.
 */
public interface AnnotationStage {

    String name();

    TokenStream annotate(TokenStream stream);
}
