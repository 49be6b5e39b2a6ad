package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.language.LanguagePolicyLoader;
import ai.codesniff.lint.lexer.PhpLexer;
import ai.codesniff.lint.token.TokenStream;

final class AnnotationFixtures {

    static final LanguagePolicy PHP = new LanguagePolicyLoader().loadDefault("php");

    private AnnotationFixtures() {
    }

    static AnnotatedFile annotate(String source) {
        return annotate(source, PHP);
    }

    static AnnotatedFile annotate(String source, LanguagePolicy policy) {
        return new AnnotationPipeline(new PhpLexer(), policy, 4).annotate(source);
    }

    static TokenStream lex(String source) {
        return TokenStream.of(new PhpLexer().tokenize(source));
    }

    /**
     * Index of the {@code occurrence}-th token (1-based) whose content is exactly {@code content}.
     */
    static int indexOf(AnnotatedFile file, String content, int occurrence) {
        int seen = 0;
        for (int i = 0; i < file.size(); i++) {
            if (file.get(i).content().equals(content) && ++seen == occurrence) {
                return i;
            }
        }
        throw new AssertionError("No occurrence " + occurrence + " of '" + content + "'");
    }

    static int indexOf(AnnotatedFile file, String content) {
        return indexOf(file, content, 1);
    }
}
