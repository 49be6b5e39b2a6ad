package ai.codesniff.lint.rules;

import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.language.LanguagePolicyLoader;
import ai.codesniff.lint.lexer.PhpLexer;
import ai.codesniff.lint.tokenizer.AnnotatedFile;
import ai.codesniff.lint.tokenizer.AnnotationPipeline;
import java.nio.file.Path;
import java.util.List;

final class SniffFixtures {

    private static final LanguagePolicy PHP = new LanguagePolicyLoader().loadDefault("php");
    private static final AnnotationPipeline PIPELINE = new AnnotationPipeline(new PhpLexer(), PHP, 4);

    private SniffFixtures() {
    }

    static AnnotatedFile annotate(String source) {
        return PIPELINE.annotate(source);
    }

    static List<Violation> check(Sniff sniff, String source) {
        return new RuleEngine(List.of(sniff)).process(Path.of("sample.php"), annotate(source));
    }
}
