package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.Token;
import ai.codesniff.lint.token.TokenStream;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Result of one pipeline run: the annotated tokens and everything the pipeline noticed on the way.
 *
 * <p>The token list is read-only; rules query it but never change it.
 */
public record AnnotatedFile(List<Token> tokens,
                            List<StructuralWarning> warnings,
                            Set<Integer> ignoredLines,
                            boolean fileIgnored) {

    public AnnotatedFile {
        tokens = tokens == null ? List.of() : tokens;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        ignoredLines = ignoredLines == null ? Set.of() : Set.copyOf(ignoredLines);
    }

    static AnnotatedFile of(TokenStream stream) {
        List<StructuralWarning> sorted = stream.warnings().stream()
                .sorted(Comparator.comparingInt(StructuralWarning::tokenIndex))
                .toList();
        return new AnnotatedFile(stream.tokens(), sorted, stream.ignoredLines(), stream.fileIgnored());
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public boolean isLineIgnored(int line) {
        return fileIgnored || ignoredLines.contains(line);
    }
}
