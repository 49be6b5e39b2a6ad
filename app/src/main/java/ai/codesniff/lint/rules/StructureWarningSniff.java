package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.TokenKind;
import java.util.Set;

/**
 * Reports the structural problems the annotation pipeline ran into as warnings on the affected tokens.
 */
public class StructureWarningSniff implements Sniff {

    @Override
    public String name() {
        return "Internal.Structure";
    }

    @Override
    public Set<TokenKind> register() {
        return Set.of(TokenKind.OPEN_TAG, TokenKind.OPEN_TAG_WITH_ECHO, TokenKind.INLINE_HTML);
    }

    @Override
    public int process(SniffFile file, int stackPtr) {
        for (StructuralWarning warning : file.structuralWarnings()) {
            file.addWarning("%s", warning.tokenIndex(), warning.kind().code(), warning.message());
        }
        return file.numTokens();
    }
}
