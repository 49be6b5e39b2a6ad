package ai.codesniff.lint.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import ai.codesniff.lint.token.RawToken;
import ai.codesniff.lint.token.TokenKind;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class PhpLexerTest {

    private final PhpLexer lexer = new PhpLexer();

    @Test
    void splitsInlineHtmlAndCode() {
        List<RawToken> tokens = lexer.tokenize("<p><?php echo $a; ?></p>");

        assertThat(tokens).extracting(RawToken::kind).containsExactly(
                TokenKind.INLINE_HTML,
                TokenKind.OPEN_TAG,
                TokenKind.ECHO,
                TokenKind.WHITESPACE,
                TokenKind.VARIABLE,
                TokenKind.SEMICOLON,
                TokenKind.WHITESPACE,
                TokenKind.CLOSE_TAG,
                TokenKind.INLINE_HTML);
    }

    @Test
    void keywordsAreCaseInsensitiveButNotAfterMemberAccess() {
        List<RawToken> tokens = significant("<?php IF ($a->class) Foo::list();");

        assertThat(tokens).extracting(RawToken::kind).containsExactly(
                TokenKind.OPEN_TAG,
                TokenKind.IF,
                TokenKind.OPEN_PARENTHESIS,
                TokenKind.VARIABLE,
                TokenKind.OBJECT_OPERATOR,
                TokenKind.IDENTIFIER,
                TokenKind.CLOSE_PARENTHESIS,
                TokenKind.IDENTIFIER,
                TokenKind.DOUBLE_COLON,
                TokenKind.IDENTIFIER,
                TokenKind.OPEN_PARENTHESIS,
                TokenKind.CLOSE_PARENTHESIS,
                TokenKind.SEMICOLON);
    }

    @Test
    void multiLineTokensEndAtEachLineTerminator() {
        List<RawToken> tokens = lexer.tokenize("<?php\n/* one\ntwo */ $s = 'a\nb';");

        assertThat(tokens).extracting(RawToken::text)
                .contains("/* one\n", "two */", "'a\n", "b'");
    }

    @Test
    void tokensCoverInputWithoutGaps() {
        String source = "<?php\n#[Attr]\nfunction f(int ...$x): ?int { return $x ?? null; } // done\n?>\ntail";

        List<RawToken> tokens = lexer.tokenize(source);

        assertThat(tokens.stream().map(RawToken::text).collect(Collectors.joining())).isEqualTo(source);
        int offset = 0;
        for (RawToken token : tokens) {
            assertThat(token.offset()).isEqualTo(offset);
            offset += token.text().length();
        }
    }

    @Test
    void unterminatedCommentRunsToEnd() {
        List<RawToken> tokens = lexer.tokenize("<?php /* never closed");

        assertThat(tokens).last().extracting(RawToken::kind).isEqualTo(TokenKind.COMMENT);
    }

    @Test
    void unknownCharactersBecomeTheirOwnTokens() {
        List<RawToken> tokens = significant("<?php `ls`;");

        assertThat(tokens).extracting(RawToken::kind)
                .containsExactly(TokenKind.OPEN_TAG, TokenKind.UNKNOWN, TokenKind.IDENTIFIER, TokenKind.UNKNOWN,
                        TokenKind.SEMICOLON);
    }

    @Test
    void invalidBytesFallBackToOneCharacterPerByte() {
        byte[] bytes = {'<', '?', 'p', 'h', 'p', ' ', (byte) 0xE9, ';'};

        String decoded = SourceText.decode(bytes, StandardCharsets.UTF_8);

        assertThat(decoded).hasSize(8);
        assertThat(decoded.charAt(6)).isEqualTo('é');
    }

    private List<RawToken> significant(String source) {
        return lexer.tokenize(source).stream()
                .filter(token -> !token.kind().isEmpty())
                .toList();
    }
}
