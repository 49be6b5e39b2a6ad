package ai.codesniff.lint.token;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Category tag of a token. Keyword kinds carry the source spellings that map onto them.
 */
public enum TokenKind {
    OPEN_TAG,
    OPEN_TAG_WITH_ECHO,
    CLOSE_TAG,
    INLINE_HTML(Flags.TABS),
    WHITESPACE(Flags.EMPTY | Flags.TABS),
    COMMENT(Flags.EMPTY | Flags.TABS),
    DOC_COMMENT(Flags.EMPTY | Flags.TABS),
    VARIABLE,
    IDENTIFIER,
    NUMBER,
    CONSTANT_STRING(Flags.TABS),
    DOUBLE_QUOTED_STRING(Flags.TABS),

    ABSTRACT("abstract"),
    ARRAY("array"),
    AS("as"),
    BREAK("break"),
    CASE("case"),
    CATCH("catch"),
    CLASS("class"),
    CONST("const"),
    CONTINUE("continue"),
    DECLARE("declare"),
    DEFAULT("default"),
    DO("do"),
    ECHO("echo"),
    ELSE("else"),
    ELSEIF("elseif"),
    EMPTY("empty"),
    ENDDECLARE("enddeclare"),
    ENDFOR("endfor"),
    ENDFOREACH("endforeach"),
    ENDIF("endif"),
    ENDSWITCH("endswitch"),
    ENDWHILE("endwhile"),
    ENUM("enum"),
    EXIT("exit", "die"),
    EXTENDS("extends"),
    FINAL("final"),
    FINALLY("finally"),
    FN("fn"),
    FOR("for"),
    FOREACH("foreach"),
    FUNCTION("function"),
    GLOBAL("global"),
    IF("if"),
    IMPLEMENTS("implements"),
    INCLUDE("include", "include_once"),
    INSTANCEOF("instanceof"),
    INTERFACE("interface"),
    ISSET("isset"),
    LIST("list"),
    MATCH("match"),
    NAMESPACE("namespace"),
    NEW("new"),
    PRINT("print"),
    PRIVATE("private"),
    PROTECTED("protected"),
    PUBLIC("public"),
    READONLY("readonly"),
    REQUIRE("require", "require_once"),
    RETURN("return"),
    STATIC("static"),
    SWITCH("switch"),
    THROW("throw"),
    TRAIT("trait"),
    TRY("try"),
    UNSET("unset"),
    USE("use"),
    VAR("var"),
    WHILE("while"),
    YIELD("yield"),

    OPEN_CURLY_BRACKET,
    CLOSE_CURLY_BRACKET,
    OPEN_SQUARE_BRACKET,
    CLOSE_SQUARE_BRACKET,
    OPEN_PARENTHESIS,
    CLOSE_PARENTHESIS,
    SEMICOLON,
    COLON,
    DOUBLE_COLON,
    COMMA,
    EQUAL,
    ASSIGNMENT,
    DOUBLE_ARROW,
    OBJECT_OPERATOR,
    NULLSAFE_OBJECT_OPERATOR,
    INLINE_THEN,
    NS_SEPARATOR,
    OPERATOR,
    UNKNOWN;

    private static final Map<String, TokenKind> KEYWORDS;

    static {
        Map<String, TokenKind> keywords = new HashMap<>();
        for (TokenKind kind : values()) {
            for (String spelling : kind.spellings) {
                keywords.put(spelling, kind);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(keywords);
    }

    private final int flags;
    private final String[] spellings;

    TokenKind() {
        this(0);
    }

    TokenKind(int flags) {
        this.flags = flags;
        this.spellings = new String[0];
    }

    TokenKind(String... spellings) {
        this.flags = Flags.KEYWORD;
        this.spellings = spellings;
    }

    /**
     * Whitespace and comments: tokens that structural lookups skip over.
     */
    public boolean isEmpty() {
        return (flags & Flags.EMPTY) != 0;
    }

    public boolean isKeyword() {
        return (flags & Flags.KEYWORD) != 0;
    }

    /**
     * Whether tab characters inside tokens of this kind are expanded to spaces.
     */
    public boolean expandsTabs() {
        return (flags & Flags.TABS) != 0;
    }

    public static Optional<TokenKind> keyword(String word) {
        if (word == null || word.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(KEYWORDS.get(word.toLowerCase(Locale.ROOT)));
    }

    public static TokenKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Token kind must be provided");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (TokenKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown token kind: " + raw);
    }

    private static final class Flags {
        private static final int EMPTY = 1;
        private static final int TABS = 1 << 1;
        private static final int KEYWORD = 1 << 2;
    }
}
