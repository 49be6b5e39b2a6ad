package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.token.TokenStream;

/**
 * Assigns 1-based line and column numbers and expands tabs in the token kinds that may carry them.
 */
public final class PositionAnnotator implements AnnotationStage {

    private final int tabWidth;

    /**
     * @param tabWidth columns per tab stop; {@code 0} keeps tabs as single columns
     */
    public PositionAnnotator(int tabWidth) {
        if (tabWidth < 0) {
            throw new IllegalArgumentException("tabWidth must be zero or greater");
        }
        this.tabWidth = tabWidth;
    }

    @Override
    public String name() {
        return "position-map";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        int line = 1;
        int column = 1;
        for (int i = 0; i < stream.size(); i++) {
            String content = stream.content(i);
            int length;
            if (tabWidth > 0 && stream.kind(i).expandsTabs() && content.indexOf('\t') >= 0) {
                Expansion expansion = replaceTabs(content, column, tabWidth);
                stream.replaceContent(i, expansion.content(), expansion.length());
                content = expansion.content();
                length = expansion.length();
            } else {
                length = width(content);
            }

            int lastBreak = content.lastIndexOf('\n');
            if (lastBreak < 0) {
                stream.setPosition(i, line, column, length);
                column += length;
                continue;
            }

            stream.setPosition(i, line, column, length - terminatorLength(content));
            line += countLines(content);
            column = 1 + width(content.substring(lastBreak + 1));
        }
        return stream;
    }

    /**
     * Replaces tabs by the spaces they stand for when the text starts at {@code column}.
     *
     * @param tabWidth columns per tab stop; {@code 0} is treated as {@code 1}
     */
    public static Expansion replaceTabs(String content, int column, int tabWidth) {
        int width = Math.max(tabWidth, 1);
        if (content.chars().allMatch(ch -> ch == '\t')) {
            int tabs = content.length();
            int firstTab = width - ((column - 1) % width);
            int length = tabs == 0 ? 0 : firstTab + width * (tabs - 1);
            return new Expansion(" ".repeat(length), length);
        }

        StringBuilder expanded = new StringBuilder(content.length());
        int current = column;
        String[] segments = content.split("\t", -1);
        for (int s = 0; s < segments.length; s++) {
            String segment = segments[s];
            expanded.append(segment);
            current += width(segment);
            if (s == segments.length - 1) {
                break;
            }
            int spaces;
            if (current % width == 0) {
                spaces = 1;
            } else {
                int next = ((current / width) + 1) * width + 1;
                spaces = next - current;
            }
            expanded.append(" ".repeat(spaces));
            current += spaces;
        }
        return new Expansion(expanded.toString(), current - column);
    }

    static int width(String text) {
        return text.codePointCount(0, text.length());
    }

    private static int terminatorLength(String content) {
        if (content.endsWith("\r\n")) {
            return 2;
        }
        return content.endsWith("\n") ? 1 : 0;
    }

    private static int countLines(String content) {
        int count = 0;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    /**
     * Expanded text and its display width.
     */
    public record Expansion(String content, int length) {
    }
}
