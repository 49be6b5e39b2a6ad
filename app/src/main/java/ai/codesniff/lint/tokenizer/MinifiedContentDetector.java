package ai.codesniff.lint.tokenizer;

/**
 * Pre-flight check for content that is effectively one enormous line, which is not worth annotating.
 */
public final class MinifiedContentDetector {

    public static final int MAX_AVERAGE_LINE_LENGTH = 100;

    private MinifiedContentDetector() {
    }

    public static boolean isMinified(String content) {
        if (content == null || content.isEmpty()) {
            return false;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                lines++;
            }
        }
        return content.length() / lines > MAX_AVERAGE_LINE_LENGTH;
    }
}
