package ai.codesniff.lint.rules;

import ai.codesniff.lint.token.TokenKind;
import ai.codesniff.lint.tokenizer.AnnotatedFile;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks an annotated file once and hands every token to the sniffs listening for its kind.
 */
public class RuleEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleEngine.class);

    static final String INTERNAL_EXCEPTION = "Internal.Exception";

    private final List<Sniff> sniffs;
    private final Map<TokenKind, List<Sniff>> listeners = new EnumMap<>(TokenKind.class);

    public RuleEngine(List<Sniff> sniffs) {
        this.sniffs = List.copyOf(Objects.requireNonNull(sniffs, "sniffs"));
        for (Sniff sniff : this.sniffs) {
            for (TokenKind kind : sniff.register()) {
                listeners.computeIfAbsent(kind, key -> new ArrayList<>()).add(sniff);
            }
        }
    }

    public static RuleEngine withDefaultSniffs() {
        return new RuleEngine(List.of(
                new SideEffectsSniff(),
                new EmbeddedCodeSniff(),
                new NestingLevelSniff(),
                new StructureWarningSniff()));
    }

    public List<Sniff> sniffs() {
        return sniffs;
    }

    public List<Violation> process(Path path, AnnotatedFile annotated) {
        SniffFile file = new SniffFile(path, annotated);
        Map<Sniff, Integer> resumeAt = new IdentityHashMap<>();
        Sniff current = null;
        try {
            for (int i = 0; i < file.numTokens(); i++) {
                List<Sniff> interested = listeners.get(file.token(i).kind());
                if (interested == null) {
                    continue;
                }
                for (Sniff sniff : interested) {
                    if (resumeAt.getOrDefault(sniff, 0) > i) {
                        continue;
                    }
                    current = sniff;
                    file.activeSniff(sniff.name());
                    int next = sniff.process(file, i);
                    if (next > i) {
                        resumeAt.put(sniff, next);
                    }
                }
            }
        } catch (RuntimeException ex) {
            String sniffName = current == null ? "unknown" : current.name();
            LOGGER.error("Sniff {} failed on {}", sniffName, path, ex);
            file.addErrorOnLine("An error occurred during processing; checking has been aborted. The error message was: "
                    + ex.getMessage(), 1, INTERNAL_EXCEPTION);
        }
        return file.violations();
    }
}
