package ai.codesniff.lint.runner;

import ai.codesniff.lint.rules.Severity;
import ai.codesniff.lint.rules.Violation;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of checking one file.
 *
 * @param failed processing stopped early because reading or annotating the file threw
 */
public record FileReport(Path path, List<Violation> violations, boolean failed) {

    public FileReport {
        Objects.requireNonNull(path, "path");
        violations = violations == null ? List.of() : violations.stream()
                .sorted(Comparator.comparingInt(Violation::line).thenComparingInt(Violation::column))
                .toList();
    }

    public long errorCount() {
        return violations.stream().filter(violation -> violation.severity() == Severity.ERROR).count();
    }

    public long warningCount() {
        return violations.stream().filter(violation -> violation.severity() == Severity.WARNING).count();
    }

    public long affectedLines() {
        return violations.stream().mapToInt(Violation::line).distinct().count();
    }
}
