package ai.codesniff.lint.runner;

import java.util.List;

/**
 * Reports of all files checked in one run, in the order the files were collected.
 */
public record RunSummary(List<FileReport> reports) {

    public static final int EXIT_CLEAN = 0;
    public static final int EXIT_VIOLATIONS = 1;
    public static final int EXIT_PROCESSING_ERROR = 3;

    public RunSummary {
        reports = reports == null ? List.of() : List.copyOf(reports);
    }

    public long errorCount() {
        return reports.stream().mapToLong(FileReport::errorCount).sum();
    }

    public long warningCount() {
        return reports.stream().mapToLong(FileReport::warningCount).sum();
    }

    public int exitCode() {
        if (reports.stream().anyMatch(FileReport::failed)) {
            return EXIT_PROCESSING_ERROR;
        }
        return errorCount() + warningCount() > 0 ? EXIT_VIOLATIONS : EXIT_CLEAN;
    }
}
