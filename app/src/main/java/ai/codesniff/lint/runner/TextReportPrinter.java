package ai.codesniff.lint.runner;

import ai.codesniff.lint.rules.Violation;
import java.io.PrintWriter;
import java.util.Locale;

/**
 * Prints one block per file with violations and a closing totals line.
 */
public class TextReportPrinter {

    private static final String RULE = "-".repeat(80);

    public void print(RunSummary summary, PrintWriter out) {
        for (FileReport report : summary.reports()) {
            if (report.violations().isEmpty()) {
                continue;
            }
            out.println();
            out.println("FILE: " + report.path());
            out.println(RULE);
            out.println(headline(report));
            out.println(RULE);
            int width = report.violations().stream()
                    .mapToInt(violation -> Integer.toString(violation.line()).length())
                    .max()
                    .orElse(1);
            for (Violation violation : report.violations()) {
                out.printf(Locale.ROOT, " %" + width + "d | %-7s | %s (%s)%n", violation.line(),
                        violation.severity().name(), violation.message(), violation.source());
            }
            out.println(RULE);
        }
        out.printf(Locale.ROOT, "Checked %d %s: %d %s, %d %s%n",
                summary.reports().size(), plural(summary.reports().size(), "file"),
                summary.errorCount(), plural(summary.errorCount(), "error"),
                summary.warningCount(), plural(summary.warningCount(), "warning"));
        out.flush();
    }

    private static String headline(FileReport report) {
        StringBuilder builder = new StringBuilder("FOUND ");
        long errors = report.errorCount();
        long warnings = report.warningCount();
        if (errors > 0) {
            builder.append(errors).append(' ').append(plural(errors, "ERROR"));
            if (warnings > 0) {
                builder.append(" AND ");
            }
        }
        if (warnings > 0) {
            builder.append(warnings).append(' ').append(plural(warnings, "WARNING"));
        }
        long lines = report.affectedLines();
        builder.append(" AFFECTING ").append(lines).append(' ').append(plural(lines, "LINE"));
        return builder.toString();
    }

    private static String plural(long count, String word) {
        if (count == 1) {
            return word;
        }
        return word + (Character.isUpperCase(word.charAt(word.length() - 1)) ? "S" : "s");
    }
}
