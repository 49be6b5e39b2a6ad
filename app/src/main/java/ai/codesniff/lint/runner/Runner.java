package ai.codesniff.lint.runner;

import ai.codesniff.lint.config.Config;
import ai.codesniff.lint.git.GitChangedFileFilter;
import ai.codesniff.lint.lexer.SourceText;
import ai.codesniff.lint.rules.RuleEngine;
import ai.codesniff.lint.rules.Severity;
import ai.codesniff.lint.rules.Violation;
import ai.codesniff.lint.tokenizer.AnnotatedFile;
import ai.codesniff.lint.tokenizer.AnnotationPipeline;
import ai.codesniff.lint.tokenizer.MinifiedContentDetector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Checks every collected file: read, annotate, run the sniffs.
 *
 * <p>Files are independent; with a parallelism above one they are spread over a fixed thread pool, each task
 * running its own pipeline pass. Reports come back in collection order.
 */
public class Runner {

    private static final Logger LOGGER = LoggerFactory.getLogger(Runner.class);

    static final String MDC_FILE = "file";
    static final String MINIFIED = "Internal.Tokenizer.Minified";
    static final String INTERNAL_EXCEPTION = "Internal.Exception";

    private final Config config;
    private final AnnotationPipeline pipeline;
    private final RuleEngine ruleEngine;
    private final FileCollector fileCollector;
    private final GitChangedFileFilter gitFilter;

    public Runner(Config config, AnnotationPipeline pipeline, RuleEngine ruleEngine) {
        this(config, pipeline, ruleEngine, new FileCollector(config.extensions()), new GitChangedFileFilter());
    }

    Runner(Config config, AnnotationPipeline pipeline, RuleEngine ruleEngine, FileCollector fileCollector,
           GitChangedFileFilter gitFilter) {
        this.config = Objects.requireNonNull(config, "config");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine");
        this.fileCollector = Objects.requireNonNull(fileCollector, "fileCollector");
        this.gitFilter = Objects.requireNonNull(gitFilter, "gitFilter");
    }

    public RunSummary run() {
        List<Path> files = fileCollector.collect(config.paths());
        if (config.gitModified()) {
            files = gitFilter.filter(files, config.paths().get(0));
        }
        LOGGER.info("Checking {} files with {} worker(s)", files.size(), config.parallelism());

        List<FileReport> reports = config.parallelism() == 1 || files.size() < 2
                ? runSequentially(files)
                : runInParallel(files);

        RunSummary summary = new RunSummary(reports);
        LOGGER.info("Finished: {} errors, {} warnings in {} files", summary.errorCount(), summary.warningCount(),
                reports.size());
        return summary;
    }

    private List<FileReport> runSequentially(List<Path> files) {
        List<FileReport> reports = new ArrayList<>(files.size());
        for (Path file : files) {
            reports.add(check(file));
        }
        return reports;
    }

    private List<FileReport> runInParallel(List<Path> files) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.parallelism(), files.size()));
        try {
            List<Future<FileReport>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> check(file)));
            }
            List<FileReport> reports = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                reports.add(await(futures.get(i), files.get(i)));
            }
            return reports;
        } finally {
            executor.shutdownNow();
        }
    }

    private FileReport await(Future<FileReport> future, Path file) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking " + file, ex);
        } catch (ExecutionException ex) {
            LOGGER.error("Checking {} failed", file, ex.getCause());
            return failed(file, ex.getCause());
        }
    }

    /**
     * Runs one complete pass over a single file. Never throws for problems inside the file.
     */
    FileReport check(Path file) {
        MDC.put(MDC_FILE, file.toString());
        try {
            String content = SourceText.read(file, config.encoding());
            if (MinifiedContentDetector.isMinified(content)) {
                LOGGER.warn("Skipping {}: content appears to be minified", file);
                return new FileReport(file, List.of(new Violation(Severity.WARNING, 1, 1,
                        "File appears to be minified and cannot be processed", MINIFIED)), false);
            }
            AnnotatedFile annotated = pipeline.annotate(content);
            if (!annotated.warnings().isEmpty()) {
                LOGGER.warn("{} structural warnings in {}", annotated.warnings().size(), file);
            }
            if (annotated.fileIgnored()) {
                LOGGER.debug("{} is suppressed by a lint:ignoreFile comment", file);
                return new FileReport(file, List.of(), false);
            }
            List<Violation> violations = ruleEngine.process(file, annotated);
            boolean crashed = violations.stream().anyMatch(violation -> INTERNAL_EXCEPTION.equals(violation.source()));
            return new FileReport(file, violations, crashed);
        } catch (RuntimeException ex) {
            LOGGER.error("Failed to check {}", file, ex);
            return failed(file, ex);
        } finally {
            MDC.remove(MDC_FILE);
        }
    }

    private static FileReport failed(Path file, Throwable cause) {
        String message = "An error occurred during processing; checking has been aborted. The error message was: "
                + cause.getMessage();
        return new FileReport(file, List.of(new Violation(Severity.ERROR, 1, 1, message, INTERNAL_EXCEPTION)), true);
    }
}
