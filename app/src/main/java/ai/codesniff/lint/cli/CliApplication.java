package ai.codesniff.lint.cli;

import ai.codesniff.lint.config.Config;
import ai.codesniff.lint.config.ConfigLoader;
import ai.codesniff.lint.config.EnvironmentReader;
import ai.codesniff.lint.git.GitStatusException;
import ai.codesniff.lint.language.LanguagePolicy;
import ai.codesniff.lint.language.LanguagePolicyLoader;
import ai.codesniff.lint.lexer.PhpLexer;
import ai.codesniff.lint.logging.LoggingConfigurator;
import ai.codesniff.lint.rules.RuleEngine;
import ai.codesniff.lint.runner.RunSummary;
import ai.codesniff.lint.runner.Runner;
import ai.codesniff.lint.runner.TextReportPrinter;
import ai.codesniff.lint.tokenizer.AnnotationPipeline;
import java.io.UncheckedIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration, annotation pipeline and runner.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final String DEFAULT_LANGUAGE = "php";

    private final ConfigLoader configLoader;
    private final LanguagePolicyLoader policyLoader;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new LanguagePolicyLoader());
    }

    CliApplication(ConfigLoader configLoader, LanguagePolicyLoader policyLoader) {
        this.configLoader = configLoader;
        this.policyLoader = policyLoader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        return run(new CommandLine(new CliArguments()), args);
    }

    int run(CommandLine commandLine, String[] args) {
        CliArguments cliArguments = commandLine.getCommand();
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return RunSummary.EXIT_PROCESSING_ERROR;
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        LanguagePolicy policy;
        try {
            config = configLoader.load(cliArguments);
            policy = config.languagePolicy()
                    .map(policyLoader::load)
                    .orElseGet(() -> policyLoader.loadDefault(DEFAULT_LANGUAGE));
        } catch (IllegalArgumentException | UncheckedIOException ex) {
            commandLine.getErr().println("Configuration error: " + ex.getMessage());
            return RunSummary.EXIT_PROCESSING_ERROR;
        }

        LoggingConfigurator.configure(config.logFormat(), cliArguments.verbose());
        LOGGER.debug("Using language policy '{}' with tab width {} and encoding {}", policy.name(),
                config.tabWidth(), config.encoding());

        AnnotationPipeline pipeline = new AnnotationPipeline(new PhpLexer(), policy, config.tabWidth());
        Runner runner = new Runner(config, pipeline, RuleEngine.withDefaultSniffs());
        RunSummary summary;
        try {
            summary = runner.run();
        } catch (IllegalArgumentException | UncheckedIOException | GitStatusException ex) {
            commandLine.getErr().println("Error: " + ex.getMessage());
            return RunSummary.EXIT_PROCESSING_ERROR;
        }

        new TextReportPrinter().print(summary, commandLine.getOut());
        return summary.exitCode();
    }
}
