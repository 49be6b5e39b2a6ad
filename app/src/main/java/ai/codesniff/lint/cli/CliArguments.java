package ai.codesniff.lint.cli;

import ai.codesniff.lint.config.LogFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "codesniff", mixinStandardHelpOptions = true, version = "codesniff 0.1.0",
        description = "Checks PHP sources against structural coding-standard rules")
public class CliArguments {

    @CommandLine.Parameters(paramLabel = "PATH", arity = "1..*", description = "Files or directories to check")
    private List<Path> paths = new ArrayList<>();

    @CommandLine.Option(names = "--tab-width", paramLabel = "COLUMNS", description = "Columns per tab stop; 0 keeps tabs as one column (default 4)")
    private Integer tabWidth;

    @CommandLine.Option(names = "--encoding", paramLabel = "CHARSET", description = "Source file encoding (default UTF-8)")
    private String encoding;

    @CommandLine.Option(names = "--extensions", paramLabel = "LIST", description = "Comma separated extensions checked in directories (default php,inc)")
    private String extensions;

    @CommandLine.Option(names = "--parallel", paramLabel = "COUNT", description = "Number of files checked concurrently (default 1)")
    private Integer parallel;

    @CommandLine.Option(names = "--language-policy", paramLabel = "FILE", description = "Properties file replacing the bundled PHP structure tables")
    private Path languagePolicy;

    @CommandLine.Option(names = "--git-modified", description = "Only check files git reports as modified, added or untracked")
    private boolean gitModified;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-stage details")
    private boolean verbose;

    public List<Path> paths() {
        return paths;
    }

    public Integer tabWidth() {
        return tabWidth;
    }

    public String encoding() {
        return encoding;
    }

    public String extensions() {
        return extensions;
    }

    public Integer parallel() {
        return parallel;
    }

    public Path languagePolicy() {
        return languagePolicy;
    }

    public boolean gitModified() {
        return gitModified;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
