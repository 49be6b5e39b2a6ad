package ai.codesniff.lint.cli;

import ai.codesniff.lint.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses the {@code --log-format} option, reporting bad values as picocli type errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
