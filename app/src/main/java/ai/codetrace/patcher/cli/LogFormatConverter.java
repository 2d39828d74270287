package ai.codetrace.patcher.cli;

import ai.codetrace.patcher.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format} values, reporting unknown ones as picocli conversion errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("expected text or json but was '" + value + "'");
        }
    }
}
