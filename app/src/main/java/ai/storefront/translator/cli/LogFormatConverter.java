package ai.storefront.translator.cli;

import ai.storefront.translator.config.LogFormat;
import picocli.CommandLine;

final class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("Unsupported log format: " + value);
        }
    }
}
