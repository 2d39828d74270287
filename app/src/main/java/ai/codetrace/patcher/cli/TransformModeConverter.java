package ai.codetrace.patcher.cli;

import ai.codetrace.patcher.llm.TransformMode;
import picocli.CommandLine;

public class TransformModeConverter implements CommandLine.ITypeConverter<TransformMode> {

    @Override
    public TransformMode convert(String value) {
        try {
            return TransformMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(
                    "expected production, dry-run or mock but was '" + value + "'");
        }
    }
}
