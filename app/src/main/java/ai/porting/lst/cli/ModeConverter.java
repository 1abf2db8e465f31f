package ai.porting.lst.cli;

import ai.porting.lst.config.Mode;
import picocli.CommandLine;

/**
 * Parses the {@code --mode} option.
 */
public class ModeConverter implements CommandLine.ITypeConverter<Mode> {
    @Override
    public Mode convert(String value) {
        return Mode.from(value);
    }
}
