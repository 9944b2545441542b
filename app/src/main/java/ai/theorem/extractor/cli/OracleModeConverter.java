package ai.theorem.extractor.cli;

import ai.theorem.extractor.oracle.OracleMode;
import picocli.CommandLine;

public class OracleModeConverter implements CommandLine.ITypeConverter<OracleMode> {

    @Override
    public OracleMode convert(String value) {
        try {
            return OracleMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
