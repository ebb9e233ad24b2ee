package ai.texdocx.converter.cli;

import ai.texdocx.converter.pipeline.SourceFormat;
import picocli.CommandLine;

public class SourceFormatConverter implements CommandLine.ITypeConverter<SourceFormat> {

    @Override
    public SourceFormat convert(String value) {
        return SourceFormat.from(value);
    }
}
