package ai.texdocx.converter.cli;

import ai.texdocx.converter.render.RendererMode;
import picocli.CommandLine;

public class RendererModeConverter implements CommandLine.ITypeConverter<RendererMode> {

    @Override
    public RendererMode convert(String value) {
        return RendererMode.from(value);
    }
}
