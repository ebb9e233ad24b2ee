package ai.texdocx.converter.pipeline;

import java.nio.file.Path;
import java.util.Objects;

public record ConversionReport(Path output,
                               long displayEquations,
                               long inlineEquations,
                               long rendered,
                               long failed,
                               int diagnostics) {

    public ConversionReport {
        Objects.requireNonNull(output, "output");
    }

    public long totalEquations() {
        return displayEquations + inlineEquations;
    }
}
