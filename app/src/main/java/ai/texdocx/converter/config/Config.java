package ai.texdocx.converter.config;

import ai.texdocx.converter.pipeline.SourceFormat;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 *
 * @param sourceFormat explicit dialect; when empty it is derived from the input file name
 */
public record Config(
        Path input,
        Path output,
        Optional<SourceFormat> sourceFormat,
        RendererConfig renderer,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        sourceFormat = sourceFormat == null ? Optional.empty() : sourceFormat;
        Objects.requireNonNull(renderer, "renderer");
        Objects.requireNonNull(logFormat, "logFormat");
    }
}
