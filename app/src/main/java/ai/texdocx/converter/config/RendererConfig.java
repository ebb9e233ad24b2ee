package ai.texdocx.converter.config;

import ai.texdocx.converter.render.RendererMode;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the formula renderer.
 */
public record RendererConfig(RendererMode mode, String texmathExecutable, Duration timeout, int parallelism) {

    public RendererConfig {
        Objects.requireNonNull(mode, "mode");
        if (texmathExecutable == null || texmathExecutable.isBlank()) {
            throw new IllegalArgumentException("texmathExecutable must not be blank");
        }
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1");
        }
    }
}
