package ai.texdocx.converter.pipeline;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported source dialects.
 */
public enum SourceFormat {
    LATEX,
    MARKDOWN;

    public static SourceFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Source format must be provided");
        }
        return SourceFormat.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public static Optional<SourceFormat> fromFileName(Path path) {
        if (path == null || path.getFileName() == null) {
            return Optional.empty();
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".tex")) {
            return Optional.of(LATEX);
        }
        if (name.endsWith(".md") || name.endsWith(".markdown")) {
            return Optional.of(MARKDOWN);
        }
        return Optional.empty();
    }
}
