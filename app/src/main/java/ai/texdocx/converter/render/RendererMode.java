package ai.texdocx.converter.render;

/**
 * Mode controlling how formulas are rendered.
 */
public enum RendererMode {
    TEXMATH,
    LITERAL,
    NONE;

    public static RendererMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TEXMATH;
        }
        for (RendererMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported renderer mode: " + raw);
    }
}
