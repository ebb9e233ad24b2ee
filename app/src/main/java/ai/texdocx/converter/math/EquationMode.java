package ai.texdocx.converter.math;

/**
 * Whether an equation is rendered as its own block or within a line of text.
 */
public enum EquationMode {
    DISPLAY('D'),
    INLINE('I');

    private final char code;

    EquationMode(char code) {
        this.code = code;
    }

    char code() {
        return code;
    }

    static EquationMode fromCode(char code) {
        for (EquationMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown equation mode code: " + code);
    }
}
