package ai.texdocx.converter.scan;

import java.util.Objects;

/**
 * A malformed construct left untouched in the working text.
 */
public record Diagnostic(String construct, int offset, String message) {

    public Diagnostic {
        Objects.requireNonNull(construct, "construct");
        Objects.requireNonNull(message, "message");
    }

    static Diagnostic unterminated(ConstructMatch match) {
        return new Diagnostic(match.name(), match.start(),
                "Unterminated " + match.name() + " at offset " + match.start() + "; left in place");
    }
}
