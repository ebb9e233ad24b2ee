package ai.texdocx.converter.document;

import java.util.Objects;

public record TextRun(String text, RunStyle style) implements Run {

    public TextRun {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(style, "style");
    }

    public static TextRun plain(String text) {
        return new TextRun(text, RunStyle.PLAIN);
    }
}
