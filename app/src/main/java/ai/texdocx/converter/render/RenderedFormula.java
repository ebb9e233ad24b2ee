package ai.texdocx.converter.render;

import java.util.Objects;

public record RenderedFormula(String markup, MathForm form) {

    public RenderedFormula {
        Objects.requireNonNull(markup, "markup");
        Objects.requireNonNull(form, "form");
        if (markup.isBlank()) {
            throw new IllegalArgumentException("markup must not be blank");
        }
    }

    public static RenderedFormula of(String markup) {
        return new RenderedFormula(markup, MathForm.classify(markup));
    }
}
