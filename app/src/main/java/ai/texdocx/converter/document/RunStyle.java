package ai.texdocx.converter.document;

public enum RunStyle {
    PLAIN,
    SUBSCRIPT,
    SUPERSCRIPT
}
