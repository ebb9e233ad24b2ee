package ai.texdocx.converter.document;

public enum ListKind {
    BULLET,
    NUMBERED
}
