package ai.texdocx.converter.scan;

/**
 * Shape of a recognised construct.
 */
public enum ConstructKind {
    ENVIRONMENT,
    DISPLAY_MATH,
    INLINE_MATH,
    COMMAND
}
