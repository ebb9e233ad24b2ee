package ai.texdocx.converter.document;

/**
 * A unit of the output document, emitted in reading order.
 */
public interface Block {
}
