package ai.texdocx.converter.document;

/**
 * One piece of paragraph content: styled text or a math fragment.
 */
public interface Run {
}
