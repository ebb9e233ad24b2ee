package ai.texdocx.converter.writer;

/**
 * Runtime exception raised when a rendered fragment cannot be placed into the document.
 */
public class MathMarkupException extends RuntimeException {

    public MathMarkupException(String message, Throwable cause) {
        super(message, cause);
    }
}
