package ai.texdocx.converter.pipeline;

/**
 * Runtime exception for failures that abort a whole conversion, such as unreadable input or unwritable output.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
