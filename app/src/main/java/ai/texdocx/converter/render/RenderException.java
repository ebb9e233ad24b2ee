package ai.texdocx.converter.render;

/**
 * Runtime exception raised when a single formula could not be rendered.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message) {
        super(message);
    }

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
