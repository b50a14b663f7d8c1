package im.arun.electoralroll.pdf;

/**
 * The input document cannot be opened or none of its pages can be rendered.
 */
public class RasterizationException extends Exception {

    public RasterizationException(String message) {
        super(message);
    }

    public RasterizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
