package im.arun.electoralroll.ocr;

/**
 * Raised by a {@link RecognitionEngine} when it cannot read an image.
 */
public class RecognitionException extends Exception {

    public RecognitionException(String message) {
        super(message);
    }

    public RecognitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
