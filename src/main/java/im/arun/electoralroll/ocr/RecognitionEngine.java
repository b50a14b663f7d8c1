package im.arun.electoralroll.ocr;

import java.awt.image.BufferedImage;

/**
 * Character-recognition engine. Implementations may keep per-thread state but must be safe to
 * call from several worker threads at once.
 */
public interface RecognitionEngine {

    /**
     * @param image       Image to read
     * @param pageSegMode Engine page segmentation mode
     * @return The recognized text, possibly empty
     * @throws RecognitionException If the engine fails on this image
     */
    String recognize(BufferedImage image, int pageSegMode) throws RecognitionException;
}
