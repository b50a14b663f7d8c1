package im.arun.electoralroll.debug;

import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.RecognitionAttempt;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Discards every artifact. Used when debugging output is disabled.
 */
public class NoOpDebugSink implements DebugSink {

    @Override
    public void pageOriginal(int pageIndex, BufferedImage image) {
    }

    @Override
    public void pageProcessed(int pageIndex, BufferedImage image) {
    }

    @Override
    public void pageAttempts(int pageIndex, List<RecognitionAttempt> attempts) {
    }

    @Override
    public void pageSelectedText(int pageIndex, String text) {
    }

    @Override
    public void combinedText(String text) {
    }

    @Override
    public void summary(ExtractionSummary summary) {
    }
}
