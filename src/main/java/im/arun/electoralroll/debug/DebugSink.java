package im.arun.electoralroll.debug;

import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.RecognitionAttempt;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Receives the intermediate artifacts of a run. Page methods are called from worker threads,
 * each page by exactly one thread. Implementations never throw on a failed write.
 */
public interface DebugSink {

    void pageOriginal(int pageIndex, BufferedImage image);

    void pageProcessed(int pageIndex, BufferedImage image);

    void pageAttempts(int pageIndex, List<RecognitionAttempt> attempts);

    void pageSelectedText(int pageIndex, String text);

    void combinedText(String text);

    void summary(ExtractionSummary summary);
}
