package im.arun.electoralroll.ocr;

import im.arun.electoralroll.model.RecognitionAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs every configured {@link RecognitionStrategy} on a page and keeps the best text.
 * Attempts run in configuration order, one at a time, on the calling worker thread.
 */
public class MultiStrategyRecognizer {
    private static final Logger logger = LoggerFactory.getLogger(MultiStrategyRecognizer.class);

    private final RecognitionEngine engine;
    private final List<RecognitionStrategy> strategies;
    private final StrategyScorer scorer;

    public MultiStrategyRecognizer(RecognitionEngine engine, List<RecognitionStrategy> strategies, StrategyScorer scorer) {
        if (strategies == null || strategies.size() < 2) {
            throw new IllegalArgumentException("at least two recognition strategies are required");
        }
        this.engine = engine;
        this.strategies = List.copyOf(strategies);
        this.scorer = scorer;
    }

    public RecognitionResult recognize(BufferedImage processed, BufferedImage original) {
        return recognize(processed, original, 0);
    }

    /**
     * @param processed Preprocessed raster
     * @param original  Raster as rendered
     * @param pageIndex Page number, for logging only
     */
    public RecognitionResult recognize(BufferedImage processed, BufferedImage original, int pageIndex) {
        List<RecognitionAttempt> attempts = new ArrayList<>(strategies.size());
        for (RecognitionStrategy strategy : strategies) {
            attempts.add(attempt(strategy, strategy.getVariant() == ImageVariant.ORIGINAL ? original : processed, pageIndex));
        }

        int best = scorer.selectBest(attempts);
        if (best < 0) {
            logger.warn("Page {}: no strategy produced any text", pageIndex);
            return new RecognitionResult("", null, attempts);
        }
        RecognitionAttempt winner = attempts.get(best);
        logger.info("Page {}: selected strategy {} (score {}, {} chars)",
            pageIndex, winner.getStrategyId(), winner.getScore(), winner.textLength());
        return new RecognitionResult(winner.getText(), winner.getStrategyId(), attempts);
    }

    private RecognitionAttempt attempt(RecognitionStrategy strategy, BufferedImage image, int pageIndex) {
        try {
            String text = engine.recognize(image, strategy.getPageSegMode());
            RecognitionAttempt attempt = RecognitionAttempt.success(strategy.getId(), text);
            attempt.setScore(scorer.score(attempt.getText()));
            logger.debug("Page {}: strategy {} read {} chars, score {}",
                pageIndex, strategy.getId(), attempt.textLength(), attempt.getScore());
            return attempt;
        } catch (RecognitionException | RuntimeException e) {
            logger.warn("Page {}: strategy {} failed: {}", pageIndex, strategy.getId(), e.getMessage());
            return RecognitionAttempt.failure(strategy.getId(), e.getMessage());
        }
    }
}
