package im.arun.electoralroll.service;

import im.arun.electoralroll.debug.DebugSink;
import im.arun.electoralroll.extract.ExtractionResult;
import im.arun.electoralroll.extract.RecordExtractor;
import im.arun.electoralroll.image.ImagePreprocessor;
import im.arun.electoralroll.model.Page;
import im.arun.electoralroll.model.PageSummary;
import im.arun.electoralroll.model.RecognitionAttempt;
import im.arun.electoralroll.ocr.MultiStrategyRecognizer;
import im.arun.electoralroll.ocr.RecognitionResult;
import im.arun.electoralroll.text.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;

/**
 * Runs preprocess, recognize, normalize and extract for one page and writes its debug artifacts.
 * Never throws: an unexpected failure marks the page zero-yield and records the error.
 */
public class PageProcessor {
    private static final Logger logger = LoggerFactory.getLogger(PageProcessor.class);

    private final ImagePreprocessor preprocessor;
    private final MultiStrategyRecognizer recognizer;
    private final TextNormalizer normalizer;
    private final RecordExtractor extractor;
    private final DebugSink debugSink;

    public PageProcessor(ImagePreprocessor preprocessor, MultiStrategyRecognizer recognizer,
                         TextNormalizer normalizer, RecordExtractor extractor, DebugSink debugSink) {
        this.preprocessor = preprocessor;
        this.recognizer = recognizer;
        this.normalizer = normalizer;
        this.extractor = extractor;
        this.debugSink = debugSink;
    }

    public PageSummary process(Page page) {
        int pageIndex = page.getPageIndex();
        PageSummary summary = new PageSummary(pageIndex);
        try {
            BufferedImage original = page.getOriginalImage();
            debugSink.pageOriginal(pageIndex, original);

            BufferedImage processed = preprocessor.preprocess(original, pageIndex);
            page.setProcessedImage(processed);
            debugSink.pageProcessed(pageIndex, processed);

            RecognitionResult recognition = recognizer.recognize(processed, original, pageIndex);
            page.setAttempts(new ArrayList<>(recognition.getAttempts()));
            page.setSelectedStrategy(recognition.getBestStrategyId());
            page.setSelectedText(recognition.getBestText());
            debugSink.pageAttempts(pageIndex, recognition.getAttempts());
            debugSink.pageSelectedText(pageIndex, recognition.getBestText());

            for (RecognitionAttempt attempt : recognition.getAttempts()) {
                summary.getStrategiesAttempted().add(attempt.getStrategyId());
                summary.getStrategyScores().put(attempt.getStrategyId(), attempt.getScore());
            }
            summary.setSelectedStrategy(recognition.getBestStrategyId());

            TextNormalizer.NormalizedText normalized = normalizer.normalizeWithReport(recognition.getBestText());
            page.setNormalizedText(normalized.getText());
            summary.setNormalizationCorrections(normalized.getCorrections());

            ExtractionResult extraction = extractor.extract(normalized.getText(), pageIndex);
            page.setRecords(new ArrayList<>(extraction.getRecords()));
            summary.setRecordsFound(extraction.getRecords().size());
            summary.setSegments(extraction.getSegments());
            summary.setUnmatchedSegments(extraction.getUnmatchedSegments());
            summary.setMatcherUsage(extraction.getMatcherUsage());
            summary.setZeroYield(extraction.getRecords().isEmpty());

            if (summary.isZeroYield()) {
                logger.warn("Page {}: no records extracted", pageIndex);
            }
        } catch (RuntimeException e) {
            logger.error("Page {}: processing failed", pageIndex, e);
            page.setRecords(new ArrayList<>());
            summary.setRecordsFound(0);
            summary.setZeroYield(true);
            summary.setError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            page.releaseImages();
        }
        return summary;
    }
}
