package im.arun.electoralroll.service;

import im.arun.electoralroll.config.ElectoralRollConfig;
import im.arun.electoralroll.debug.DebugSink;
import im.arun.electoralroll.extract.RecordExtractor;
import im.arun.electoralroll.image.ImagePreprocessor;
import im.arun.electoralroll.model.Page;
import im.arun.electoralroll.model.PageSummary;
import im.arun.electoralroll.ocr.MultiStrategyRecognizer;
import im.arun.electoralroll.ocr.RecognitionEngine;
import im.arun.electoralroll.ocr.StrategyScorer;
import im.arun.electoralroll.text.TextNormalizer;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PageProcessorTest {

    private final ElectoralRollConfig config = new ElectoralRollConfig();
    private final TextNormalizer normalizer = new TextNormalizer();
    private final DebugSink debugSink = mock(DebugSink.class);

    private PageProcessor processor(MultiStrategyRecognizer recognizer) {
        return new PageProcessor(new ImagePreprocessor(config), recognizer, normalizer, new RecordExtractor(), debugSink);
    }

    private static Page page(int pageIndex) {
        return new Page(pageIndex, new BufferedImage(1600, 60, BufferedImage.TYPE_INT_RGB));
    }

    @Test
    void process_shouldExtractRecordsAndReportStrategies() throws Exception {
        RecognitionEngine engine = mock(RecognitionEngine.class);
        when(engine.recognize(any(), anyInt())).thenReturn("Nanre: Sita Devi, Age: 4O, Gender: Female");
        MultiStrategyRecognizer recognizer =
            new MultiStrategyRecognizer(engine, config.getStrategies(), new StrategyScorer(normalizer));
        Page page = page(3);

        PageSummary summary = processor(recognizer).process(page);

        assertThat(summary.getPageIndex()).isEqualTo(3);
        assertThat(summary.getRecordsFound()).isEqualTo(1);
        assertThat(summary.isZeroYield()).isFalse();
        assertThat(summary.getError()).isNull();
        assertThat(summary.getStrategiesAttempted())
            .containsExactly("processed-block", "processed-columns", "processed-sparse", "original-block");
        assertThat(summary.getSelectedStrategy()).isEqualTo("processed-block");
        assertThat(summary.getNormalizationCorrections()).isEqualTo(2);
        assertThat(summary.getMatcherUsage()).containsEntry("strict", 1);

        assertThat(page.getNormalizedText()).isEqualTo("Name: Sita Devi, Age: 40, Gender: Female");
        assertThat(page.getRecords()).hasSize(1);
        assertThat(page.getOriginalImage()).isNull();
        assertThat(page.getProcessedImage()).isNull();

        verify(debugSink).pageOriginal(eq(3), any());
        verify(debugSink).pageProcessed(eq(3), any());
        verify(debugSink).pageAttempts(eq(3), anyList());
        verify(debugSink).pageSelectedText(3, "Nanre: Sita Devi, Age: 4O, Gender: Female");
    }

    @Test
    void process_shouldMarkPageZeroYieldWhenProcessingFails() {
        MultiStrategyRecognizer recognizer = mock(MultiStrategyRecognizer.class);
        when(recognizer.recognize(any(), any(), anyInt())).thenThrow(new IllegalStateException("boom"));
        Page page = page(5);

        PageSummary summary = processor(recognizer).process(page);

        assertThat(summary.isZeroYield()).isTrue();
        assertThat(summary.getRecordsFound()).isZero();
        assertThat(summary.getError()).isEqualTo("IllegalStateException: boom");
        assertThat(page.getRecords()).isEmpty();
        assertThat(page.getOriginalImage()).isNull();
    }

    @Test
    void process_shouldReportZeroYieldForTextWithoutRecords() throws Exception {
        RecognitionEngine engine = mock(RecognitionEngine.class);
        when(engine.recognize(any(), anyInt())).thenReturn("GENERAL ELECTORAL ROLL 2024");
        MultiStrategyRecognizer recognizer =
            new MultiStrategyRecognizer(engine, config.getStrategies(), new StrategyScorer(normalizer));

        PageSummary summary = processor(recognizer).process(page(1));

        assertThat(summary.isZeroYield()).isTrue();
        assertThat(summary.getError()).isNull();
        assertThat(summary.getSegments()).isEqualTo(1);
        assertThat(summary.getUnmatchedSegments()).isEqualTo(1);
    }
}
