package im.arun.electoralroll.ocr;

import im.arun.electoralroll.config.ElectoralRollConfig;
import im.arun.electoralroll.model.RecognitionAttempt;
import im.arun.electoralroll.text.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MultiStrategyRecognizerTest {

    private final BufferedImage processed = new BufferedImage(10, 10, BufferedImage.TYPE_BYTE_GRAY);
    private final BufferedImage original = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);

    private RecognitionEngine engine;
    private MultiStrategyRecognizer recognizer;

    @BeforeEach
    void setUp() {
        engine = mock(RecognitionEngine.class);
        recognizer = new MultiStrategyRecognizer(engine, ElectoralRollConfig.defaultStrategies(),
            new StrategyScorer(new TextNormalizer()));
    }

    @Test
    void recognize_shouldPickTextWithMostRecordLines() throws Exception {
        when(engine.recognize(same(processed), eq(6))).thenReturn("noise and more noise than anything else");
        when(engine.recognize(same(processed), eq(4))).thenReturn("Name: A, Age: 30\nName: B, Age: 41");
        when(engine.recognize(same(processed), eq(11))).thenReturn("");
        when(engine.recognize(same(original), eq(6))).thenReturn("Name: A");

        RecognitionResult result = recognizer.recognize(processed, original, 1);

        assertThat(result.getBestStrategyId()).isEqualTo("processed-columns");
        assertThat(result.getBestText()).isEqualTo("Name: A, Age: 30\nName: B, Age: 41");
        assertThat(result.getAttempts()).extracting(RecognitionAttempt::getStrategyId)
            .containsExactly("processed-block", "processed-columns", "processed-sparse", "original-block");
        assertThat(result.getAttempts()).extracting(RecognitionAttempt::getScore)
            .containsExactly(0, 2, 0, 1);
    }

    @Test
    void recognize_shouldBreakScoreTiesByLength() throws Exception {
        when(engine.recognize(same(processed), eq(6))).thenReturn("Name: A");
        when(engine.recognize(same(processed), eq(4))).thenReturn("Name: A Kumar");
        when(engine.recognize(same(processed), eq(11))).thenReturn("Name: A");
        when(engine.recognize(same(original), eq(6))).thenReturn("Name: A");

        assertThat(recognizer.recognize(processed, original, 1).getBestStrategyId()).isEqualTo("processed-columns");
    }

    @Test
    void recognize_shouldPreferEarlierStrategyOnExactTie() throws Exception {
        when(engine.recognize(any(), anyInt())).thenReturn("Name: A");

        assertThat(recognizer.recognize(processed, original, 1).getBestStrategyId()).isEqualTo("processed-block");
    }

    @Test
    void recognize_shouldRecordEngineFailureAndContinue() throws Exception {
        when(engine.recognize(same(processed), eq(6))).thenThrow(new RecognitionException("engine crashed"));
        when(engine.recognize(same(processed), eq(4))).thenThrow(new IllegalStateException("bad state"));
        when(engine.recognize(same(processed), eq(11))).thenReturn("Name: A");
        when(engine.recognize(same(original), eq(6))).thenReturn("");

        RecognitionResult result = recognizer.recognize(processed, original, 1);

        assertThat(result.getBestStrategyId()).isEqualTo("processed-sparse");
        assertThat(result.getAttempts().get(0).isFailed()).isTrue();
        assertThat(result.getAttempts().get(0).getError()).isEqualTo("engine crashed");
        assertThat(result.getAttempts().get(1).isFailed()).isTrue();
        verify(engine, times(1)).recognize(same(processed), eq(6));
    }

    @Test
    void recognize_shouldReturnEmptyWhenNothingIsRead() throws Exception {
        when(engine.recognize(any(), anyInt())).thenReturn("   ");

        RecognitionResult result = recognizer.recognize(processed, original, 2);

        assertThat(result.getBestText()).isEmpty();
        assertThat(result.getBestStrategyId()).isNull();
        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getAttempts()).hasSize(4);
    }

    @Test
    void constructor_shouldRequireTwoStrategies() {
        List<RecognitionStrategy> single = List.of(new RecognitionStrategy("only", ImageVariant.PROCESSED, 6));

        assertThatThrownBy(() -> new MultiStrategyRecognizer(engine, single, new StrategyScorer(new TextNormalizer())))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
