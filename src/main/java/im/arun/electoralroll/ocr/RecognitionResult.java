package im.arun.electoralroll.ocr;

import im.arun.electoralroll.model.RecognitionAttempt;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of running every strategy on a page. {@code bestStrategyId} is null when no attempt
 * produced text.
 */
@Getter
@AllArgsConstructor
public class RecognitionResult {
    private final String bestText;
    private final String bestStrategyId;
    private final List<RecognitionAttempt> attempts;

    public boolean isEmpty() {
        return bestText.isBlank();
    }
}
