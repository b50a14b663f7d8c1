package im.arun.electoralroll.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text produced by one recognition strategy on one page.
 * The score is the structural-probe count used for strategy selection, not an engine confidence.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecognitionAttempt {

    @JsonProperty("strategy")
    private String strategyId;

    @JsonProperty("text")
    private String text;

    @JsonProperty("score")
    private int score;

    @JsonProperty("failed")
    private boolean failed;

    @JsonProperty("error")
    private String error;

    public static RecognitionAttempt success(String strategyId, String text) {
        return new RecognitionAttempt(strategyId, text == null ? "" : text, 0, false, null);
    }

    public static RecognitionAttempt failure(String strategyId, String error) {
        return new RecognitionAttempt(strategyId, "", 0, true, error);
    }

    @JsonIgnore
    public boolean isBlank() {
        return text == null || text.isBlank();
    }

    public int textLength() {
        return text == null ? 0 : text.length();
    }
}
