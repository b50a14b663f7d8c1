package im.arun.electoralroll.ocr;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One recognition configuration tried per page: an image variant plus the engine's
 * page segmentation mode (6 = uniform block, 4 = single column, 11 = sparse text).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecognitionStrategy {

    @JsonProperty("id")
    private String id;

    @JsonProperty("variant")
    private ImageVariant variant = ImageVariant.PROCESSED;

    @JsonProperty("page_seg_mode")
    private int pageSegMode = 6;

    public RecognitionStrategy copy() {
        return new RecognitionStrategy(id, variant, pageSegMode);
    }
}
