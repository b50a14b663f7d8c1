package im.arun.electoralroll.model;

import lombok.Data;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * One page of the source document, filled in stage by stage by the worker that owns it.
 */
@Data
public class Page {
    private final int pageIndex;
    private BufferedImage originalImage;
    private BufferedImage processedImage;
    private List<RecognitionAttempt> attempts = new ArrayList<>();
    private String selectedStrategy;
    private String selectedText = "";
    private String normalizedText = "";
    private List<VoterRecord> records = new ArrayList<>();

    public Page(int pageIndex, BufferedImage originalImage) {
        this.pageIndex = pageIndex;
        this.originalImage = originalImage;
    }

    /**
     * Drops both rasters once their artifacts are written; text and records stay.
     */
    public void releaseImages() {
        originalImage = null;
        processedImage = null;
    }
}
