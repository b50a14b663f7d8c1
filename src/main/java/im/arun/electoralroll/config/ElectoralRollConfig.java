package im.arun.electoralroll.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.electoralroll.ocr.ImageVariant;
import im.arun.electoralroll.ocr.RecognitionStrategy;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElectoralRollConfig {

    @JsonProperty("dpi")
    private int dpi = 300;

    @JsonProperty("worker_count")
    private int workerCount = Math.min(Runtime.getRuntime().availableProcessors(), 8);

    @JsonProperty("debug_enabled")
    private boolean debugEnabled = true;

    @JsonProperty("debug_dir")
    private String debugDir = "ocr_debug_output";

    @JsonProperty("language")
    private String language = "eng";

    @JsonProperty("tessdata_path")
    private String tessdataPath;

    @JsonProperty("ocr_engine_mode")
    private int ocrEngineMode = 3;

    @JsonProperty("minimum_width")
    private int minimumWidth = 1500;

    @JsonProperty("contrast_factor")
    private double contrastFactor = 1.5;

    @JsonProperty("sharpness_factor")
    private double sharpnessFactor = 2.0;

    @JsonProperty("metadata_pages")
    private int metadataPages = 3;

    @JsonProperty("strategies")
    private List<RecognitionStrategy> strategies = defaultStrategies();

    /** Characters read in place of digits, applied only where digits are expected. */
    @JsonProperty("digit_substitutions")
    private Map<String, String> digitSubstitutions = defaultDigitSubstitutions();

    /** Whole-word fixes for misread field labels. */
    @JsonProperty("label_corrections")
    private Map<String, String> labelCorrections = defaultLabelCorrections();

    /**
     * @throws IllegalArgumentException when a value cannot drive a run
     */
    public void validate() {
        if (dpi < 72 || dpi > 1200) {
            throw new IllegalArgumentException("dpi must be between 72 and 1200, got " + dpi);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("worker_count must be at least 1, got " + workerCount);
        }
        if (minimumWidth < 1) {
            throw new IllegalArgumentException("minimum_width must be positive, got " + minimumWidth);
        }
        if (strategies == null || strategies.size() < 2) {
            throw new IllegalArgumentException("at least two recognition strategies are required");
        }
        Set<String> ids = new HashSet<>();
        for (RecognitionStrategy strategy : strategies) {
            if (strategy.getId() == null || strategy.getId().isBlank()) {
                throw new IllegalArgumentException("every recognition strategy needs an id");
            }
            if (!ids.add(strategy.getId())) {
                throw new IllegalArgumentException("duplicate recognition strategy id: " + strategy.getId());
            }
            if (strategy.getVariant() == null) {
                throw new IllegalArgumentException("strategy " + strategy.getId() + " has no image variant");
            }
        }
        for (Map.Entry<String, String> entry : digitSubstitutions.entrySet()) {
            if (entry.getKey().length() != 1 || entry.getValue().length() != 1
                || !Character.isDigit(entry.getValue().charAt(0))) {
                throw new IllegalArgumentException("digit substitution must map one character to one digit: "
                    + entry.getKey() + " -> " + entry.getValue());
            }
        }
    }

    public static List<RecognitionStrategy> defaultStrategies() {
        List<RecognitionStrategy> strategies = new ArrayList<>();
        strategies.add(new RecognitionStrategy("processed-block", ImageVariant.PROCESSED, 6));
        strategies.add(new RecognitionStrategy("processed-columns", ImageVariant.PROCESSED, 4));
        strategies.add(new RecognitionStrategy("processed-sparse", ImageVariant.PROCESSED, 11));
        strategies.add(new RecognitionStrategy("original-block", ImageVariant.ORIGINAL, 6));
        return strategies;
    }

    public static Map<String, String> defaultDigitSubstitutions() {
        Map<String, String> table = new LinkedHashMap<>();
        table.put("O", "0");
        table.put("o", "0");
        table.put("Q", "0");
        table.put("D", "0");
        table.put("I", "1");
        table.put("l", "1");
        table.put("|", "1");
        table.put("Z", "2");
        table.put("S", "5");
        table.put("B", "8");
        return table;
    }

    public static Map<String, String> defaultLabelCorrections() {
        Map<String, String> table = new LinkedHashMap<>();
        for (String wrong : List.of("Nanre", "Narne", "Natne", "Nanie", "Narme", "Namre", "Nanne")) {
            table.put(wrong, "Name");
        }
        for (String wrong : List.of("Fathars", "Fathar", "Fatber", "Farher")) {
            table.put(wrong, "Father");
        }
        for (String wrong : List.of("Hurband", "Husbamd", "Hursband", "Husbanc")) {
            table.put(wrong, "Husband");
        }
        for (String wrong : List.of("Aqe", "Agg", "Agge", "Agae")) {
            table.put(wrong, "Age");
        }
        for (String wrong : List.of("Gendsr", "Gendet", "Gencer")) {
            table.put(wrong, "Gender");
        }
        for (String wrong : List.of("Malg", "Malle", "Maie")) {
            table.put(wrong, "Male");
        }
        for (String wrong : List.of("Fernale", "Femala", "Femsle", "Femaie", "Fenale")) {
            table.put(wrong, "Female");
        }
        for (String wrong : List.of("Houre", "Housr", "Hourse")) {
            table.put(wrong, "House");
        }
        for (String wrong : List.of("Numbsr", "Numbef", "Numbar")) {
            table.put(wrong, "Number");
        }
        return table;
    }
}
