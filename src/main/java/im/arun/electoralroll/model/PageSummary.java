package im.arun.electoralroll.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-page entry of the extraction summary.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageSummary {

    @JsonProperty("page")
    private int pageIndex;

    @JsonProperty("records_found")
    private int recordsFound;

    @JsonProperty("strategies_attempted")
    private List<String> strategiesAttempted = new ArrayList<>();

    @JsonProperty("selected_strategy")
    private String selectedStrategy;

    @JsonProperty("strategy_scores")
    private Map<String, Integer> strategyScores = new LinkedHashMap<>();

    @JsonProperty("normalization_corrections")
    private int normalizationCorrections;

    @JsonProperty("segments")
    private int segments;

    @JsonProperty("unmatched_segments")
    private int unmatchedSegments;

    @JsonProperty("matcher_usage")
    private Map<String, Integer> matcherUsage = new LinkedHashMap<>();

    @JsonProperty("zero_yield")
    private boolean zeroYield;

    @JsonProperty("error")
    private String error;

    public PageSummary(int pageIndex) {
        this.pageIndex = pageIndex;
    }
}
