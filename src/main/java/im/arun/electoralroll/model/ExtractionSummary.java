package im.arun.electoralroll.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Run-level metadata collected while pages complete in any order.
 * Page entries are kept sorted by page index; all mutators are synchronized.
 */
@JsonPropertyOrder({"document", "timestamp", "dpi", "total_pages", "pages_processed", "total_records",
    "aborted", "zero_yield_pages", "skipped_pages", "metadata", "statistics", "pages", "sample_records"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionSummary {
    private static final int SAMPLE_SIZE = 3;

    private final String document;
    private final String timestamp;
    private final int dpi;
    private final int totalPages;
    private final TreeMap<Integer, PageSummary> pages = new TreeMap<>();
    private final TreeSet<Integer> skippedPages = new TreeSet<>();
    private RollMetadata metadata;
    private Map<String, Object> statistics = new LinkedHashMap<>();
    private List<VoterRecord> sampleRecords = new ArrayList<>();
    private boolean aborted;

    public ExtractionSummary(String document, int dpi, int totalPages) {
        this.document = document;
        this.dpi = dpi;
        this.totalPages = totalPages;
        this.timestamp = OffsetDateTime.now().toString();
    }

    public synchronized void recordPage(PageSummary pageSummary) {
        pages.put(pageSummary.getPageIndex(), pageSummary);
    }

    public synchronized void recordSkipped(int pageIndex) {
        skippedPages.add(pageIndex);
    }

    public synchronized void markAborted() {
        this.aborted = true;
    }

    public synchronized void setMetadata(RollMetadata metadata) {
        this.metadata = metadata;
    }

    public synchronized void setStatistics(Map<String, Object> statistics) {
        this.statistics = new LinkedHashMap<>(statistics);
    }

    public synchronized void setSampleRecords(List<VoterRecord> records) {
        this.sampleRecords = new ArrayList<>(records.subList(0, Math.min(SAMPLE_SIZE, records.size())));
    }

    @JsonProperty("document")
    public String getDocument() {
        return document;
    }

    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("dpi")
    public int getDpi() {
        return dpi;
    }

    @JsonProperty("total_pages")
    public int getTotalPages() {
        return totalPages;
    }

    @JsonProperty("pages_processed")
    public synchronized int getPagesProcessed() {
        return pages.size();
    }

    @JsonProperty("total_records")
    public synchronized int getTotalRecords() {
        return pages.values().stream().mapToInt(PageSummary::getRecordsFound).sum();
    }

    @JsonProperty("aborted")
    public synchronized boolean isAborted() {
        return aborted;
    }

    @JsonProperty("zero_yield_pages")
    public synchronized List<Integer> getZeroYieldPages() {
        List<Integer> zeroYield = new ArrayList<>();
        for (PageSummary page : pages.values()) {
            if (page.isZeroYield()) {
                zeroYield.add(page.getPageIndex());
            }
        }
        return zeroYield;
    }

    @JsonProperty("skipped_pages")
    public synchronized List<Integer> getSkippedPages() {
        return new ArrayList<>(skippedPages);
    }

    @JsonProperty("metadata")
    public synchronized RollMetadata getMetadata() {
        return metadata;
    }

    @JsonProperty("statistics")
    public synchronized Map<String, Object> getStatistics() {
        return new LinkedHashMap<>(statistics);
    }

    @JsonProperty("pages")
    public synchronized List<PageSummary> getPages() {
        return new ArrayList<>(pages.values());
    }

    public synchronized PageSummary getPage(int pageIndex) {
        return pages.get(pageIndex);
    }

    @JsonProperty("sample_records")
    public synchronized List<VoterRecord> getSampleRecords() {
        return new ArrayList<>(sampleRecords);
    }
}
