package im.arun.electoralroll.service;

import im.arun.electoralroll.config.ElectoralRollConfig;
import im.arun.electoralroll.debug.DebugSink;
import im.arun.electoralroll.debug.FileSystemDebugSink;
import im.arun.electoralroll.debug.NoOpDebugSink;
import im.arun.electoralroll.extract.RecordExtractor;
import im.arun.electoralroll.extract.RollMetadataExtractor;
import im.arun.electoralroll.image.ImagePreprocessor;
import im.arun.electoralroll.model.AgeGroup;
import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.Page;
import im.arun.electoralroll.model.PageSummary;
import im.arun.electoralroll.model.RollMetadata;
import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;
import im.arun.electoralroll.ocr.MultiStrategyRecognizer;
import im.arun.electoralroll.ocr.RecognitionEngine;
import im.arun.electoralroll.ocr.StrategyScorer;
import im.arun.electoralroll.ocr.TesseractRecognitionEngine;
import im.arun.electoralroll.output.CsvSpreadsheetWriter;
import im.arun.electoralroll.output.SpreadsheetWriter;
import im.arun.electoralroll.pdf.PageRasterizer;
import im.arun.electoralroll.pdf.PdfBoxRasterizer;
import im.arun.electoralroll.pdf.RasterizationException;
import im.arun.electoralroll.pdf.RasterizedDocument;
import im.arun.electoralroll.text.TextNormalizer;
import im.arun.electoralroll.util.ExecutorProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main orchestrator: turns a scanned roll into a spreadsheet plus debugging artifacts.
 * <p>
 * Pages are rendered one after another on the calling thread and each rendered page is handed to
 * a fixed worker pool. At most {@code 2 * workerCount} pages are held in memory at once.
 * Results are put back into page order before anything is written.
 */
public class ElectoralRollService {
    private static final Logger logger = LoggerFactory.getLogger(ElectoralRollService.class);

    private final ElectoralRollConfig config;
    private final PageRasterizer rasterizer;
    private final DebugSink debugSink;
    private final SpreadsheetWriter spreadsheetWriter;
    private final PageProcessor pageProcessor;
    private final RollMetadataExtractor metadataExtractor;

    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private volatile CountDownLatch running = new CountDownLatch(0);

    public ElectoralRollService(ElectoralRollConfig config, PageRasterizer rasterizer, RecognitionEngine engine,
                                DebugSink debugSink, SpreadsheetWriter spreadsheetWriter) {
        config.validate();
        this.config = config;
        this.rasterizer = rasterizer;
        this.debugSink = debugSink;
        this.spreadsheetWriter = spreadsheetWriter;
        TextNormalizer normalizer = new TextNormalizer(config);
        MultiStrategyRecognizer recognizer =
            new MultiStrategyRecognizer(engine, config.getStrategies(), new StrategyScorer(normalizer));
        this.pageProcessor = new PageProcessor(
            new ImagePreprocessor(config), recognizer, normalizer, new RecordExtractor(), debugSink);
        this.metadataExtractor = new RollMetadataExtractor();
    }

    /**
     * Production wiring: PDFBox, Tesseract, CSV output, and debug files unless disabled.
     */
    public static ElectoralRollService create(ElectoralRollConfig config) {
        DebugSink sink = config.isDebugEnabled()
            ? new FileSystemDebugSink(Paths.get(config.getDebugDir()))
            : new NoOpDebugSink();
        return new ElectoralRollService(config, new PdfBoxRasterizer(), new TesseractRecognitionEngine(config),
            sink, new CsvSpreadsheetWriter());
    }

    /**
     * Stops the current run after the pages already in progress. Completed pages are still written.
     */
    public void abort() {
        if (aborted.compareAndSet(false, true)) {
            logger.warn("Abort requested; finishing pages in progress");
        }
    }

    public boolean isAborted() {
        return aborted.get();
    }

    /**
     * Waits for a run in progress to finish writing its output.
     *
     * @return false if the run was still going when the timeout expired
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        return running.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Main processing pipeline.
     *
     * @param pdfPath    Scanned roll
     * @param outputPath Spreadsheet to write; written even when no record was found
     * @throws RasterizationException If the document cannot be opened or no page renders;
     *                                nothing is written in that case
     * @throws IOException            If the spreadsheet cannot be written
     */
    public RunResult process(Path pdfPath, Path outputPath) throws RasterizationException, IOException {
        CountDownLatch latch = new CountDownLatch(1);
        running = latch;
        try {
            return run(pdfPath, outputPath);
        } finally {
            latch.countDown();
        }
    }

    private RunResult run(Path pdfPath, Path outputPath) throws RasterizationException, IOException {
        logger.info("Starting extraction of {} at {} DPI with {} workers",
            pdfPath, config.getDpi(), config.getWorkerCount());

        ExtractionSummary summary;
        List<Page> pages = new ArrayList<>();

        try (RasterizedDocument document = rasterizer.open(pdfPath, config.getDpi())) {
            int pageCount = document.pageCount();
            if (pageCount < 1) {
                throw new RasterizationException("Document has no pages: " + pdfPath);
            }
            summary = new ExtractionSummary(pdfPath.getFileName().toString(), config.getDpi(), pageCount);
            renderAndProcess(document, pageCount, summary, pages);
        }

        if (aborted.get()) {
            summary.markAborted();
            logger.warn("Run aborted; pages skipped: {}", summary.getSkippedPages());
        }

        List<VoterRecord> records = new ArrayList<>();
        for (Page page : pages) {
            records.addAll(page.getRecords());
        }

        RollMetadata metadata = extractMetadata(pages);
        summary.setMetadata(metadata);
        summary.setStatistics(statistics(records));
        summary.setSampleRecords(records);

        debugSink.combinedText(combinedText(pdfPath, metadata, pages));
        debugSink.summary(summary);

        spreadsheetWriter.write(records, metadata, outputPath);

        List<Integer> zeroYield = summary.getZeroYieldPages();
        if (!zeroYield.isEmpty()) {
            logger.warn("{} page(s) yielded no records: {}", zeroYield.size(), zeroYield);
        }
        logger.info("Extraction complete: {} records from {} pages", records.size(), summary.getPagesProcessed());
        return new RunResult(records, summary, outputPath);
    }

    private void renderAndProcess(RasterizedDocument document, int pageCount, ExtractionSummary summary,
                                  List<Page> completed) throws RasterizationException {
        ExecutorService executor = ExecutorProvider.newWorkerPool(config.getWorkerCount());
        Semaphore inFlight = new Semaphore(2 * config.getWorkerCount());
        TreeMap<Integer, CompletableFuture<PageSummary>> futures = new TreeMap<>();
        Map<Integer, Page> started = new TreeMap<>();
        int renderFailures = 0;
        String lastRenderError = null;

        try {
            for (int pageIndex = 1; pageIndex <= pageCount; pageIndex++) {
                if (aborted.get()) {
                    summary.recordSkipped(pageIndex);
                    continue;
                }
                try {
                    inFlight.acquire();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    abort();
                    summary.recordSkipped(pageIndex);
                    continue;
                }

                BufferedImage image;
                try {
                    image = document.render(pageIndex);
                    logger.debug("Rendered page {}/{}", pageIndex, pageCount);
                } catch (RasterizationException e) {
                    inFlight.release();
                    renderFailures++;
                    lastRenderError = e.getMessage();
                    logger.error("Page {}: {}", pageIndex, e.getMessage());
                    PageSummary failed = new PageSummary(pageIndex);
                    failed.setZeroYield(true);
                    failed.setError(e.getMessage());
                    summary.recordPage(failed);
                    continue;
                }

                Page page = new Page(pageIndex, image);
                started.put(pageIndex, page);
                futures.put(pageIndex, CompletableFuture.supplyAsync(() -> {
                    try {
                        if (aborted.get()) {
                            return null;
                        }
                        return pageProcessor.process(page);
                    } finally {
                        inFlight.release();
                    }
                }, executor));
            }

            for (Map.Entry<Integer, CompletableFuture<PageSummary>> entry : futures.entrySet()) {
                PageSummary pageSummary = entry.getValue().join();
                if (pageSummary == null) {
                    summary.recordSkipped(entry.getKey());
                    continue;
                }
                summary.recordPage(pageSummary);
                completed.add(started.get(entry.getKey()));
            }
        } finally {
            executor.shutdown();
        }

        if (renderFailures == pageCount) {
            throw new RasterizationException("No page of the document could be rendered: " + lastRenderError);
        }
    }

    private RollMetadata extractMetadata(List<Page> pages) {
        List<String> texts = new ArrayList<>();
        for (Page page : pages) {
            if (page.getPageIndex() <= config.getMetadataPages()) {
                texts.add(page.getNormalizedText());
            }
        }
        return metadataExtractor.extract(texts);
    }

    static Map<String, Object> statistics(List<VoterRecord> records) {
        Map<String, Integer> genders = new TreeMap<>();
        Map<String, Integer> ageGroups = new LinkedHashMap<>();
        for (AgeGroup group : AgeGroup.values()) {
            ageGroups.put(group.getLabel(), 0);
        }
        Set<Integer> pagesWithRecords = new TreeSet<>();
        int withEpic = 0;
        int withAge = 0;
        for (VoterRecord record : records) {
            if (record.getPageIndex() != null) {
                pagesWithRecords.add(record.getPageIndex());
            }
            genders.merge(record.get(VoterField.GENDER).orElse("Unknown"), 1, Integer::sum);
            AgeGroup.of(record).ifPresent(group -> ageGroups.merge(group.getLabel(), 1, Integer::sum));
            if (record.has(VoterField.EPIC)) {
                withEpic++;
            }
            if (record.has(VoterField.AGE)) {
                withAge++;
            }
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("total_records", records.size());
        stats.put("pages_with_records", pagesWithRecords.size());
        stats.put("records_with_epic", withEpic);
        stats.put("records_with_age", withAge);
        stats.put("gender_counts", genders);
        stats.put("age_groups", ageGroups);
        return stats;
    }

    private static String combinedText(Path pdfPath, RollMetadata metadata, List<Page> pages) {
        StringBuilder text = new StringBuilder();
        text.append("Document: ").append(pdfPath.getFileName()).append('\n');
        if (!metadata.isEmpty()) {
            appendIfSet(text, "Assembly Constituency", metadata.getAssemblyConstituencyNo(),
                metadata.getAssemblyConstituencyName());
            appendIfSet(text, "Parliamentary Constituency", metadata.getParliamentaryConstituencyNo(),
                metadata.getParliamentaryConstituencyName());
            appendIfSet(text, "Part No", metadata.getPartNo(), null);
            appendIfSet(text, "District", metadata.getDistrict(), null);
            appendIfSet(text, "Pin Code", metadata.getPinCode(), null);
            appendIfSet(text, "Region", metadata.getRegion(), null);
        }
        text.append('\n');
        for (Page page : pages) {
            text.append(String.format("=== PAGE %d (%s) ===%n", page.getPageIndex(),
                page.getSelectedStrategy() == null ? "no text" : page.getSelectedStrategy()));
            text.append(page.getNormalizedText()).append("\n\n");
        }
        return text.toString();
    }

    private static void appendIfSet(StringBuilder text, String label, String first, String second) {
        if (first == null && second == null) {
            return;
        }
        text.append(label).append(": ");
        if (first != null) {
            text.append(first);
        }
        if (second != null) {
            text.append(first != null ? " - " : "").append(second);
        }
        text.append('\n');
    }
}
