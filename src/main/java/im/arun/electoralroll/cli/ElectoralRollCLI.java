package im.arun.electoralroll.cli;

import im.arun.electoralroll.config.ConfigLoader;
import im.arun.electoralroll.config.ElectoralRollConfig;
import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.RollMetadata;
import im.arun.electoralroll.output.CsvSpreadsheetWriter;
import im.arun.electoralroll.pdf.RasterizationException;
import im.arun.electoralroll.service.ElectoralRollService;
import im.arun.electoralroll.service.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Command-line interface for electoral roll extraction using Picocli.
 */
@Command(
    name = "electoral-roll-ocr",
    description = "Extract voter records from a scanned electoral roll PDF into a CSV spreadsheet",
    mixinStandardHelpOptions = true,
    version = "Electoral Roll OCR 1.0"
)
public class ElectoralRollCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(ElectoralRollCLI.class);
    private static final Duration ABORT_GRACE = Duration.ofSeconds(30);

    @Parameters(index = "0", paramLabel = "INPUT.pdf", description = "Scanned electoral roll")
    private File input;

    @Parameters(index = "1", paramLabel = "OUTPUT.csv", description = "Spreadsheet to write")
    private File output;

    @Option(names = {"--dpi"}, description = "Rendering resolution (default 300; try 400-600 for poor scans)")
    private Integer dpi;

    @Option(names = {"--workers"}, description = "Pages processed in parallel (default: processors, at most 8)")
    private Integer workers;

    @Option(names = {"--debug-dir"}, description = "Directory for debugging artifacts (default ocr_debug_output)")
    private String debugDir;

    @Option(names = {"--no-debug"}, description = "Do not write debugging artifacts")
    private boolean noDebug;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--tessdata"}, description = "Tesseract tessdata directory")
    private String tessdataPath;

    @Option(names = {"--lang"}, description = "Tesseract language (default eng)")
    private String language;

    private final Function<ElectoralRollConfig, ElectoralRollService> serviceFactory;
    private final PrintStream out;
    private final PrintStream err;

    public ElectoralRollCLI() {
        this(ElectoralRollService::create, System.out, System.err);
    }

    ElectoralRollCLI(Function<ElectoralRollConfig, ElectoralRollService> serviceFactory, PrintStream out, PrintStream err) {
        this.serviceFactory = serviceFactory;
        this.out = out;
        this.err = err;
    }

    @Override
    public Integer call() {
        if (!input.isFile()) {
            err.println("Error: PDF file not found: " + input);
            return 1;
        }
        if (!input.getName().toLowerCase().endsWith(".pdf")) {
            err.println("Error: File must be a PDF: " + input);
            return 1;
        }

        ElectoralRollConfig config;
        ElectoralRollService service;
        try {
            config = new ConfigLoader(configPath).load(userOptions());
            service = serviceFactory.apply(config);
        } catch (IllegalArgumentException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }

        out.println("Electoral Roll OCR - Scanned Roll to Spreadsheet");
        out.println("=".repeat(50));
        out.println("PDF: " + input);
        out.println("Output: " + output);
        out.println("DPI: " + config.getDpi() + ", workers: " + config.getWorkerCount());
        out.println(config.isDebugEnabled() ? "Debug output: " + config.getDebugDir() : "Debug output: disabled");
        out.println();

        Thread abortHook = new Thread(() -> {
            service.abort();
            try {
                service.awaitCompletion(ABORT_GRACE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "electoralroll-abort");
        Runtime.getRuntime().addShutdownHook(abortHook);

        RunResult result;
        try {
            out.println("Starting processing...");
            result = service.process(input.toPath(), output.toPath());
        } catch (RasterizationException e) {
            logger.error("Cannot process {}", input, e);
            err.println("Error: cannot read the document: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Cannot write {}", output, e);
            err.println("Error: cannot write output: " + e.getMessage());
            return 1;
        } finally {
            removeHook(abortHook);
        }

        ExtractionSummary summary = result.getSummary();
        if (summary.isAborted()) {
            out.println("Processing was aborted; skipped pages: " + summary.getSkippedPages());
        }
        if (!result.hasRecords()) {
            printZeroRecordHelp(config);
            return 0;
        }
        printStatistics(result);
        return 0;
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("dpi", dpi);
        options.put("worker_count", workers);
        options.put("debug_dir", debugDir);
        if (noDebug) {
            options.put("debug_enabled", false);
        }
        options.put("tessdata_path", tessdataPath);
        options.put("language", language);
        return options;
    }

    private void printZeroRecordHelp(ElectoralRollConfig config) {
        out.println();
        out.println("!".repeat(50));
        out.println("WARNING: no voter records were extracted.");
        out.println("!".repeat(50));
        out.println("A spreadsheet with only the header row was written to " + output);
        out.println("Troubleshooting:");
        out.println("  - Re-run with a higher resolution, e.g. --dpi 400 up to --dpi 600");
        out.println("  - Check the Tesseract language data (--tessdata, --lang)");
        if (config.isDebugEnabled()) {
            out.println("  - Inspect the page images and raw text in " + config.getDebugDir());
        } else {
            out.println("  - Re-run without --no-debug and inspect the raw recognized text");
        }
    }

    private void printStatistics(RunResult result) {
        ExtractionSummary summary = result.getSummary();
        out.println();
        out.println("Processing complete!");
        out.println("Records extracted: " + result.getRecords().size());
        out.println("Pages processed: " + summary.getPagesProcessed() + "/" + summary.getTotalPages());
        if (!summary.getZeroYieldPages().isEmpty()) {
            out.println("Pages without records: " + summary.getZeroYieldPages());
        }
        Object genders = summary.getStatistics().get("gender_counts");
        if (genders != null) {
            out.println("Gender counts: " + genders);
        }
        Object ageGroups = summary.getStatistics().get("age_groups");
        if (ageGroups != null) {
            out.println("Age groups: " + ageGroups);
        }
        RollMetadata metadata = summary.getMetadata();
        if (metadata != null && metadata.getAssemblyConstituencyNo() != null) {
            out.println("Assembly constituency: " + metadata.getAssemblyConstituencyNo()
                + (metadata.getAssemblyConstituencyName() != null ? " - " + metadata.getAssemblyConstituencyName() : ""));
        }
        if (metadata != null && metadata.getPartNo() != null) {
            out.println("Part No: " + metadata.getPartNo());
        }
        if (metadata != null && metadata.getRegion() != null) {
            out.println("Region: " + metadata.getRegion());
        }
        out.println("Output written to: " + output);
        File dashboard = CsvSpreadsheetWriter.dashboardPath(output.toPath()).toFile();
        if (dashboard.isFile()) {
            out.println("Dashboard written to: " + dashboard);
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running
            logger.debug("Shutdown in progress, abort hook stays registered");
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ElectoralRollCLI()).execute(args);
        System.exit(exitCode);
    }
}
