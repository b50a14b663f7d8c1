package im.arun.electoralroll.debug;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.RecognitionAttempt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes debugging artifacts into one directory:
 * <pre>
 * page_001_original.png          page as rendered
 * page_001_processed.png         page after preprocessing
 * page_001_&lt;strategy&gt;_raw.txt    text of every recognition attempt
 * page_001_selected.txt          text chosen for extraction
 * all_pages_combined_text.txt    selected text of all pages
 * extraction_summary.json        run summary
 * </pre>
 * A failed write is logged and the remaining artifacts are still written.
 */
public class FileSystemDebugSink implements DebugSink {
    private static final Logger logger = LoggerFactory.getLogger(FileSystemDebugSink.class);

    public static final String COMBINED_TEXT_FILE = "all_pages_combined_text.txt";
    public static final String SUMMARY_FILE = "extraction_summary.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileSystemDebugSink(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            logger.error("Failed to create debug directory {}", directory, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    static String pagePrefix(int pageIndex) {
        return String.format("page_%03d", pageIndex);
    }

    @Override
    public void pageOriginal(int pageIndex, BufferedImage image) {
        writeImage(image, pagePrefix(pageIndex) + "_original.png");
    }

    @Override
    public void pageProcessed(int pageIndex, BufferedImage image) {
        writeImage(image, pagePrefix(pageIndex) + "_processed.png");
    }

    @Override
    public void pageAttempts(int pageIndex, List<RecognitionAttempt> attempts) {
        for (RecognitionAttempt attempt : attempts) {
            String content = attempt.isFailed()
                ? "[recognition failed: " + attempt.getError() + "]\n"
                : attempt.getText();
            writeText(content, pagePrefix(pageIndex) + "_" + safeName(attempt.getStrategyId()) + "_raw.txt");
        }
    }

    @Override
    public void pageSelectedText(int pageIndex, String text) {
        writeText(text, pagePrefix(pageIndex) + "_selected.txt");
    }

    @Override
    public void combinedText(String text) {
        writeText(text, COMBINED_TEXT_FILE);
    }

    @Override
    public void summary(ExtractionSummary summary) {
        Path target = directory.resolve(SUMMARY_FILE);
        try {
            objectMapper.writeValue(target.toFile(), summary);
            logger.info("Extraction summary written to {}", target);
        } catch (IOException e) {
            logger.warn("Failed to write {}: {}", target, e.getMessage());
        }
    }

    private void writeImage(BufferedImage image, String fileName) {
        if (image == null) {
            return;
        }
        Path target = directory.resolve(fileName);
        try {
            if (!ImageIO.write(image, "png", target.toFile())) {
                logger.warn("No PNG writer available for {}", target);
            }
        } catch (IOException e) {
            logger.warn("Failed to write {}: {}", target, e.getMessage());
        }
    }

    private void writeText(String text, String fileName) {
        Path target = directory.resolve(fileName);
        try {
            Files.writeString(target, text == null ? "" : text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.warn("Failed to write {}: {}", target, e.getMessage());
        }
    }

    private static String safeName(String strategyId) {
        return strategyId == null ? "unknown" : strategyId.replaceAll("[^A-Za-z0-9_.-]", "_");
    }
}
