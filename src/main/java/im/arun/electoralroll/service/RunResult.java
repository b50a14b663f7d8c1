package im.arun.electoralroll.service;

import im.arun.electoralroll.model.ExtractionSummary;
import im.arun.electoralroll.model.VoterRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * Records of a finished run in page order, with its summary.
 */
@Getter
@AllArgsConstructor
public class RunResult {
    private final List<VoterRecord> records;
    private final ExtractionSummary summary;
    private final Path outputPath;

    public boolean hasRecords() {
        return !records.isEmpty();
    }
}
