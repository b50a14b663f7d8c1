package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterRecord;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Records found on one page plus the bookkeeping the extraction summary needs.
 */
@Getter
@AllArgsConstructor
public class ExtractionResult {
    private final List<VoterRecord> records;
    private final int segments;
    private final int unmatchedSegments;
    private final int duplicatesDropped;
    private final Map<String, Integer> matcherUsage;
}
