package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns the normalized text of one page into voter records.
 * <p>
 * The text is cut into segments at blank lines and every segment is offered to the matchers from
 * most to least strict; the first matcher returning records wins that segment. Records are then
 * de-duplicated by name and serial number, keeping the first occurrence.
 */
public class RecordExtractor {
    private static final Logger logger = LoggerFactory.getLogger(RecordExtractor.class);
    private static final Pattern SEGMENT_BREAK = Pattern.compile("\\n[ \\t]*\\n");

    private final List<RecordMatcher> matchers;

    public RecordExtractor() {
        this(List.of(new StrictLayoutMatcher(), new KeywordProximityMatcher(), new HeuristicBlockMatcher()));
    }

    public RecordExtractor(List<RecordMatcher> matchers) {
        if (matchers == null || matchers.isEmpty()) {
            throw new IllegalArgumentException("at least one record matcher is required");
        }
        this.matchers = List.copyOf(matchers);
    }

    public ExtractionResult extract(String normalizedText, int pageIndex) {
        Map<String, Integer> usage = new LinkedHashMap<>();
        for (RecordMatcher matcher : matchers) {
            usage.put(matcher.name(), 0);
        }
        if (normalizedText == null || normalizedText.isBlank()) {
            return new ExtractionResult(List.of(), 0, 0, 0, usage);
        }

        Map<String, VoterRecord> unique = new LinkedHashMap<>();
        int segments = 0;
        int unmatched = 0;
        int duplicates = 0;

        for (String segment : SEGMENT_BREAK.split(normalizedText)) {
            if (segment.isBlank()) {
                continue;
            }
            segments++;
            List<VoterRecord> found = matchSegment(segment, pageIndex, usage);
            if (found.isEmpty()) {
                unmatched++;
                logger.debug("Page {}: no matcher recognized segment starting '{}'", pageIndex, preview(segment));
                continue;
            }
            for (VoterRecord record : found) {
                if (unique.putIfAbsent(record.identityKey(), record) != null) {
                    duplicates++;
                }
            }
        }

        if (duplicates > 0) {
            logger.info("Page {}: dropped {} duplicate records", pageIndex, duplicates);
        }
        logger.info("Page {}: {} records from {} segments ({} unmatched)",
            pageIndex, unique.size(), segments, unmatched);
        return new ExtractionResult(new ArrayList<>(unique.values()), segments, unmatched, duplicates, usage);
    }

    private List<VoterRecord> matchSegment(String segment, int pageIndex, Map<String, Integer> usage) {
        for (RecordMatcher matcher : matchers) {
            Optional<List<VoterRecord>> records = matcher.tryMatch(segment, pageIndex);
            if (records.isPresent() && !records.get().isEmpty()) {
                usage.merge(matcher.name(), 1, Integer::sum);
                return records.get();
            }
        }
        return List.of();
    }

    private static String preview(String segment) {
        String firstLine = segment.strip().split("\n", 2)[0];
        return firstLine.length() > 40 ? firstLine.substring(0, 40) + "..." : firstLine;
    }
}
