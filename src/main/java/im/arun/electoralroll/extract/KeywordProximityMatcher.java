package im.arun.electoralroll.extract;

import im.arun.electoralroll.extract.LabelScanner.LabelHit;
import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads field values next to their labels, in any order and without relying on delimiters.
 * <p>
 * The segment is cut into one chunk per voter at every occurrence of its anchor label: whichever of
 * "Sl No" or "Name" appears first. Within a chunk the first valid value of each field wins.
 */
public class KeywordProximityMatcher implements RecordMatcher {

    private static final Pattern LINE_SERIAL = Pattern.compile("(?m)^(\\d{1,5})[.)]?\\s*$");
    private static final int MIN_FIELDS = 2;

    @Override
    public String name() {
        return "keyword";
    }

    @Override
    public Optional<List<VoterRecord>> tryMatch(String segment, int pageIndex) {
        List<LabelHit> hits = LabelScanner.scan(segment);
        VoterField anchor = anchorOf(hits);
        if (anchor == null) {
            return Optional.empty();
        }

        List<Integer> boundaries = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            if (hits.get(i).getField() == anchor) {
                boundaries.add(i);
            }
        }

        List<VoterRecord> records = new ArrayList<>();
        for (int b = 0; b < boundaries.size(); b++) {
            int from = b == 0 ? 0 : boundaries.get(b);
            int to = b + 1 < boundaries.size() ? boundaries.get(b + 1) : hits.size();
            VoterRecord.Builder builder = VoterRecord.builder().pageIndex(pageIndex);
            for (int i = from; i < to; i++) {
                VoterField field = hits.get(i).getField();
                if (builder.has(field)) {
                    continue;
                }
                FieldValues.parse(field, LabelScanner.valueAfter(segment, hits, i))
                    .ifPresent(value -> builder.field(field, value));
            }
            if (anchor == VoterField.NAME && !builder.has(VoterField.SERIAL_NO)) {
                leadingSerial(segment, hits, boundaries.get(b))
                    .ifPresent(serial -> builder.field(VoterField.SERIAL_NO, serial));
            }
            if (builder.fieldCount() >= MIN_FIELDS) {
                builder.build().ifPresent(records::add);
            }
        }
        return records.isEmpty() ? Optional.empty() : Optional.of(records);
    }

    private static VoterField anchorOf(List<LabelHit> hits) {
        for (LabelHit hit : hits) {
            if (hit.getField() == VoterField.SERIAL_NO || hit.getField() == VoterField.NAME) {
                return hit.getField();
            }
        }
        return null;
    }

    /**
     * A bare number printed just before the anchor label, either earlier on the same line or
     * alone on the line above, as rolls print serials.
     */
    private static Optional<String> leadingSerial(String segment, List<LabelHit> hits, int anchorIndex) {
        int anchorStart = hits.get(anchorIndex).getStart();
        int previousEnd = anchorIndex > 0 ? hits.get(anchorIndex - 1).getEnd() : 0;
        int lineStart = segment.lastIndexOf('\n', anchorStart - 1) + 1;
        if (lineStart < previousEnd) {
            return Optional.empty();
        }
        String before = segment.substring(lineStart, anchorStart);
        if (before.isBlank() && lineStart > 0) {
            int previousLineStart = segment.lastIndexOf('\n', lineStart - 2) + 1;
            if (previousLineStart < previousEnd) {
                return Optional.empty();
            }
            before = segment.substring(previousLineStart, lineStart - 1);
        }
        Matcher matcher = LINE_SERIAL.matcher(before);
        return matcher.find() ? FieldValues.serial(matcher.group(1)) : Optional.empty();
    }
}
