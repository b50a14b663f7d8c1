package im.arun.electoralroll.extract;

import im.arun.electoralroll.extract.LabelScanner.LabelHit;
import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches one voter per line written as {@code Label: value} pairs joined by commas, e.g.
 * {@code Name: A, Age: 30, Sl No: 1} or {@code 12 Name: B, Husband's Name: C, Age: 41, Gender: Female}.
 * <p>
 * The core fields must keep the roll's order (name, relation, house, age, gender); serial and EPIC
 * numbers may only lead or trail them.
 */
public class StrictLayoutMatcher implements RecordMatcher {

    private static final Pattern SERIAL_PREFIX = Pattern.compile("^(\\d{1,5})[.)]? (?=[A-Za-z])");
    private static final Pattern PAIR_GAP = Pattern.compile("^: ?([^,:]+?) ?, ?$");
    private static final Pattern LAST_GAP = Pattern.compile("^: ?([^,:]+?) ?$");
    private static final Set<VoterField> EDGE_FIELDS = EnumSet.of(VoterField.SERIAL_NO, VoterField.EPIC);
    private static final Map<VoterField, Integer> CORE_ORDER = new EnumMap<>(VoterField.class);

    static {
        CORE_ORDER.put(VoterField.NAME, 0);
        CORE_ORDER.put(VoterField.RELATION_NAME, 1);
        CORE_ORDER.put(VoterField.HOUSE_NO, 2);
        CORE_ORDER.put(VoterField.AGE, 3);
        CORE_ORDER.put(VoterField.GENDER, 4);
    }

    @Override
    public String name() {
        return "strict";
    }

    @Override
    public Optional<List<VoterRecord>> tryMatch(String segment, int pageIndex) {
        List<VoterRecord> records = new ArrayList<>();
        for (String line : segment.split("\n")) {
            matchLine(line.strip(), pageIndex).ifPresent(records::add);
        }
        return records.isEmpty() ? Optional.empty() : Optional.of(records);
    }

    Optional<VoterRecord> matchLine(String line, int pageIndex) {
        if (line.isEmpty()) {
            return Optional.empty();
        }
        String prefixSerial = null;
        Matcher prefix = SERIAL_PREFIX.matcher(line);
        if (prefix.find()) {
            prefixSerial = prefix.group(1);
            line = line.substring(prefix.end());
        }

        List<LabelHit> hits = LabelScanner.scan(line);
        if (hits.size() < 2 || hits.get(0).getStart() != 0) {
            return Optional.empty();
        }

        List<VoterField> order = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (int i = 0; i < hits.size(); i++) {
            boolean last = i == hits.size() - 1;
            int gapEnd = last ? line.length() : hits.get(i + 1).getStart();
            String gap = line.substring(hits.get(i).getEnd(), gapEnd);
            Matcher pair = (last ? LAST_GAP : PAIR_GAP).matcher(gap);
            if (!pair.matches()) {
                return Optional.empty();
            }
            order.add(hits.get(i).getField());
            values.add(pair.group(1));
        }
        if (!inCanonicalOrder(order)) {
            return Optional.empty();
        }

        VoterRecord.Builder builder = VoterRecord.builder().pageIndex(pageIndex);
        for (int i = 0; i < order.size(); i++) {
            VoterField field = order.get(i);
            builder.field(field, FieldValues.parse(field, values.get(i)).orElse(null));
        }
        if (prefixSerial != null && !order.contains(VoterField.SERIAL_NO)) {
            builder.field(VoterField.SERIAL_NO, FieldValues.serial(prefixSerial).orElse(null));
        }
        return builder.build();
    }

    /**
     * Leading edge fields, then core fields in strictly increasing order including a name,
     * then trailing edge fields. No field may repeat.
     */
    static boolean inCanonicalOrder(List<VoterField> order) {
        if (EnumSet.copyOf(order).size() != order.size() || !order.contains(VoterField.NAME)) {
            return false;
        }
        int i = 0;
        while (i < order.size() && EDGE_FIELDS.contains(order.get(i))) {
            i++;
        }
        int previous = -1;
        while (i < order.size() && CORE_ORDER.containsKey(order.get(i))) {
            int rank = CORE_ORDER.get(order.get(i));
            if (rank <= previous) {
                return false;
            }
            previous = rank;
            i++;
        }
        while (i < order.size()) {
            if (!EDGE_FIELDS.contains(order.get(i))) {
                return false;
            }
            i++;
        }
        return true;
    }
}
