package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterField;
import im.arun.electoralroll.model.VoterRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort matcher for text whose labels were lost in recognition.
 * <p>
 * Lines are grouped into blocks, a new block starting at each line that opens with a serial number
 * or an EPIC number. Each block keeps only tokens it can classify with confidence: EPIC numbers,
 * "s/o"/"w/o"/"d/o" relations, ages, gender words and house numbers. A block needs a name or an EPIC
 * number plus one more field to become a record.
 */
public class HeuristicBlockMatcher implements RecordMatcher {

    private static final String NOT_AN_AGE = "(?!\\s*(?i:years?|yrs?)\\b)";
    private static final Pattern BLOCK_START = Pattern.compile(
        "^(?:\\d{1,5}[.)]?\\s" + NOT_AN_AGE + "|[A-Z]{2,4}(?:/\\d+){3}\\b|[A-Z]{2,4}\\d{6,10}\\b)");
    private static final Pattern SERIAL = Pattern.compile("^(\\d{1,5})[.)]?\\s" + NOT_AN_AGE);
    private static final Pattern RELATION = Pattern.compile(
        "(?i)\\b[swd]\\s*/\\s*o\\b[\\s:.\\-]*([a-z][a-z .']{0,49})");
    private static final Pattern NAME_BEFORE_RELATION = Pattern.compile(
        "([A-Z][A-Za-z]*(?: [A-Z][A-Za-z]*){0,3}) ?,? ?(?i:[swd]\\s*/\\s*o\\b)");
    private static final Pattern LABELLED_NAME = Pattern.compile(
        "(?i)(?<![a-z]['’]?s )(?<!father )(?<!husband )\\bname\\b[\\s:.\\-]*([a-z][a-z .']{0,49})");
    private static final Pattern AGE_YEARS = Pattern.compile("(?i)\\b(\\d{2,3})\\s*(?:years?|yrs?)\\b");
    private static final Pattern AGE_LABEL = Pattern.compile("(?i)\\bage\\b\\D{0,3}(\\d{1,3})\\b");
    private static final Pattern GENDER_WORD = Pattern.compile("(?i)\\b(female|male|third gender)\\b");
    private static final Pattern HOUSE = Pattern.compile(
        "(?i)\\b(?:house|door)(?:\\s*(?:no\\.?|number))?\\s*[:\\-]?\\s*([a-z0-9/\\-]{1,20})");
    private static final int MIN_FIELDS = 2;

    @Override
    public String name() {
        return "heuristic";
    }

    @Override
    public Optional<List<VoterRecord>> tryMatch(String segment, int pageIndex) {
        List<VoterRecord> records = new ArrayList<>();
        for (String block : splitBlocks(segment)) {
            parseBlock(block, pageIndex).ifPresent(records::add);
        }
        return records.isEmpty() ? Optional.empty() : Optional.of(records);
    }

    List<String> splitBlocks(String segment) {
        List<String> blocks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String rawLine : segment.split("\n")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (BLOCK_START.matcher(line).find() && current.length() > 0) {
                blocks.add(current.toString());
                current.setLength(0);
            }
            if (current.length() > 0) {
                current.append('\n');
            }
            current.append(line);
        }
        if (current.length() > 0) {
            blocks.add(current.toString());
        }
        return blocks;
    }

    Optional<VoterRecord> parseBlock(String block, int pageIndex) {
        VoterRecord.Builder builder = VoterRecord.builder().pageIndex(pageIndex);

        Matcher serial = SERIAL.matcher(block);
        if (serial.find()) {
            builder.field(VoterField.SERIAL_NO, FieldValues.serial(serial.group(1)).orElse(null));
        }
        builder.field(VoterField.EPIC, FieldValues.epic(block).orElse(null));

        Matcher labelled = LABELLED_NAME.matcher(block);
        if (labelled.find()) {
            builder.field(VoterField.NAME, FieldValues.name(cutAtLabel(labelled.group(1))).orElse(null));
        } else {
            Matcher beforeRelation = NAME_BEFORE_RELATION.matcher(block);
            if (beforeRelation.find()) {
                builder.field(VoterField.NAME, FieldValues.name(beforeRelation.group(1)).orElse(null));
            }
        }

        Matcher relation = RELATION.matcher(block);
        if (relation.find()) {
            builder.field(VoterField.RELATION_NAME, FieldValues.name(cutAtLabel(relation.group(1))).orElse(null));
        }

        firstValid(block, AGE_LABEL, FieldValues::age)
            .or(() -> firstValid(block, AGE_YEARS, FieldValues::age))
            .ifPresent(age -> builder.field(VoterField.AGE, age));

        Matcher gender = GENDER_WORD.matcher(block);
        if (gender.find()) {
            builder.field(VoterField.GENDER, FieldValues.gender(gender.group(1)).orElse(null));
        }

        Matcher house = HOUSE.matcher(block);
        if (house.find()) {
            builder.field(VoterField.HOUSE_NO, FieldValues.house(house.group(1)).orElse(null));
        }

        if (builder.fieldCount() < MIN_FIELDS) {
            return Optional.empty();
        }
        // a leading number alone is not an identity
        if (!builder.has(VoterField.NAME) && !builder.has(VoterField.EPIC)) {
            return Optional.empty();
        }
        return builder.build();
    }

    private static String cutAtLabel(String value) {
        List<LabelScanner.LabelHit> hits = LabelScanner.scan(value);
        String cut = hits.isEmpty() ? value : value.substring(0, hits.get(0).getStart());
        Matcher gender = GENDER_WORD.matcher(cut);
        return gender.find() ? cut.substring(0, gender.start()) : cut;
    }

    private static Optional<String> firstValid(String block, Pattern pattern,
                                               Function<String, Optional<String>> parser) {
        Matcher matcher = pattern.matcher(block);
        while (matcher.find()) {
            Optional<String> value = parser.apply(matcher.group(1));
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
