package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterField;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds field labels ("Name", "Age", "Sl No", "Father's Name", "S/O", ...) in recognized text.
 * Relation labels are tried before the bare "Name" label so "Husband's Name" is not read as a voter name.
 */
public final class LabelScanner {

    private static final Pattern LABEL = Pattern.compile(
        "(?i)\\b(?:"
            + "(?<relation>(?:father|husband|mother|guardian|other)(?:['’]?s)?\\s*name"
            + "|(?:father|husband)(?=\\s*:)"
            + "|[swd]\\s*/\\s*o)"
            + "|(?<serial>(?:serial|sl|sr|s\\.)\\s*\\.?\\s*no\\.?)"
            + "|(?<house>(?:house|door)\\s*(?:no\\.?|number)|house(?=\\s*:))"
            + "|(?<epic>epic(?:\\s*no\\.?)?|voter\\s*id)"
            + "|(?<name>(?:elector['’]?s?\\s+)?name)"
            + "|(?<age>age)"
            + "|(?<gender>gender|sex)"
            + ")(?![a-z])");

    private static final Pattern LEADING_DELIMITERS = Pattern.compile("^[\\s:.\\-=]+");
    private static final Pattern TRAILING_DELIMITERS = Pattern.compile("[\\s,;|]+$");

    private LabelScanner() {
    }

    @Getter
    @ToString
    @AllArgsConstructor
    public static class LabelHit {
        private final VoterField field;
        private final int start;
        private final int end;
    }

    public static List<LabelHit> scan(String text) {
        List<LabelHit> hits = new ArrayList<>();
        Matcher matcher = LABEL.matcher(text);
        while (matcher.find()) {
            hits.add(new LabelHit(fieldOf(matcher), matcher.start(), matcher.end()));
        }
        return hits;
    }

    /**
     * Raw value following hit {@code index}: the text up to the next label, without delimiters.
     */
    public static String valueAfter(String text, List<LabelHit> hits, int index) {
        int from = hits.get(index).getEnd();
        int to = index + 1 < hits.size() ? hits.get(index + 1).getStart() : text.length();
        String raw = text.substring(from, to);
        raw = LEADING_DELIMITERS.matcher(raw).replaceFirst("");
        return TRAILING_DELIMITERS.matcher(raw).replaceFirst("");
    }

    private static VoterField fieldOf(Matcher matcher) {
        if (matcher.group("relation") != null) return VoterField.RELATION_NAME;
        if (matcher.group("serial") != null) return VoterField.SERIAL_NO;
        if (matcher.group("house") != null) return VoterField.HOUSE_NO;
        if (matcher.group("epic") != null) return VoterField.EPIC;
        if (matcher.group("name") != null) return VoterField.NAME;
        if (matcher.group("age") != null) return VoterField.AGE;
        return VoterField.GENDER;
    }
}
