package im.arun.electoralroll.extract;

import java.util.regex.Pattern;

/**
 * Cheap measure of how record-like a text is: the number of lines carrying a labelled name,
 * a labelled age or an EPIC number. Used to rank recognition attempts, never to build records.
 */
public class StructuralProbe {

    private static final Pattern RECORD_SHAPE = Pattern.compile(
        "(?i:\\bname\\b\\s*[:.\\-]?\\s*[a-z])"
            + "|(?i:\\bage\\b\\s*[:.\\-]?\\s*\\d)"
            + "|\\b[A-Z]{2,4}\\d{6,10}\\b"
            + "|\\b[A-Z]{2,4}(?:/\\d+){3}\\b");

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int matches = 0;
        for (String line : text.split("\n")) {
            if (RECORD_SHAPE.matcher(line).find()) {
                matches++;
            }
        }
        return matches;
    }
}
