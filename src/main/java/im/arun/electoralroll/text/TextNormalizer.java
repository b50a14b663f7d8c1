package im.arun.electoralroll.text;

import im.arun.electoralroll.config.ElectoralRollConfig;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cleans recognized text before record extraction.
 * <p>
 * {@link #normalize(String)} is total and idempotent: feeding its output back in returns the same string.
 * Character-confusion fixes (O for 0, l for 1, ...) are only applied to tokens where a number is
 * structurally expected, so ordinary words keep their letters.
 */
public class TextNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(TextNormalizer.class);

    private static final Pattern LINE_SEPARATOR = Pattern.compile("\\r\\n?|[\\u2028\\u2029]");
    private static final Pattern NON_PRINTABLE = Pattern.compile("[\\p{Cc}&&[^\\n\\t]]|\\p{Cf}|\\uFFFD");
    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\t\\p{Zs}]+");
    private static final Pattern PUNCTUATION_SPACING = Pattern.compile(" ?([:,]) ?");
    private static final Pattern NOISE_LINE = Pattern.compile("[\\p{P}\\p{S} ]+");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n{3,}");
    private static final Pattern NUMERIC_LABEL_BEFORE = Pattern.compile(
        "(?i)\\b(?:age|sl\\.? ?no\\.?|serial no\\.?|s\\. ?no\\.?)[ ]?[:.\\-]?[ ]?$");
    private static final Pattern HOUSE_LABEL_BEFORE = Pattern.compile(
        "(?i)\\b(?:house|door)(?: ?(?:no\\.?|number))?[ ]?[:.\\-]?[ ]?[a-z0-9/\\-]*$");
    private static final Pattern IDENTIFIER_SHAPE = Pattern.compile("[A-Z]{1,4}[0-9]+");
    private static final int LABEL_CONTEXT = 24;
    private static final int MAX_LABELLED_TOKEN = 4;

    private final Map<Character, Character> digitSubstitutions;
    private final List<LabelCorrection> labelCorrections;
    private final Pattern tokenPattern;

    public TextNormalizer() {
        this(ElectoralRollConfig.defaultDigitSubstitutions(), ElectoralRollConfig.defaultLabelCorrections());
    }

    public TextNormalizer(ElectoralRollConfig config) {
        this(config.getDigitSubstitutions(), config.getLabelCorrections());
    }

    public TextNormalizer(Map<String, String> digitSubstitutions, Map<String, String> labelCorrections) {
        this.digitSubstitutions = new HashMap<>();
        StringBuilder tokenClass = new StringBuilder("[A-Za-z0-9");
        for (Map.Entry<String, String> entry : digitSubstitutions.entrySet()) {
            char from = entry.getKey().charAt(0);
            this.digitSubstitutions.put(from, entry.getValue().charAt(0));
            if (!Character.isLetterOrDigit(from)) {
                tokenClass.append(Pattern.quote(String.valueOf(from)));
            }
        }
        this.tokenPattern = Pattern.compile(tokenClass.append("]+").toString());
        this.labelCorrections = compileLabelCorrections(labelCorrections);
    }

    /**
     * Result of normalization together with the number of corrections applied.
     */
    @Getter
    @AllArgsConstructor
    public static class NormalizedText {
        private final String text;
        private final int corrections;
    }

    @AllArgsConstructor
    private static class LabelCorrection {
        private final Pattern pattern;
        private final String replacement;
    }

    public String normalize(String text) {
        return normalizeWithReport(text).getText();
    }

    public NormalizedText normalizeWithReport(String text) {
        if (text == null || text.isEmpty()) {
            return new NormalizedText("", 0);
        }

        String result = LINE_SEPARATOR.matcher(text).replaceAll("\n");
        result = NON_PRINTABLE.matcher(result).replaceAll("");

        int corrections = 0;
        for (LabelCorrection correction : labelCorrections) {
            Matcher matcher = correction.pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            int found = 0;
            while (matcher.find()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(correction.replacement));
                found++;
            }
            if (found > 0) {
                matcher.appendTail(sb);
                result = sb.toString();
                corrections += found;
            }
        }

        // every space variant is a plain space before punctuation spacing looks at it
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = PUNCTUATION_SPACING.matcher(result).replaceAll("$1 ");
        result = cleanLines(result);
        result = BLANK_LINE_RUN.matcher(result).replaceAll("\n\n");
        result = result.strip();

        DigitPass digitPass = substituteDigits(result);
        corrections += digitPass.substitutions;

        if (corrections > 0) {
            logger.debug("Applied {} text corrections", corrections);
        }
        return new NormalizedText(digitPass.text, corrections);
    }

    private String cleanLines(String text) {
        String[] lines = text.split("\n", -1);
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (!line.isEmpty() && NOISE_LINE.matcher(line).matches()) {
                line = "";
            }
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(line);
        }
        return sb.toString();
    }

    private static class DigitPass {
        private final String text;
        private final int substitutions;

        DigitPass(String text, int substitutions) {
            this.text = text;
            this.substitutions = substitutions;
        }
    }

    private DigitPass substituteDigits(String text) {
        Matcher matcher = tokenPattern.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        int last = 0;
        int substitutions = 0;
        while (matcher.find()) {
            String token = matcher.group();
            String replaced = token;
            if (digitExpected(token, text, matcher.start())) {
                replaced = toDigits(token);
            }
            sb.append(text, last, matcher.start()).append(replaced);
            last = matcher.end();
            if (!replaced.equals(token)) {
                substitutions++;
            }
        }
        sb.append(text, last, text.length());
        return new DigitPass(sb.toString(), substitutions);
    }

    private boolean digitExpected(String token, String text, int start) {
        int digits = 0;
        int convertible = 0;
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (c >= '0' && c <= '9') {
                digits++;
            } else if (digitSubstitutions.containsKey(c)) {
                convertible++;
            } else {
                return false;
            }
        }
        if (convertible == 0) {
            return false;
        }
        // house numbers carry real letter suffixes (12B, 4D)
        if (followsLabel(HOUSE_LABEL_BEFORE, text, start)) {
            return false;
        }
        if (digits > 0 && digits >= convertible && !IDENTIFIER_SHAPE.matcher(token).matches()) {
            return true;
        }
        return token.length() <= MAX_LABELLED_TOKEN && followsLabel(NUMERIC_LABEL_BEFORE, text, start);
    }

    private static boolean followsLabel(Pattern label, String text, int tokenStart) {
        int from = Math.max(0, tokenStart - LABEL_CONTEXT);
        int lineStart = text.lastIndexOf('\n', tokenStart - 1) + 1;
        Matcher matcher = label.matcher(text);
        matcher.region(Math.max(from, lineStart), tokenStart);
        matcher.useTransparentBounds(true);
        return matcher.find();
    }

    private String toDigits(String token) {
        StringBuilder sb = new StringBuilder(token.length());
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            Character digit = digitSubstitutions.get(c);
            sb.append(digit != null ? digit : c);
        }
        return sb.toString();
    }

    private static List<LabelCorrection> compileLabelCorrections(Map<String, String> table) {
        Set<String> wrongForms = new HashSet<>();
        for (String wrong : table.keySet()) {
            wrongForms.add(wrong.toLowerCase(Locale.ROOT));
        }
        List<LabelCorrection> compiled = new ArrayList<>();
        for (Map.Entry<String, String> entry : table.entrySet()) {
            String replacement = entry.getValue();
            if (wrongForms.contains(replacement.toLowerCase(Locale.ROOT))) {
                // a replacement that is itself a misreading would rewrite again on the next pass
                logger.warn("Ignoring label correction {} -> {}: target is also corrected", entry.getKey(), replacement);
                continue;
            }
            Pattern pattern = Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b", Pattern.CASE_INSENSITIVE);
            compiled.add(new LabelCorrection(pattern, replacement));
        }
        return compiled;
    }
}
