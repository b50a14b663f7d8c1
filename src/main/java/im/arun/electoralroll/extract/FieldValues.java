package im.arun.electoralroll.extract;

import im.arun.electoralroll.model.VoterField;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validation and clean-up of raw field values. A value that cannot be classified is dropped.
 */
public final class FieldValues {

    public static final Pattern EPIC = Pattern.compile("\\b([A-Z]{2,4}/\\d+/\\d+/\\d+|[A-Z]{2,4}\\d{6,10})\\b");

    private static final Pattern NAME_PREFIX = Pattern.compile("^[A-Za-z][A-Za-z .'’]*");
    private static final Pattern NUMBER_PREFIX = Pattern.compile("^(\\d{1,5})\\b");
    private static final Pattern FIRST_NUMBER = Pattern.compile("\\b(\\d{1,3})\\b");
    private static final Pattern HOUSE_PREFIX = Pattern.compile("^[A-Za-z0-9/\\-]+(?: [A-Za-z0-9/\\-]+)*");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final int MIN_AGE = 18;
    public static final int MAX_AGE = 120;
    private static final int MAX_NAME_LENGTH = 50;
    private static final int MAX_HOUSE_LENGTH = 30;

    private FieldValues() {
    }

    public static Optional<String> parse(VoterField field, String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        switch (field) {
            case NAME:
            case RELATION_NAME:
                return name(raw);
            case AGE:
                return age(raw);
            case SERIAL_NO:
                return serial(raw);
            case GENDER:
                return gender(raw);
            case HOUSE_NO:
                return house(raw);
            case EPIC:
                return epic(raw);
            default:
                return Optional.empty();
        }
    }

    /**
     * Leading run of letters, spaces, dots and apostrophes; at most 50 characters.
     */
    public static Optional<String> name(String raw) {
        Matcher matcher = NAME_PREFIX.matcher(raw.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String name = WHITESPACE.matcher(matcher.group()).replaceAll(" ").strip();
        name = name.replaceAll("[ .'’]+$", "");
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    public static Optional<String> age(String raw) {
        Matcher matcher = FIRST_NUMBER.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int age = Integer.parseInt(matcher.group(1));
        if (age < MIN_AGE || age > MAX_AGE) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(age));
    }

    public static Optional<String> serial(String raw) {
        Matcher matcher = NUMBER_PREFIX.matcher(raw.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(String.valueOf(Integer.parseInt(matcher.group(1))));
    }

    /**
     * Maps "Male"/"M", "Female"/"F" and "Third Gender"/"T" to M, F and T.
     */
    public static Optional<String> gender(String raw) {
        String value = raw.strip().toLowerCase(Locale.ROOT);
        if (value.startsWith("female") || value.equals("f") || value.startsWith("f ")) {
            return Optional.of("F");
        }
        if (value.startsWith("male") || value.equals("m") || value.startsWith("m ")) {
            return Optional.of("M");
        }
        if (value.startsWith("third") || value.startsWith("transgender") || value.equals("t")
            || value.startsWith("t ")) {
            return Optional.of("T");
        }
        return Optional.empty();
    }

    public static Optional<String> house(String raw) {
        Matcher matcher = HOUSE_PREFIX.matcher(raw.strip());
        if (!matcher.find()) {
            return Optional.empty();
        }
        String house = matcher.group().strip();
        if (house.isEmpty() || house.length() > MAX_HOUSE_LENGTH) {
            return Optional.empty();
        }
        return Optional.of(house);
    }

    public static Optional<String> epic(String raw) {
        Matcher matcher = EPIC.matcher(raw);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }
}
