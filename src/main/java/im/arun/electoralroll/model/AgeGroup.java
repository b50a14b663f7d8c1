package im.arun.electoralroll.model;

import java.util.Optional;

/**
 * Age buckets reported in the spreadsheet and the run statistics.
 */
public enum AgeGroup {
    UNDER_18("Under 18"),
    YOUNG("18-29"),
    MIDDLE("30-45"),
    SENIOR("46+");

    private final String label;

    AgeGroup(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static AgeGroup of(int age) {
        if (age < 18) {
            return UNDER_18;
        }
        if (age <= 29) {
            return YOUNG;
        }
        if (age <= 45) {
            return MIDDLE;
        }
        return SENIOR;
    }

    public static Optional<AgeGroup> of(VoterRecord record) {
        return record.get(VoterField.AGE).flatMap(age -> {
            try {
                return Optional.of(of(Integer.parseInt(age)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        });
    }
}
