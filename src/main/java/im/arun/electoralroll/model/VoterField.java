package im.arun.electoralroll.model;

/**
 * Named fields of a voter record, in spreadsheet column order.
 */
public enum VoterField {
    SERIAL_NO("Serial No"),
    EPIC("EPIC"),
    NAME("Name"),
    RELATION_NAME("Father/Husband Name"),
    HOUSE_NO("House No"),
    AGE("Age"),
    GENDER("Gender");

    private final String columnName;

    VoterField(String columnName) {
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
