package edu.harvard.hms.dbmi.avillach.profiler.field;

/**
 * Letter case of a string field's values.
 */
public enum FieldCase {
    MIXED("mixed"),
    LOWER("lower"),
    UPPER("upper"),
    UNKNOWN("unknown"),
    NOT_APPLICABLE("n/a");

    private final String label;

    FieldCase(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
