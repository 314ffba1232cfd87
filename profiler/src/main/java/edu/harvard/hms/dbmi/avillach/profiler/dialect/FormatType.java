package edu.harvard.hms.dbmi.avillach.profiler.dialect;

/**
 * Overall layout of a file.
 */
public enum FormatType {
    /** every sampled record has the same number of delimited fields, more than one */
    CSV("csv"),
    /** not delimited, but every sampled line has the same length */
    FIXED("fixed"),
    OTHER("other");

    private final String label;

    FormatType(String label) {
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
