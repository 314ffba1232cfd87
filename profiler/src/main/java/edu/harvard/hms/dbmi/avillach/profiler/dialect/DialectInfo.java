package edu.harvard.hms.dbmi.avillach.profiler.dialect;

/**
 * Physical structure of a delimited file.
 *
 * @param recordCount every parsed record, the header included
 * @param fieldCount the most common number of fields per sampled record
 */
public record DialectInfo(
    char delimiter,
    char quoteChar,
    boolean quoting,
    boolean hasHeader,
    FormatType formatType,
    long recordCount,
    int fieldCount
) {
}
