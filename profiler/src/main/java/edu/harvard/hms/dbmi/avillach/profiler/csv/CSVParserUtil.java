package edu.harvard.hms.dbmi.avillach.profiler.csv;

import org.apache.commons.csv.CSVFormat;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class CSVParserUtil {

    private CSVParserUtil() {
    }

    /**
     * The commons-csv format used by every scan: one record per line, blank lines skipped, values kept verbatim apart
     * from quote removal.
     */
    public static CSVFormat format(char delimiter, char quoteChar) {
        return CSVFormat.DEFAULT.builder()
            .setDelimiter(delimiter)
            .setQuote(quoteChar)
            .setIgnoreEmptyLines(true)
            .build();
    }

    /**
     * Splits a raw line on the delimiter wherever it is not inside a quoted section, in one pass over the line. Quotes
     * are kept on the returned fields.
     */
    public static String[] splitLine(String line, char delimiter, char quoteChar) {
        List<String> fields = new ArrayList<>();
        boolean inQuotes = false;
        int fieldStart = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == quoteChar) {
                inQuotes = !inQuotes;
            } else if (c == delimiter && !inQuotes) {
                fields.add(line.substring(fieldStart, i));
                fieldStart = i + 1;
            }
        }
        fields.add(line.substring(fieldStart));
        return fields.toArray(new String[0]);
    }

    public static boolean isQuoted(String field, char quoteChar) {
        return field.length() >= 2 && field.charAt(0) == quoteChar && field.charAt(field.length() - 1) == quoteChar;
    }

    /**
     * commons-csv reports read failures from its record iterator as unchecked exceptions; this restores the
     * {@link IOException} so callers see one failure kind for I/O problems.
     */
    public static IOException readFailure(RuntimeException e) {
        if (e instanceof UncheckedIOException unchecked) {
            return unchecked.getCause();
        }
        if (e.getCause() instanceof IOException io) {
            return io;
        }
        return new IOException("Error reading delimited record: " + e.getMessage(), e);
    }

    public static void requireReadableFile(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("File not found: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a regular file: " + file);
        }
    }
}
