package edu.harvard.hms.dbmi.avillach.profiler.field;

import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.profiler.config.ProfilerConfig;
import edu.harvard.hms.dbmi.avillach.profiler.csv.CSVParserUtil;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Streams a delimited file once to collect the value distribution of a single field.
 */
public class FrequencyScanner {

    private static final Logger log = LoggerFactory.getLogger(FrequencyScanner.class);

    private final char quoteChar;
    private final Charset charset;
    private final int defaultMaxFreqSize;

    public FrequencyScanner() {
        this(ProfilerConfig.defaults());
    }

    public FrequencyScanner(ProfilerConfig config) {
        this.quoteChar = config.getQuoteChar();
        this.charset = config.getCharset();
        this.defaultMaxFreqSize = config.getMaxFreqSize();
    }

    public FieldFrequency getFieldFreq(Path file, int fieldNumber, boolean hasHeader, char delimiter) throws IOException {
        return getFieldFreq(file, fieldNumber, hasHeader, delimiter, defaultMaxFreqSize);
    }

    public FieldFrequency getFieldFreq(Path file, int fieldNumber, boolean hasHeader, char delimiter, int maxFreqSize)
        throws IOException {
        CSVParserUtil.requireReadableFile(file);
        log.info("Collecting frequencies for field {} of {}", fieldNumber, file.getFileName());
        try (Reader reader = Files.newBufferedReader(file, charset)) {
            return getFieldFreq(reader, fieldNumber, hasHeader, delimiter, maxFreqSize);
        }
    }

    /**
     * Counts the occurrences of each distinct value of one field. The header record is skipped when present, and
     * records too short to hold the field are skipped with a warning. Scanning stops as soon as the map holds
     * {@code maxFreqSize} distinct values, in which case the result is marked truncated.
     * <p>
     * The reader is consumed but not closed; it belongs to the caller.
     *
     * @param fieldNumber zero-based field position
     * @param maxFreqSize cap on distinct values
     * @throws IOException if the reader fails or the input is not parseable with the given delimiter
     */
    public FieldFrequency getFieldFreq(Reader reader, int fieldNumber, boolean hasHeader, char delimiter, int maxFreqSize)
        throws IOException {
        Preconditions.checkArgument(fieldNumber >= 0, "fieldNumber must not be negative but was %s", fieldNumber);
        Preconditions.checkArgument(maxFreqSize > 0, "maxFreqSize must be positive but was %s", maxFreqSize);

        CSVFormat format = CSVParserUtil.format(delimiter, quoteChar);
        Map<String, Long> counts = new HashMap<>();
        long recordsScanned = 0;
        long recordsSkipped = 0;
        boolean truncated = false;

        CSVParser parser = format.parse(reader);
        try {
            Iterator<CSVRecord> records = parser.iterator();
            while (records.hasNext()) {
                CSVRecord record = records.next();
                if (hasHeader && record.getRecordNumber() == 1) {
                    continue;
                }
                if (record.size() <= fieldNumber) {
                    log.warn("Record #{} has too few fields for field {}, skipping.", record.getRecordNumber(), fieldNumber);
                    recordsSkipped++;
                    continue;
                }

                counts.merge(record.get(fieldNumber), 1L, Long::sum);
                recordsScanned++;
                if (counts.size() >= maxFreqSize) {
                    log.warn("Frequency distribution for field {} reached {} distinct values, truncating", fieldNumber, maxFreqSize);
                    truncated = true;
                    break;
                }
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            throw CSVParserUtil.readFailure(e);
        }

        log.info(
            "Field {}: {} records counted, {} skipped, {} distinct values{}", fieldNumber, recordsScanned, recordsSkipped,
            counts.size(), truncated ? " (truncated)" : ""
        );
        return new FieldFrequency(counts, truncated, recordsScanned);
    }

    /**
     * Determines a field's name from the first record of the file only. Blank lines before it are skipped, the same
     * way {@link #getFieldFreq} skips them.
     *
     * @param fieldNumber zero-based field position
     * @return the header value at {@code fieldNumber} when the file has a header, otherwise {@code field_num_<N>};
     *         empty if the file holds no record
     * @throws IllegalArgumentException if the header has no field at {@code fieldNumber}
     */
    public Optional<String> getFieldName(Path file, int fieldNumber, boolean hasHeader, char delimiter) throws IOException {
        Preconditions.checkArgument(fieldNumber >= 0, "fieldNumber must not be negative but was %s", fieldNumber);
        CSVParserUtil.requireReadableFile(file);

        CSVRecord header = null;
        try (Reader reader = Files.newBufferedReader(file, charset);
             CSVParser parser = CSVParserUtil.format(delimiter, quoteChar).parse(reader)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (records.hasNext()) {
                header = records.next();
            }
        } catch (UncheckedIOException | IllegalStateException e) {
            throw CSVParserUtil.readFailure(e);
        }

        if (header == null) {
            return Optional.empty();
        }
        if (!hasHeader) {
            return Optional.of("field_num_" + fieldNumber);
        }
        if (header.size() <= fieldNumber) {
            throw new IllegalArgumentException(String.format(
                "Field %d not found in header of %s. Header has %d fields", fieldNumber, file, header.size()
            ));
        }
        return Optional.of(header.get(fieldNumber).trim());
    }
}
