package edu.harvard.hms.dbmi.avillach.profiler.dialect;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;
import edu.harvard.hms.dbmi.avillach.profiler.config.ProfilerConfig;
import edu.harvard.hms.dbmi.avillach.profiler.csv.CSVParserUtil;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Works out the physical structure of a delimited file: delimiter, quoting, header, record and field counts and the
 * overall format. Any of delimiter, quoting and header can be supplied up front, in which case it is taken as given.
 * <p>
 * Results are published by {@link #analyze()} and cached on the instance; the accessors fail until it has run.
 */
public class DialectDetector {

    private static final Logger log = LoggerFactory.getLogger(DialectDetector.class);

    /**
     * Delimiters tried when none is supplied, in order of preference.
     */
    public static final List<Character> CANDIDATE_DELIMITERS = ImmutableList.of(',', '|', '\t', ';', ':');

    private static final Set<ValueType> TYPED_VALUES = EnumSet.of(ValueType.INTEGER, ValueType.FLOAT, ValueType.TIMESTAMP);

    private final Path file;
    private final @Nullable Character delimiterHint;
    private final @Nullable Boolean quotingHint;
    private final @Nullable Boolean headerHint;
    private final char quoteChar;
    private final int sampleSize;
    private final Charset charset;
    private final ValueClassifier classifier;

    private DialectInfo dialect;

    public DialectDetector(Path file) {
        this(file, null, null, null, ProfilerConfig.defaults());
    }

    public DialectDetector(
        Path file, @Nullable Character delimiter, @Nullable Boolean quoting, @Nullable Boolean hasHeader, ProfilerConfig config
    ) {
        this(file, delimiter, quoting, hasHeader, config, config.newClassifier());
    }

    /**
     * @param classifier decides the value types compared when voting on a header
     */
    public DialectDetector(
        Path file, @Nullable Character delimiter, @Nullable Boolean quoting, @Nullable Boolean hasHeader,
        ProfilerConfig config, ValueClassifier classifier
    ) {
        this.file = Preconditions.checkNotNull(file, "file");
        this.delimiterHint = delimiter;
        this.quotingHint = quoting;
        this.headerHint = hasHeader;
        this.quoteChar = config.getQuoteChar();
        this.sampleSize = config.getSampleSize();
        this.charset = config.getCharset();
        this.classifier = Preconditions.checkNotNull(classifier, "classifier");
    }

    /**
     * Scans the file and publishes its dialect. Only the first call touches the file; later calls return the cached
     * result.
     *
     * @throws IOException if the file is missing or cannot be read
     */
    public DialectInfo analyze() throws IOException {
        if (dialect != null) {
            return dialect;
        }
        CSVParserUtil.requireReadableFile(file);
        log.info("Analyzing dialect of {}", file.toAbsolutePath());

        List<String> sample = readSample();
        if (sample.isEmpty()) {
            log.warn("File {} is empty", file.getFileName());
            dialect = new DialectInfo(
                delimiterHint == null ? ',' : delimiterHint, quoteChar, Boolean.TRUE.equals(quotingHint),
                Boolean.TRUE.equals(headerHint), FormatType.OTHER, 0, 0
            );
            return dialect;
        }

        char delimiter = delimiterHint == null ? detectDelimiter(sample) : delimiterHint;
        Optional<List<List<String>>> records = parseSample(sample, delimiter);

        FormatType formatType = detectFormat(sample, records);
        int fieldCount = records.map(DialectDetector::mostCommonFieldCount)
            .orElseGet(() -> mostCommonFieldCount(splitSample(sample, delimiter)));
        boolean hasHeader = headerHint == null ? records.map(this::detectHeader).orElse(false) : headerHint;
        boolean quoting = quotingHint == null ? detectQuoting(sample, delimiter, hasHeader) : quotingHint;
        long recordCount = countRecords(delimiter);

        dialect = new DialectInfo(delimiter, quoteChar, quoting, hasHeader, formatType, recordCount, fieldCount);
        log.info(
            "File {}: format {}, delimiter '{}', quoting {}, header {}, {} records of {} fields", file.getFileName(),
            formatType, delimiter, quoting, hasHeader, recordCount, fieldCount
        );
        return dialect;
    }

    public Path getFile() {
        return file;
    }

    public DialectInfo getDialect() {
        Preconditions.checkState(dialect != null, "analyze() has not been run for %s", file);
        return dialect;
    }

    public long getRecordCount() {
        return getDialect().recordCount();
    }

    public int getFieldCount() {
        return getDialect().fieldCount();
    }

    public FormatType getFormatType() {
        return getDialect().formatType();
    }

    public char getDelimiter() {
        return getDialect().delimiter();
    }

    public boolean isQuoting() {
        return getDialect().quoting();
    }

    public boolean hasHeader() {
        return getDialect().hasHeader();
    }

    private List<String> readSample() throws IOException {
        List<String> sample = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
            String line;
            while (sample.size() < sampleSize && (line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    sample.add(line);
                }
            }
        }
        return sample;
    }

    /**
     * Picks the first candidate that splits every sampled record into the same number of fields, more than one.
     * Without such a candidate, falls back to the one occurring most often on the first line.
     */
    char detectDelimiter(List<String> sample) {
        for (char candidate : CANDIDATE_DELIMITERS) {
            Optional<List<List<String>>> records = parseSample(sample, candidate);
            if (records.isPresent() && isRegular(records.get())) {
                log.debug("Delimiter '{}' gives {} fields on every sampled record", candidate, records.get().get(0).size());
                return candidate;
            }
        }

        String firstLine = sample.get(0);
        char mostFrequent = ',';
        long mostOccurrences = 0;
        for (char candidate : CANDIDATE_DELIMITERS) {
            long occurrences = firstLine.chars().filter(c -> c == candidate).count();
            if (occurrences > mostOccurrences) {
                mostFrequent = candidate;
                mostOccurrences = occurrences;
            }
        }
        log.debug("No delimiter splits the sample regularly, using '{}' from the first line", mostFrequent);
        return mostFrequent;
    }

    private FormatType detectFormat(List<String> sample, Optional<List<List<String>>> records) {
        if (records.isPresent() && isRegular(records.get())) {
            return FormatType.CSV;
        }
        int length = sample.get(0).length();
        boolean sameLength = sample.stream().allMatch(line -> line.length() == length);
        if (sample.size() > 1 && sameLength && sample.stream().anyMatch(line -> line.contains(" "))) {
            return FormatType.FIXED;
        }
        return FormatType.OTHER;
    }

    /**
     * Quoting holds when every sampled data line has at least one field wrapped in the quote character.
     */
    private boolean detectQuoting(List<String> sample, char delimiter, boolean hasHeader) {
        List<String> lines = hasHeader && sample.size() > 1 ? sample.subList(1, sample.size()) : sample;
        for (String line : lines) {
            boolean quotedField = Arrays.stream(CSVParserUtil.splitLine(line, delimiter, quoteChar))
                .anyMatch(field -> CSVParserUtil.isQuoted(field.trim(), quoteChar));
            if (!quotedField) {
                return false;
            }
        }
        return true;
    }

    /**
     * Votes column by column on whether the first record looks different from the rest. A column whose values all
     * share a numeric or timestamp type votes for a header when the first value lacks that type; a column of strings
     * that all share one length votes for a header when the first value has another length. Matching first values vote
     * against.
     */
    boolean detectHeader(List<List<String>> records) {
        if (records.size() < 2) {
            return false;
        }
        List<String> first = records.get(0);
        List<List<String>> rows = records.subList(1, records.size()).stream()
            .filter(row -> row.size() == first.size())
            .toList();
        if (rows.isEmpty()) {
            return false;
        }

        int votes = 0;
        for (int column = 0; column < first.size(); column++) {
            Set<ValueType> types = EnumSet.noneOf(ValueType.class);
            Set<Integer> lengths = new HashSet<>();
            for (List<String> row : rows) {
                String value = row.get(column);
                ValueType type = classifier.classify(value);
                if (type != ValueType.UNKNOWN) {
                    types.add(type);
                    lengths.add(value.length());
                }
            }
            if (types.size() != 1) {
                continue;
            }

            ValueType columnType = types.iterator().next();
            String candidate = first.get(column);
            if (TYPED_VALUES.contains(columnType)) {
                votes += classifier.classify(candidate) == columnType ? -1 : 1;
            } else if (lengths.size() == 1) {
                votes += lengths.contains(candidate.length()) ? -1 : 1;
            }
        }
        log.debug("Header vote for {}: {}", file.getFileName(), votes);
        return votes > 0;
    }

    private long countRecords(char delimiter) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, charset);
             CSVParser parser = CSVParserUtil.format(delimiter, quoteChar).parse(reader)) {
            long count = 0;
            for (CSVRecord ignored : parser) {
                count++;
            }
            return count;
        } catch (UncheckedIOException | IllegalStateException e) {
            log.warn("Could not parse {} with delimiter '{}', counting lines instead: {}", file.getFileName(), delimiter, e.getMessage());
        }

        try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
            return reader.lines().filter(line -> !line.isBlank()).count();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    private Optional<List<List<String>>> parseSample(List<String> sample, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        try (CSVParser parser = CSVParser.parse(String.join("\n", sample), CSVParserUtil.format(delimiter, quoteChar))) {
            for (CSVRecord record : parser) {
                records.add(record.toList());
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            log.debug("Sample does not parse with delimiter '{}': {}", delimiter, e.getMessage());
            return Optional.empty();
        }
        return records.isEmpty() ? Optional.empty() : Optional.of(records);
    }

    private List<List<String>> splitSample(List<String> sample, char delimiter) {
        return sample.stream()
            .map(line -> Arrays.asList(CSVParserUtil.splitLine(line, delimiter, quoteChar)))
            .toList();
    }

    private static boolean isRegular(List<List<String>> records) {
        int fieldCount = records.get(0).size();
        return fieldCount > 1 && records.stream().allMatch(record -> record.size() == fieldCount);
    }

    private static int mostCommonFieldCount(List<List<String>> records) {
        Map<Integer, Integer> occurrences = new HashMap<>();
        for (List<String> record : records) {
            occurrences.merge(record.size(), 1, Integer::sum);
        }
        return occurrences.entrySet().stream()
            .max(Map.Entry.<Integer, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey()))
            .map(Map.Entry::getKey)
            .orElse(0);
    }
}
