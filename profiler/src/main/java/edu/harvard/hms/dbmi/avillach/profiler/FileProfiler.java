package edu.harvard.hms.dbmi.avillach.profiler;

import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueType;
import edu.harvard.hms.dbmi.avillach.profiler.config.ProfilerConfig;
import edu.harvard.hms.dbmi.avillach.profiler.dialect.DialectDetector;
import edu.harvard.hms.dbmi.avillach.profiler.dialect.DialectInfo;
import edu.harvard.hms.dbmi.avillach.profiler.field.FieldFrequency;
import edu.harvard.hms.dbmi.avillach.profiler.field.FieldProfile;
import edu.harvard.hms.dbmi.avillach.profiler.field.FieldStatistics;
import edu.harvard.hms.dbmi.avillach.profiler.field.FieldTypeInferrer;
import edu.harvard.hms.dbmi.avillach.profiler.field.FrequencyScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Profiles every field of a delimited file. The dialect is detected first; each field is then scanned in its own pass
 * and summarized from its frequency distribution.
 */
public class FileProfiler {

    private static final Logger log = LoggerFactory.getLogger(FileProfiler.class);

    private final ProfilerConfig config;
    private final ValueClassifier classifier;
    private final FrequencyScanner scanner;
    private final FieldStatistics statistics;
    private final FieldTypeInferrer typeInferrer;

    public FileProfiler() {
        this(ProfilerConfig.defaults());
    }

    public FileProfiler(ProfilerConfig config) {
        this(config, config.newClassifier());
    }

    public FileProfiler(ProfilerConfig config, ValueClassifier classifier) {
        config.validate();
        this.config = config;
        this.classifier = classifier;
        this.scanner = new FrequencyScanner(config);
        this.statistics = new FieldStatistics(classifier);
        this.typeInferrer = new FieldTypeInferrer(classifier);
    }

    public FileProfile profile(Path file) throws IOException {
        return profile(new DialectDetector(file, null, null, null, config, classifier));
    }

    /**
     * @param delimiter known delimiter, or null to detect it
     * @param hasHeader known header presence, or null to detect it
     */
    public FileProfile profile(Path file, @Nullable Character delimiter, @Nullable Boolean hasHeader) throws IOException {
        return profile(new DialectDetector(file, delimiter, null, hasHeader, config, classifier));
    }

    private FileProfile profile(DialectDetector detector) throws IOException {
        long startTime = System.nanoTime();
        DialectInfo dialect = detector.analyze();
        Path file = detector.getFile();

        List<FieldProfile> fields = new ArrayList<>();
        for (int fieldNumber = 0; fieldNumber < dialect.fieldCount(); fieldNumber++) {
            fields.add(profileField(file, fieldNumber, dialect));
        }

        log.info("Profiled {} fields of {} in {} ms", fields.size(), file.getFileName(), (System.nanoTime() - startTime) / 1_000_000);
        return new FileProfile(file, dialect, fields);
    }

    private FieldProfile profileField(Path file, int fieldNumber, DialectInfo dialect) throws IOException {
        String name = scanner.getFieldName(file, fieldNumber, dialect.hasHeader(), dialect.delimiter())
            .orElse("field_num_" + fieldNumber);
        FieldFrequency frequency = scanner.getFieldFreq(file, fieldNumber, dialect.hasHeader(), dialect.delimiter());
        if (frequency.truncated()) {
            log.warn("Statistics for field {} ({}) are based on a truncated distribution", fieldNumber, name);
        }

        Map<String, Long> counts = frequency.counts();
        ValueType valueType = typeInferrer.inferType(frequency);
        return new FieldProfile(
            fieldNumber,
            name,
            valueType,
            statistics.getCase(valueType, counts),
            statistics.getMin(valueType, counts),
            statistics.getMax(valueType, counts),
            statistics.getMinLength(counts),
            statistics.getMaxLength(counts),
            frequency.distinctCount(),
            frequency.truncated()
        );
    }
}
