package edu.harvard.hms.dbmi.avillach.profiler.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import edu.harvard.hms.dbmi.avillach.profiler.classify.StandardValueClassifier;
import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings shared by the scanners and the dialect detector. JSON keys are snake_case to match the keys of the
 * profiler config file; every key is optional and falls back to the default below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProfilerConfig {

    public static final int MAX_FREQ_SIZE_DEFAULT = 10000;
    public static final int SAMPLE_SIZE_DEFAULT = 1000;
    public static final char QUOTE_CHAR_DEFAULT = '"';
    public static final String CHARSET_DEFAULT = "UTF-8";

    @JsonProperty("max_freq_size")
    private int maxFreqSize = MAX_FREQ_SIZE_DEFAULT;

    @JsonProperty("sample_size")
    private int sampleSize = SAMPLE_SIZE_DEFAULT;

    @JsonProperty("quote_char")
    private char quoteChar = QUOTE_CHAR_DEFAULT;

    @JsonProperty("charset")
    private String charset = CHARSET_DEFAULT;

    @JsonProperty("unknown_markers")
    private List<String> unknownMarkers = new ArrayList<>(StandardValueClassifier.DEFAULT_UNKNOWN_MARKERS);

    @JsonProperty("timestamp_patterns")
    private List<String> timestampPatterns = new ArrayList<>(StandardValueClassifier.DEFAULT_TIMESTAMP_PATTERNS);

    public static ProfilerConfig defaults() {
        return new ProfilerConfig();
    }

    /**
     * Builds the classifier described by the configured unknown markers and timestamp patterns.
     */
    public ValueClassifier newClassifier() {
        return new StandardValueClassifier(unknownMarkers, timestampPatterns);
    }

    /**
     * @throws IllegalArgumentException if a size is not positive or the charset is not available
     */
    public void validate() {
        Preconditions.checkArgument(maxFreqSize > 0, "max_freq_size must be positive but was %s", maxFreqSize);
        Preconditions.checkArgument(sampleSize > 0, "sample_size must be positive but was %s", sampleSize);
        Preconditions.checkArgument(charset != null && Charset.isSupported(charset), "charset %s is not supported", charset);
        Preconditions.checkArgument(unknownMarkers != null, "unknown_markers must not be null");
        Preconditions.checkArgument(timestampPatterns != null, "timestamp_patterns must not be null");
    }

    public int getMaxFreqSize() {
        return maxFreqSize;
    }

    public ProfilerConfig setMaxFreqSize(int maxFreqSize) {
        this.maxFreqSize = maxFreqSize;
        return this;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public ProfilerConfig setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
        return this;
    }

    public char getQuoteChar() {
        return quoteChar;
    }

    public ProfilerConfig setQuoteChar(char quoteChar) {
        this.quoteChar = quoteChar;
        return this;
    }

    /**
     * Encoding used to read every scanned file.
     */
    public Charset getCharset() {
        return Charset.forName(charset);
    }

    public ProfilerConfig setCharset(String charset) {
        this.charset = charset;
        return this;
    }

    public List<String> getUnknownMarkers() {
        return unknownMarkers;
    }

    public ProfilerConfig setUnknownMarkers(List<String> unknownMarkers) {
        this.unknownMarkers = unknownMarkers;
        return this;
    }

    public List<String> getTimestampPatterns() {
        return timestampPatterns;
    }

    public ProfilerConfig setTimestampPatterns(List<String> timestampPatterns) {
        this.timestampPatterns = timestampPatterns;
        return this;
    }

    @Override
    public String toString() {
        return "ProfilerConfig{max_freq_size=" + maxFreqSize + ", sample_size=" + sampleSize + ", quote_char=" + quoteChar
            + ", charset=" + charset + ", unknown_markers=" + unknownMarkers + ", timestamp_patterns=" + timestampPatterns + "}";
    }
}
