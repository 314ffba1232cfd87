package edu.harvard.hms.dbmi.avillach.profiler.config;

import edu.harvard.hms.dbmi.avillach.profiler.classify.ValueClassifier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private final ConfigLoader configLoader = new ConfigLoader();

    @Test
    void shouldUseDefaultsWhenFileIsMissing(@TempDir Path testDir) throws IOException {
        ProfilerConfig config = configLoader.load(testDir.resolve("profiler.json"));

        assertEquals(ProfilerConfig.MAX_FREQ_SIZE_DEFAULT, config.getMaxFreqSize());
        assertEquals(ProfilerConfig.SAMPLE_SIZE_DEFAULT, config.getSampleSize());
        assertEquals('"', config.getQuoteChar());
        assertEquals(StandardCharsets.UTF_8, config.getCharset());
        assertTrue(config.getUnknownMarkers().contains("unknown"));
    }

    @Test
    void shouldLoadValuesFromJson(@TempDir Path testDir) throws IOException {
        Path configFile = testDir.resolve("profiler.json");
        Files.writeString(configFile, """
            {
              "max_freq_size": 50,
              "sample_size": 200,
              "quote_char": "'",
              "charset": "ISO-8859-1",
              "unknown_markers": ["-", "missing"],
              "some_future_key": true
            }
            """);

        ProfilerConfig config = configLoader.load(configFile);

        assertEquals(50, config.getMaxFreqSize());
        assertEquals(200, config.getSampleSize());
        assertEquals('\'', config.getQuoteChar());
        assertEquals(StandardCharsets.ISO_8859_1, config.getCharset());
        assertEquals(List.of("-", "missing"), config.getUnknownMarkers());

        ValueClassifier classifier = config.newClassifier();
        assertTrue(classifier.isUnknown("MISSING"));
        assertFalse(classifier.isUnknown("unknown"));
        assertTrue(classifier.isTimestamp("2021-03-14"));
    }

    @Test
    void shouldFailOnMalformedJson(@TempDir Path testDir) throws IOException {
        Path configFile = testDir.resolve("profiler.json");
        Files.writeString(configFile, "{ \"max_freq_size\": ");

        IOException exception = assertThrows(IOException.class, () -> configLoader.load(configFile));
        assertTrue(exception.getMessage().startsWith("Failed to load profiler config"));
    }

    @Test
    void shouldRejectOutOfRangeValues(@TempDir Path testDir) throws IOException {
        Path configFile = testDir.resolve("profiler.json");
        Files.writeString(configFile, "{\"max_freq_size\": 0}");

        assertThrows(IllegalArgumentException.class, () -> configLoader.load(configFile));
    }

    @Test
    void shouldRejectDirectory(@TempDir Path testDir) {
        assertThrows(IOException.class, () -> configLoader.load(testDir));
    }

    @Test
    void shouldRejectUnknownCharset(@TempDir Path testDir) throws IOException {
        Path configFile = testDir.resolve("profiler.json");
        Files.writeString(configFile, "{\"charset\": \"no-such-charset\"}");

        assertThrows(IllegalArgumentException.class, () -> configLoader.load(configFile));
    }
}
