package edu.harvard.hms.dbmi.avillach.profiler.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads the profiler configuration from a JSON file. A missing file is not an error: the defaults are used and a
     * warning is logged.
     *
     * @param configFile path to the JSON config file
     * @return the loaded, validated configuration
     * @throws IOException if the file exists but cannot be read or is not valid JSON
     * @throws IllegalArgumentException if the file holds out-of-range values
     */
    public ProfilerConfig load(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            log.warn("No profiler config found at {}, using default settings", configFile.toAbsolutePath());
            return ProfilerConfig.defaults();
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("Not a regular file: " + configFile);
        }

        ProfilerConfig config;
        try {
            config = objectMapper.readValue(configFile.toFile(), ProfilerConfig.class);
        } catch (IOException e) {
            throw new IOException("Failed to load profiler config from " + configFile + ": " + e.getMessage(), e);
        }
        config.validate();
        log.info("Loaded config from {}", configFile.toAbsolutePath());
        log.debug("Profiler config: {}", config);
        return config;
    }
}
