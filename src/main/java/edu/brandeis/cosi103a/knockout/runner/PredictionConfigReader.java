package edu.brandeis.cosi103a.knockout.runner;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link PredictionConfig} from JSON.
 */
public final class PredictionConfigReader {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);

    private PredictionConfigReader() {}

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IOException              if the file cannot be read or parsed
     */
    public static PredictionConfig read(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Run file not found: " + configFile);
        }
        PredictionConfig config = MAPPER.readValue(configFile.toFile(), PredictionConfig.class);
        if (config.name() == null || config.name().isBlank()) {
            String fileName = configFile.getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            config = config.withName(dot > 0 ? fileName.substring(0, dot) : fileName);
        }
        return config;
    }
}
