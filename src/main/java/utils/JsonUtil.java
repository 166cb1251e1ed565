package utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the pipeline's JSON files: raw transaction batches from the generator,
 * the same batches when they are converted to CSV, and {@code pipeline_config.json}.
 * <p>
 * <strong>Naming:</strong> Java properties are camelCase and JSON properties snake_case
 * ({@code recordsPerFile} / {@code records_per_file}). Unknown properties are ignored.
 * <p>
 * The mapper is configured once in the static initializer and never changed afterwards, so
 * callers on any thread may share it.
 */
public final class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtil() {
    }

    /**
     * Serializes {@code value} into {@code target}, replacing any existing file.
     *
     * @throws IOException if the value cannot be serialized or the file cannot be written.
     */
    public static void writeJson(Path target, Object value) throws IOException {
        objectMapper.writeValue(target.toFile(), value);
    }

    /**
     * Reads a JSON file into an instance of {@code type}.
     *
     * @throws IOException if the file is missing or not valid JSON for the type.
     */
    public static <T> T readJson(Path source, Class<T> type) throws IOException {
        try (InputStream in = Files.newInputStream(source)) {
            return objectMapper.readValue(in, type);
        }
    }

    /**
     * Reads a JSON file as a tree, for documents whose shape is not bound to a DTO.
     */
    public static JsonNode readTree(Path source) throws IOException {
        try (InputStream in = Files.newInputStream(source)) {
            return objectMapper.readTree(in);
        }
    }
}
