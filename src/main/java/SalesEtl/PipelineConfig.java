package SalesEtl;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import utils.JsonUtil;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings of a pipeline run, read from a snake_case JSON file such as
 * <pre>
 * {
 *   "num_files": 10,
 *   "records_per_file": 1000,
 *   "raw_data_dir": "data/raw",
 *   "processed_data_dir": "data/processed",
 *   "curated_data_dir": "data/curated",
 *   "backend": "local"
 * }
 * </pre>
 * Absent properties keep their defaults.
 */
@Data
@NoArgsConstructor
public class PipelineConfig {

    public static final String LOCAL = "local";
    public static final String FLINK = "flink";

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    private int numFiles = 10;
    private int recordsPerFile = 1000;
    private String rawDataDir = "data/raw";
    private String processedDataDir = "data/processed";
    private String curatedDataDir = "data/curated";

    /**
     * {@value #LOCAL} or {@value #FLINK}.
     */
    private String backend = LOCAL;

    /**
     * Flink job parallelism; 0 keeps the environment default.
     */
    private int flinkParallelism = 0;

    private String delimiter = ",";
    private String fileExtension = "csv";

    /**
     * Seed of the data generator; null draws a fresh one per run.
     */
    private Long randomSeed;

    /**
     * Reads the configuration file. A file that cannot be read or parsed is logged and
     * replaced by the defaults, so a run never fails on its configuration alone.
     */
    public static PipelineConfig load(Path configFile) {
        try {
            PipelineConfig config = JsonUtil.readJson(configFile, PipelineConfig.class);
            log.info("Loaded configuration from {}", configFile);
            return config;
        } catch (IOException e) {
            log.error("Error loading configuration: {}", e.getMessage());
            PipelineConfig defaults = new PipelineConfig();
            log.info("Using default configuration: {}", defaults);
            return defaults;
        }
    }

    public boolean isFlink() {
        return FLINK.equalsIgnoreCase(backend);
    }

    /**
     * @throws IllegalArgumentException unless the delimiter is exactly one character
     */
    public char delimiterChar() {
        if (delimiter == null || delimiter.length() != 1) {
            throw new IllegalArgumentException("delimiter must be a single character, got '" + delimiter + "'");
        }
        return delimiter.charAt(0);
    }

    public Path rawDataPath() {
        return Paths.get(rawDataDir);
    }

    public Path processedDataPath() {
        return Paths.get(processedDataDir);
    }

    /**
     * The curated output directory. Flink runs write next to local ones, under a {@code _flink} suffix.
     */
    public Path curatedDataPath() {
        return Paths.get(isFlink() ? curatedDataDir + "_flink" : curatedDataDir);
    }
}
