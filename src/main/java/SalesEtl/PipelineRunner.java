package SalesEtl;

import Dto.RawTransaction;
import Dto.Transaction;
import Engine.AggregationView;
import Engine.Dataset;
import Engine.ExecutionBackend;
import Engine.Stage;
import Exceptions.PipelineException;
import Exceptions.StageFailedException;
import Ingest.JsonToCsvConverter;
import Ingest.TransactionDataGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Runs the pipeline end to end: data generation, JSON to CSV conversion, then the
 * transform-and-aggregate engine on the configured backend.
 * <p>
 * Steps run strictly one after the other and the first failing step ends the run. Nothing is
 * retried; artifacts written before a failure are left in place.
 */
public class PipelineRunner {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    static final String CLEANED_DATA = "cleaned_data";

    private final PipelineConfig config;
    private final TransactionDataGenerator generator;

    public PipelineRunner(PipelineConfig config) {
        this(config, TransactionDataGenerator.create(config.getRandomSeed()));
    }

    PipelineRunner(PipelineConfig config, TransactionDataGenerator generator) {
        this.config = config;
        this.generator = generator;
    }

    /**
     * @param skipGeneration start from the JSON files already in the raw directory
     * @return true if every step succeeded
     */
    public boolean run(boolean skipGeneration) {
        long pipelineStart = System.nanoTime();
        log.info("Starting data processing pipeline");

        if (skipGeneration) {
            log.info("Skipping data generation, using existing files in {}", config.rawDataPath());
        } else if (!runStep("Data Generation", () -> generator.generate(
                config.getNumFiles(), config.getRecordsPerFile(), config.rawDataPath()))) {
            log.error("Pipeline failed at data generation step");
            return false;
        }

        if (!runStep("JSON to CSV Conversion", () -> new JsonToCsvConverter(config.delimiterChar(),
                config.getFileExtension()).convertAll(config.rawDataPath(), config.processedDataPath()))) {
            log.error("Pipeline failed at JSON to CSV conversion step");
            return false;
        }

        String transformStep = config.isFlink() ? "Data Transformation (Flink)" : "Data Transformation";
        if (!runStep(transformStep, () -> transform(config.processedDataPath(), config.curatedDataPath()))) {
            log.error("Pipeline failed at data transformation step");
            return false;
        }

        log.info("Pipeline completed successfully in {} seconds", seconds(pipelineStart));
        return true;
    }

    /**
     * Runs the engine on its own: reads {@code inputDir}, writes {@code cleaned_data} and one
     * artifact per view into {@code outputDir}. The backend is closed whatever the outcome.
     *
     * @throws StageFailedException naming the stage that failed
     */
    public void transform(Path inputDir, Path outputDir) throws Exception {
        try (ExecutionBackend backend = Backends.create(config)) {
            log.info("Starting data transformation on the {} backend", backend.name());
            transform(backend, inputDir, outputDir, config.getFileExtension());
        }
    }

    static void transform(ExecutionBackend backend, Path inputDir, Path outputDir, String extension)
            throws StageFailedException {
        Dataset<RawTransaction> raw = inStage(Stage.ROW_SOURCE, () -> backend.rowSource().load(Set.of(inputDir)));
        Dataset<Transaction> cleaned = inStage(Stage.NORMALIZER, () -> backend.normalizer().normalize(raw));
        Map<String, AggregationView<?>> views = inStage(Stage.AGGREGATION,
                () -> backend.aggregationEngine().aggregate(cleaned));

        inStage(Stage.SINK, () -> {
            backend.sink().persist(CLEANED_DATA, cleaned, outputDir.resolve(CLEANED_DATA + "." + extension));
            for (AggregationView<?> view : views.values()) {
                backend.sink().persist(view.getName(), view.getDataset(),
                        outputDir.resolve(view.getName() + "." + extension));
            }
            return null;
        });
        log.info("Data transformation completed, {} artifacts written to {}", views.size() + 1, outputDir);
    }

    private boolean runStep(String stepName, Step step) {
        log.info("Starting step: {}", stepName);
        long start = System.nanoTime();
        try {
            step.run();
        } catch (Exception e) {
            log.error("Error in step {}: {}", stepName, e.getMessage(), e);
            return false;
        }
        log.info("Completed step: {} in {} seconds", stepName, seconds(start));
        return true;
    }

    private static <T> T inStage(Stage stage, StageAction<T> action) throws StageFailedException {
        try {
            return action.run();
        } catch (PipelineException e) {
            throw new StageFailedException(stage, e);
        }
    }

    private static String seconds(long startNanos) {
        return String.format(Locale.ROOT, "%.2f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    @FunctionalInterface
    private interface Step {
        void run() throws Exception;
    }

    @FunctionalInterface
    private interface StageAction<T> {
        T run() throws PipelineException;
    }
}
