package Flink;

import Engine.AggregationEngine;
import Engine.CsvFileSink;
import Engine.ExecutionBackend;
import Engine.Normalizer;
import Engine.RowSource;
import Engine.Sink;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.ExecutionOptions;
import org.apache.flink.configuration.RestartStrategyOptions;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Distributed backend on Apache Flink.
 * <p>
 * <strong>Execution context:</strong> one {@link StreamExecutionEnvironment} in {@code BATCH}
 * runtime mode is shared by all stages. Launched through {@code flink run} it targets the
 * cluster; launched directly it starts an in-process mini cluster per job.
 * <p>
 * <strong>Failure policy:</strong> restart strategy {@code none}. A failed task fails its job
 * and the error propagates to the calling stage; nothing is retried.
 */
public class FlinkBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(FlinkBackend.class);

    private final StreamExecutionEnvironment env;
    private final RowSource rowSource;
    private final Normalizer normalizer;
    private final AggregationEngine aggregationEngine;
    private final Sink sink;

    /**
     * @param parallelism job parallelism, or 0 to keep the environment's default
     */
    public FlinkBackend(int parallelism, char delimiter, String extension) {
        Configuration conf = new Configuration();
        conf.set(ExecutionOptions.RUNTIME_MODE, RuntimeExecutionMode.BATCH);
        conf.set(RestartStrategyOptions.RESTART_STRATEGY, "none");

        this.env = StreamExecutionEnvironment.getExecutionEnvironment(conf);
        if (parallelism > 0) {
            env.setParallelism(parallelism);
        }
        this.rowSource = new FlinkRowSource(env, delimiter, extension);
        this.normalizer = new FlinkNormalizer(env);
        this.aggregationEngine = new FlinkAggregationEngine(env);
        this.sink = new CsvFileSink(delimiter);
        log.info("Initialized Flink execution environment (parallelism={})", env.getParallelism());
    }

    @Override
    public String name() {
        return "flink";
    }

    @Override
    public RowSource rowSource() {
        return rowSource;
    }

    @Override
    public Normalizer normalizer() {
        return normalizer;
    }

    @Override
    public AggregationEngine aggregationEngine() {
        return aggregationEngine;
    }

    @Override
    public Sink sink() {
        return sink;
    }

    @Override
    public void close() throws Exception {
        env.close();
        log.info("Flink execution environment closed");
    }
}
