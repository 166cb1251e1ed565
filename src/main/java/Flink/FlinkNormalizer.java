package Flink;

import Dto.RawTransaction;
import Dto.Transaction;
import Engine.Dataset;
import Engine.Normalizer;
import Engine.TransactionNormalizer;
import Engine.TransactionSchema;
import Exceptions.PipelineException;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link TransactionNormalizer} as a Flink map operator.
 * <p>
 * The normalized stream stays lazy for the downstream jobs, but a count job runs here so that
 * coercion failures surface in the normalize stage rather than in whichever stage first reads
 * the rows.
 */
public class FlinkNormalizer implements Normalizer {

    private static final Logger log = LoggerFactory.getLogger(FlinkNormalizer.class);

    private final StreamExecutionEnvironment env;

    public FlinkNormalizer(StreamExecutionEnvironment env) {
        this.env = env;
    }

    @Override
    public Dataset<Transaction> normalize(Dataset<RawTransaction> dataset) throws PipelineException {
        DataStream<RawTransaction> input = FlinkJobs.stream(env, dataset, RawTransaction.class);
        DataStream<Transaction> cleaned = input
                .map(new TransactionNormalizer(dataset.hasColumn(TransactionSchema.IS_GIFT)))
                .name("Normalize transactions");

        long recordCount = FlinkJobs.count(cleaned, "Normalize transactions");
        log.info("Cleaned data: {} records", recordCount);
        return new FlinkDataset<>(TransactionSchema.normalizedColumns(dataset.columns()), cleaned, "cleaned rows");
    }
}
