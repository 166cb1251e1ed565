package Flink;

import Dto.TabularRecord;
import Dto.Transaction;
import Engine.AggregationEngine;
import Engine.AggregationView;
import Engine.Dataset;
import Engine.LocalDataset;
import Engine.ViewDefinition;
import Exceptions.MissingColumnException;
import Exceptions.PipelineException;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Runs each view as its own batch job: {@code map(seed) -> keyBy(group key) -> reduce(combiner)}.
 * <p>
 * In {@code BATCH} runtime mode a keyed reduce emits exactly one record per key once its
 * input is exhausted, so the collected result is the final set of groups. The groups are then
 * sorted on the client with the view's ordering.
 */
public class FlinkAggregationEngine implements AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(FlinkAggregationEngine.class);

    private final StreamExecutionEnvironment env;

    public FlinkAggregationEngine(StreamExecutionEnvironment env) {
        this.env = env;
    }

    @Override
    public <V extends TabularRecord> AggregationView<V> aggregate(Dataset<Transaction> dataset, ViewDefinition<V> view)
            throws PipelineException {
        List<String> missing = view.missingColumns(dataset.columns());
        if (!missing.isEmpty()) {
            throw new MissingColumnException(view.getName(), missing);
        }
        log.info("Creating {} aggregation", view.getName());

        DataStream<V> groups = FlinkJobs.stream(env, dataset, Transaction.class)
                .map(view.getSeed()).returns(view.getRowType()).name("Seed " + view.getName())
                .keyBy(view.getKeySelector(), Types.STRING)
                .reduce(view.getCombiner()).name("Reduce " + view.getName());

        List<V> rows = FlinkJobs.collect(groups, "Aggregate " + view.getName());
        rows.sort(view.getOrdering());
        return new AggregationView<>(view.getName(), new LocalDataset<>(view.getOutputColumns(), rows));
    }

    @Override
    public Map<String, AggregationView<?>> aggregate(Dataset<Transaction> dataset) throws PipelineException {
        Map<String, AggregationView<?>> views = AggregationEngine.super.aggregate(dataset);
        log.info("Created {} aggregation views", views.size());
        return views;
    }
}
