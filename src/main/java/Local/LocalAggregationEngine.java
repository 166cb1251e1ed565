package Local;

import Dto.TabularRecord;
import Dto.Transaction;
import Engine.AggregationEngine;
import Engine.AggregationView;
import Engine.Dataset;
import Engine.LocalDataset;
import Engine.ViewDefinition;
import Exceptions.MissingColumnException;
import Exceptions.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash aggregation in memory: one accumulator per group key, folded in row order.
 */
public class LocalAggregationEngine implements AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(LocalAggregationEngine.class);

    @Override
    public <V extends TabularRecord> AggregationView<V> aggregate(Dataset<Transaction> dataset, ViewDefinition<V> view)
            throws PipelineException {
        List<String> missing = view.missingColumns(dataset.columns());
        if (!missing.isEmpty()) {
            throw new MissingColumnException(view.getName(), missing);
        }
        log.info("Creating {} aggregation", view.getName());

        Map<String, V> groups = new LinkedHashMap<>();
        try {
            for (Transaction row : dataset.collect()) {
                V seed = view.getSeed().map(row);
                String key = view.getKeySelector().getKey(seed);
                V current = groups.get(key);
                groups.put(key, current == null ? seed : view.getCombiner().reduce(current, seed));
            }
        } catch (PipelineException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("View function of " + view.getName() + " failed", e);
        }

        List<V> rows = new ArrayList<>(groups.values());
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
