package Engine;

import Dto.TabularRecord;
import Dto.Transaction;
import Exceptions.PipelineException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Third stage: derives the named grouped summaries of a normalized dataset.
 * <p>
 * The input is never mutated and every view is computed independently of the others.
 */
public interface AggregationEngine {

    /**
     * Computes a single view.
     *
     * @throws Exceptions.MissingColumnException if a grouping or reduced column of the view is absent
     */
    <V extends TabularRecord> AggregationView<V> aggregate(Dataset<Transaction> dataset, ViewDefinition<V> view)
            throws PipelineException;

    /**
     * Computes every view whose preconditions the dataset satisfies, in catalogue order.
     */
    default Map<String, AggregationView<?>> aggregate(Dataset<Transaction> dataset) throws PipelineException {
        Map<String, AggregationView<?>> views = new LinkedHashMap<>();
        for (ViewDefinition<?> view : AggregationViews.applicableTo(dataset.columns())) {
            views.put(view.getName(), aggregate(dataset, view));
        }
        return views;
    }
}
