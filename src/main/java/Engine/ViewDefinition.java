package Engine;

import Dto.TabularRecord;
import Dto.Transaction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.apache.flink.api.common.functions.MapFunction;
import org.apache.flink.api.common.functions.ReduceFunction;
import org.apache.flink.api.java.functions.KeySelector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Declarative description of one grouped view, executed as is by every backend:
 * <pre>
 *   rows.map(seed).keyBy(keySelector).reduce(combiner), then sorted by ordering
 * </pre>
 * The functions are Flink function types so that the Flink backend can ship them to its
 * workers; the local backend simply calls them.
 *
 * @param <V> the aggregate row type, which doubles as the accumulator
 */
@Value
@Builder
public class ViewDefinition<V extends TabularRecord> {

    String name;

    /**
     * Columns the rows are grouped by.
     */
    @Singular
    List<String> groupKeys;

    /**
     * Source columns the reducers read.
     */
    @Singular
    List<String> reducedColumns;

    /**
     * Columns of the produced rows, in output order.
     */
    @Singular
    List<String> outputColumns;

    Class<V> rowType;

    /**
     * Turns one transaction into a single-row aggregate.
     */
    MapFunction<Transaction, V> seed;

    /**
     * Folds two aggregates of the same group. May reuse its first argument.
     */
    ReduceFunction<V> combiner;

    KeySelector<V, String> keySelector;

    /**
     * Post-sort applied once the groups have been collected.
     */
    Comparator<V> ordering;

    /**
     * Group keys followed by reduced columns, without duplicates.
     */
    public List<String> requiredColumns() {
        List<String> required = new ArrayList<>(groupKeys);
        for (String column : reducedColumns) {
            if (!required.contains(column)) {
                required.add(column);
            }
        }
        return required;
    }

    public List<String> missingColumns(List<String> available) {
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns()) {
            if (!available.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }
}
