package Engine;

import java.util.List;
import java.util.Objects;

/**
 * In-memory, ordered {@link Dataset}. Both the column list and the rows are copied on
 * construction.
 */
public final class LocalDataset<T> implements Dataset<T> {

    private final List<String> columns;
    private final List<T> rows;

    public LocalDataset(List<String> columns, List<T> rows) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public List<T> collect() {
        return rows;
    }
}
