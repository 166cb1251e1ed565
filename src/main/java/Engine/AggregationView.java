package Engine;

import Dto.TabularRecord;

import java.util.Objects;

/**
 * A named dataset produced by grouping and reducing a normalized dataset.
 */
public final class AggregationView<V extends TabularRecord> {

    private final String name;
    private final Dataset<V> dataset;

    public AggregationView(String name, Dataset<V> dataset) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataset = Objects.requireNonNull(dataset, "dataset");
    }

    public String getName() {
        return name;
    }

    public Dataset<V> getDataset() {
        return dataset;
    }
}
