package Local;

import Engine.AggregationEngine;
import Engine.CsvFileSink;
import Engine.ExecutionBackend;
import Engine.Normalizer;
import Engine.RowSource;
import Engine.Sink;

/**
 * Single-node backend: synchronous, single-threaded, everything in memory.
 */
public class LocalBackend implements ExecutionBackend {

    private final RowSource rowSource;
    private final Normalizer normalizer = new LocalNormalizer();
    private final AggregationEngine aggregationEngine = new LocalAggregationEngine();
    private final Sink sink;

    public LocalBackend(char delimiter, String extension) {
        this.rowSource = new LocalRowSource(delimiter, extension);
        this.sink = new CsvFileSink(delimiter);
    }

    @Override
    public String name() {
        return "local";
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
}
