package Flink;

import Engine.Dataset;
import Exceptions.PipelineException;
import org.apache.flink.streaming.api.datastream.DataStream;

import java.util.List;
import java.util.Objects;

/**
 * A {@link Dataset} backed by a bounded Flink {@link DataStream}.
 * <p>
 * Nothing runs until {@link #collect()} is called, and every call submits a new batch job
 * that re-reads the sources. Row order is not defined.
 */
public final class FlinkDataset<T> implements Dataset<T> {

    private final List<String> columns;
    private final DataStream<T> stream;
    private final String description;

    public FlinkDataset(List<String> columns, DataStream<T> stream, String description) {
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
        this.stream = Objects.requireNonNull(stream, "stream");
        this.description = description;
    }

    @Override
    public List<String> columns() {
        return columns;
    }

    @Override
    public List<T> collect() throws PipelineException {
        return FlinkJobs.collect(stream, "Collect " + description);
    }

    public DataStream<T> stream() {
        return stream;
    }
}
