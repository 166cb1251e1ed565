package Flink;

import Engine.Dataset;
import Exceptions.ComputeException;
import Exceptions.PipelineException;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.apache.flink.util.Collector;
import org.apache.flink.util.ExceptionUtils;
import org.apache.flink.util.SerializedThrowable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Submission helpers for the batch jobs of the Flink backend.
 * <p>
 * A failed job is never resubmitted: the backend runs with the {@code none} restart strategy
 * and the first failure is rethrown to the caller.
 */
final class FlinkJobs {

    private FlinkJobs() {
    }

    /**
     * The stream behind a dataset: the dataset's own stream for a {@link FlinkDataset}, otherwise
     * the collected rows uploaded as a bounded collection source.
     */
    static <T> DataStream<T> stream(StreamExecutionEnvironment env, Dataset<T> dataset, Class<T> type)
            throws PipelineException {
        if (dataset instanceof FlinkDataset) {
            return ((FlinkDataset<T>) dataset).stream();
        }
        List<T> rows = dataset.collect();
        if (rows.isEmpty()) {
            // fromCollection rejects an empty collection
            return env.fromSequence(0, 0)
                    .flatMap((Long ignored, Collector<T> out) -> { })
                    .returns(TypeInformation.of(type));
        }
        return env.fromCollection(rows, TypeInformation.of(type));
    }

    /**
     * Runs the job ending in {@code stream} and brings every row back to the client.
     */
    static <T> List<T> collect(DataStream<T> stream, String jobName) throws PipelineException {
        List<T> rows = new ArrayList<>();
        try (CloseableIterator<T> results = stream.executeAndCollect(jobName)) {
            results.forEachRemaining(rows::add);
        } catch (Exception e) {
            throw unwrap(jobName, e);
        }
        return rows;
    }

    /**
     * Counts the rows of {@code stream} with a single-key reduce, which in batch mode emits
     * only the final total. An empty stream counts 0.
     */
    static <T> long count(DataStream<T> stream, String jobName) throws PipelineException {
        DataStream<Long> total = stream
                .map(row -> 1L).returns(Types.LONG).name("Count " + jobName)
                .keyBy(one -> 0, Types.INT)
                .reduce(Long::sum);
        List<Long> result = collect(total, jobName);
        return result.isEmpty() ? 0L : result.get(0);
    }

    /**
     * Finds the engine error that made a job fail. Task failures reach the client wrapped in
     * several layers and possibly still serialized.
     */
    static PipelineException unwrap(String jobName, Throwable failure) {
        Optional<PipelineException> direct = ExceptionUtils.findThrowable(failure, PipelineException.class);
        if (direct.isPresent()) {
            return direct.get();
        }
        Optional<SerializedThrowable> serialized = ExceptionUtils.findThrowable(failure, SerializedThrowable.class);
        if (serialized.isPresent()) {
            Throwable original = serialized.get().deserializeError(FlinkJobs.class.getClassLoader());
            Optional<PipelineException> nested = ExceptionUtils.findThrowable(original, PipelineException.class);
            if (nested.isPresent()) {
                return nested.get();
            }
        }
        Throwable root = ExceptionUtils.stripExecutionException(failure);
        return new ComputeException("Flink job '" + jobName + "' failed: " + root.getMessage(), failure);
    }
}
