package Engine;

/**
 * One implementation of the four stage contracts plus the compute context they run in.
 * <p>
 * A backend is opened before the row source is first used and must be closed after the last
 * sink write, failure or not; callers use try-with-resources.
 */
public interface ExecutionBackend extends AutoCloseable {

    String name();

    RowSource rowSource();

    Normalizer normalizer();

    AggregationEngine aggregationEngine();

    Sink sink();

    /**
     * Releases the compute context. The local backend holds nothing to release.
     */
    @Override
    default void close() throws Exception {
        // no-op by default
    }
}
