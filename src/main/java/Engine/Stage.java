package Engine;

/**
 * The stages of a transformation run, in execution order.
 */
public enum Stage {
    ROW_SOURCE,
    NORMALIZER,
    AGGREGATION,
    SINK
}
