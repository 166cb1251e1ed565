package SalesEtl;

import Engine.ExecutionBackend;
import Flink.FlinkBackend;
import Local.LocalBackend;

/**
 * Picks the execution backend a configuration asks for.
 */
public final class Backends {

    private Backends() {
    }

    /**
     * @throws IllegalArgumentException for an unknown backend name
     */
    public static ExecutionBackend create(PipelineConfig config) {
        String backend = config.getBackend();
        if (PipelineConfig.LOCAL.equalsIgnoreCase(backend)) {
            return new LocalBackend(config.delimiterChar(), config.getFileExtension());
        }
        if (PipelineConfig.FLINK.equalsIgnoreCase(backend)) {
            return new FlinkBackend(config.getFlinkParallelism(), config.delimiterChar(), config.getFileExtension());
        }
        throw new IllegalArgumentException("Unknown backend '" + backend + "', expected "
                + PipelineConfig.LOCAL + " or " + PipelineConfig.FLINK);
    }
}
