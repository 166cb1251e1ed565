package Exceptions;

import Engine.Stage;

/**
 * A stage of a transformation run failed. Keeps the error kind of the underlying failure,
 * which is also the cause.
 */
public class StageFailedException extends PipelineException {

    private final Stage stage;

    public StageFailedException(Stage stage, PipelineException cause) {
        super(cause.getKind(), "Stage " + stage + " failed with " + cause.getKind() + ": " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
