package org.example.content.service.pipeline;

/**
 * Thrown by a {@link StageExecutor} when the whole stage is unusable, not just the current item.
 */
public class StageExecutionException extends RuntimeException {

    public StageExecutionException(String message) {
        super(message);
    }

    public StageExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
