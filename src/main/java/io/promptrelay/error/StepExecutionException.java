package io.promptrelay.error;

/**
 * A single dispatch of a step failed. {@code retryable} tells the executor whether another
 * attempt can change the outcome.
 */
public final class StepExecutionException extends PromptRelayException {
    private final boolean retryable;

    private StepExecutionException(String message, boolean retryable, Throwable cause) {
        super(ErrorKind.STEP_EXECUTION_FAILURE, message, cause);
        this.retryable = retryable;
    }

    public static StepExecutionException retryable(String message) {
        return new StepExecutionException(message, true, null);
    }

    public static StepExecutionException retryable(String message, Throwable cause) {
        return new StepExecutionException(message, true, cause);
    }

    public static StepExecutionException terminal(String message) {
        return new StepExecutionException(message, false, null);
    }

    public static StepExecutionException terminal(String message, Throwable cause) {
        return new StepExecutionException(message, false, cause);
    }

    public boolean retryable() {
        return retryable;
    }
}
