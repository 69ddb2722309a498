package io.promptrelay.error;

public final class RetryExhaustedException extends PromptRelayException {
    private final int stepNumber;
    private final int attempts;

    public RetryExhaustedException(int stepNumber, int attempts, String lastError) {
        super(ErrorKind.RETRY_EXHAUSTED,
                "Step " + stepNumber + " failed after " + attempts + " attempts: " + lastError);
        this.stepNumber = stepNumber;
        this.attempts = attempts;
    }

    public int stepNumber() {
        return stepNumber;
    }

    public int attempts() {
        return attempts;
    }
}
