package io.promptrelay.error;

/**
 * Root of the programmatic error contract. Callers branch on {@link #kind()}, never on the message.
 */
public class PromptRelayException extends RuntimeException {
    private final ErrorKind kind;

    public PromptRelayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PromptRelayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
