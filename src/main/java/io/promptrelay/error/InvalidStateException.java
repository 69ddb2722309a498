package io.promptrelay.error;

public final class InvalidStateException extends PromptRelayException {
    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
