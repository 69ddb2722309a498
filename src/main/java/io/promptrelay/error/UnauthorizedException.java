package io.promptrelay.error;

public final class UnauthorizedException extends PromptRelayException {
    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }
}
