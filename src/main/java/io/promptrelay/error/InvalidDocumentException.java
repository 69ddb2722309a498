package io.promptrelay.error;

public final class InvalidDocumentException extends PromptRelayException {
    public InvalidDocumentException(String message) {
        super(ErrorKind.INVALID_DOCUMENT, message);
    }

    public InvalidDocumentException(String message, Throwable cause) {
        super(ErrorKind.INVALID_DOCUMENT, message, cause);
    }
}
