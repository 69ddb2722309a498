package io.promptrelay.error;

public final class NotFoundException extends PromptRelayException {
    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException document(String documentRef) {
        return new NotFoundException("Document not found: " + documentRef);
    }

    public static NotFoundException prompt(String documentId, int promptNumber) {
        return new NotFoundException("Prompt " + promptNumber + " not found in document " + documentId);
    }

    public static NotFoundException execution(String executionId) {
        return new NotFoundException("Execution not found: " + executionId);
    }
}
