package io.promptrelay.error;

public enum ErrorKind {
    NOT_FOUND,
    UNSATISFIED_DEPENDENCY,
    STEP_EXECUTION_FAILURE,
    RETRY_EXHAUSTED,
    INVALID_STATE,
    INVALID_DOCUMENT,
    UNAUTHORIZED
}
