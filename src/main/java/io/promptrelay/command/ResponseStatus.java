package io.promptrelay.command;

public enum ResponseStatus {
    SUCCESS(200),
    ERROR(400),
    PROCESSING(202),
    NOT_FOUND(404),
    UNAUTHORIZED(401);

    private final int httpStatus;

    ResponseStatus(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
