package com.baton.coordinator.service;

/**
 * Structured result of one coordination command.
 *
 * @param status  Outcome tag.
 * @param value   Result on OK, null otherwise.
 * @param message Error description when status is not OK.
 */
public record CommandResult<T>(ResultStatus status, T value, String message) {

    public static <T> CommandResult<T> ok(T value) {
        return new CommandResult<>(ResultStatus.OK, value, null);
    }

    public static <T> CommandResult<T> failure(ResultStatus status, String message) {
        return new CommandResult<>(status, null, message);
    }

    public boolean isOk() {
        return status == ResultStatus.OK;
    }
}
