package com.jenkins.operator.store;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Outcome of a write against the Kubernetes API.
 *
 * <p>Conflicts are expected whenever another writer touched the resource since it was read,
 * so they are reported as an outcome of their own instead of an error.
 *
 * @param <T> the written resource type
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class UpdateResult<T> {

    public enum Outcome {
        SUCCESS,
        CONFLICT,
        ERROR
    }

    private final Outcome outcome;
    private final T object;
    private final String message;
    private final Throwable cause;

    public static <T> UpdateResult<T> success(T object) {
        return new UpdateResult<>(Outcome.SUCCESS, object, null, null);
    }

    public static <T> UpdateResult<T> conflict(String message) {
        return new UpdateResult<>(Outcome.CONFLICT, null, message, null);
    }

    public static <T> UpdateResult<T> error(String message) {
        return new UpdateResult<>(Outcome.ERROR, null, message, null);
    }

    public static <T> UpdateResult<T> error(String message, Throwable cause) {
        return new UpdateResult<>(Outcome.ERROR, null, message, cause);
    }
}
