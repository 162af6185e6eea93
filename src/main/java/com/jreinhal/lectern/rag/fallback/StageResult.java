package com.jreinhal.lectern.rag.fallback;

/**
 * Outcome of one pipeline stage.
 *
 * <p>{@link Kind#SOFT_FAILURE} means the stage could not produce its result but a weaker
 * strategy may; {@link Kind#HARD_FAILURE} means no strategy can succeed for this request
 * and the pipeline should answer with the apology right away.</p>
 */
public record StageResult<T>(Kind kind, T value, String reason, Throwable cause) {

    public enum Kind {
        SUCCESS,
        SOFT_FAILURE,
        HARD_FAILURE
    }

    public static <T> StageResult<T> success(T value) {
        return new StageResult<>(Kind.SUCCESS, value, null, null);
    }

    public static <T> StageResult<T> softFailure(String reason) {
        return new StageResult<>(Kind.SOFT_FAILURE, null, reason, null);
    }

    public static <T> StageResult<T> softFailure(String reason, Throwable cause) {
        return new StageResult<>(Kind.SOFT_FAILURE, null, reason, cause);
    }

    public static <T> StageResult<T> hardFailure(String reason, Throwable cause) {
        return new StageResult<>(Kind.HARD_FAILURE, null, reason, cause);
    }

    public boolean isSuccess() {
        return this.kind == Kind.SUCCESS;
    }
}
