package com.gnovoa.tennis.error;

/**
 * Base type for every typed failure of the engine.
 *
 * <p>Single-match operations let it propagate to the caller. Bulk runs catch it per match and turn
 * it into a result entry.
 */
public abstract class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    protected SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
