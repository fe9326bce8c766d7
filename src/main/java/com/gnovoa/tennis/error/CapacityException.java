package com.gnovoa.tennis.error;

/** A caller-chosen time has no slot, or not enough courts left at it. */
public class CapacityException extends SchedulingException {

    public CapacityException(String message) {
        super(ErrorKind.CAPACITY, message);
    }
}
