package com.gnovoa.tennis.error;

/** Lines must share one start time and no slot on the day is big enough. */
public class NoSingleSlotException extends SchedulingException {

    public NoSingleSlotException(String message) {
        super(ErrorKind.NO_SINGLE_SLOT, message);
    }
}
