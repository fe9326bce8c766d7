package com.gnovoa.tennis.error;

/** Even split across every slot of the day, there are fewer courts than lines. */
public class InsufficientCapacityException extends SchedulingException {

    public InsufficientCapacityException(String message) {
        super(ErrorKind.INSUFFICIENT_CAPACITY, message);
    }
}
