package com.gnovoa.tennis.error;

/** The placement collides with a match already booked for a team or the facility. */
public class ConflictException extends SchedulingException {

    public ConflictException(String message) {
        super(ErrorKind.CONFLICT, message);
    }
}
