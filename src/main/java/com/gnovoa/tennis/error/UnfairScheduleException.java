package com.gnovoa.tennis.error;

public class UnfairScheduleException extends SchedulingException {

    public UnfairScheduleException(String message) {
        super(ErrorKind.UNFAIR_SCHEDULE, message);
    }
}
