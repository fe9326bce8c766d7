package com.gnovoa.tennis.error;

public class InsufficientTeamsException extends SchedulingException {

    public InsufficientTeamsException(String message) {
        super(ErrorKind.INSUFFICIENT_TEAMS, message);
    }
}
