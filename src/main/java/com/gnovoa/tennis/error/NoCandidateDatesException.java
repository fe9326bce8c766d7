package com.gnovoa.tennis.error;

/** Auto-scheduling had no facility and date combination to try. */
public class NoCandidateDatesException extends SchedulingException {

    public NoCandidateDatesException(String message) {
        super(ErrorKind.NO_CANDIDATE_DATES, message);
    }
}
