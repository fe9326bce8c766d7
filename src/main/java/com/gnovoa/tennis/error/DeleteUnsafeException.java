package com.gnovoa.tennis.error;

/** Only matches with no facility, date or times may be deleted. */
public class DeleteUnsafeException extends SchedulingException {

    public DeleteUnsafeException(String message) {
        super(ErrorKind.DELETE_UNSAFE, message);
    }
}
