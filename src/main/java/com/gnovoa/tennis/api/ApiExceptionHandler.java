package com.gnovoa.tennis.api;

import com.gnovoa.tennis.error.ErrorKind;
import com.gnovoa.tennis.error.SchedulingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.Locale;
import java.util.NoSuchElementException;

/** Maps engine exceptions to RFC 7807 problem responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
    private static final String PROBLEM_BASE = "https://tennis.gnovoa.com/problems/";

    @ExceptionHandler(SchedulingException.class)
    public ProblemDetail scheduling(SchedulingException ex) {
        HttpStatus status = switch (ex.kind()) {
            case CONFLICT, DELETE_UNSAFE -> HttpStatus.CONFLICT;
            default -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + ex.kind().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        pd.setTitle(title(ex.kind()));
        pd.setProperty("kind", ex.kind());
        return pd;
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ProblemDetail notFound(NoSuchElementException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        pd.setTitle("Resource Not Found");
        return pd;
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail badRequest(Exception ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setTitle("Bad Request");
        return pd;
    }

    // Anything else becomes a 500 without internals
    @ExceptionHandler(Exception.class)
    public ProblemDetail generic(Exception ex) {
        if (ex instanceof ErrorResponse er) return er.getBody();
        log.error("Unhandled API error", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact the league administrator.");
        pd.setTitle("Internal Server Error");
        pd.setProperty("kind", ErrorKind.UNEXPECTED);
        return pd;
    }

    private static String title(ErrorKind kind) {
        return switch (kind) {
            case INSUFFICIENT_TEAMS -> "Not Enough Teams";
            case UNFAIR_SCHEDULE -> "Unfair Schedule";
            case CAPACITY -> "Slot Capacity Exceeded";
            case NO_SINGLE_SLOT -> "No Single Slot";
            case INSUFFICIENT_CAPACITY -> "Insufficient Capacity";
            case CONFLICT -> "Scheduling Conflict";
            case DELETE_UNSAFE -> "Delete Not Safe";
            case NO_CANDIDATE_DATES -> "No Candidate Dates";
            case UNEXPECTED -> "Unexpected Error";
        };
    }
}
