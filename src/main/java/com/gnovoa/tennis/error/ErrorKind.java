package com.gnovoa.tennis.error;

/** Failure categories reported by the scheduling engine, single-match and bulk alike. */
public enum ErrorKind {
    INSUFFICIENT_TEAMS,
    UNFAIR_SCHEDULE,
    CAPACITY,
    NO_SINGLE_SLOT,
    INSUFFICIENT_CAPACITY,
    CONFLICT,
    DELETE_UNSAFE,
    NO_CANDIDATE_DATES,
    UNEXPECTED
}
