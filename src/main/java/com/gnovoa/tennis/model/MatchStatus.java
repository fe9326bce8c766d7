package com.gnovoa.tennis.model;

public enum MatchStatus {
    UNSCHEDULED,
    PARTIALLY_SCHEDULED,
    FULLY_SCHEDULED,
    OVER_SCHEDULED
}
