package com.gnovoa.tennis.runner;

public enum BulkOperation {
    AUTO_SCHEDULE,
    UNSCHEDULE,
    DELETE
}
