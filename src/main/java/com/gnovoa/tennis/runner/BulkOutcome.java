package com.gnovoa.tennis.runner;

/** What happened to one match in a bulk run. */
public enum BulkOutcome {
    SUCCEEDED,
    /** Left alone: nothing to do, or not safe to do. Not an error. */
    SKIPPED,
    FAILED
}
