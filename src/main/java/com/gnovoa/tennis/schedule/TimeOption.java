package com.gnovoa.tennis.schedule;

/** How the start times of a match's lines are chosen. */
public enum TimeOption {
    /** The planner picks times from the day's open slots. */
    AUTO,
    /** Every line starts at one caller-given time. */
    SAME,
    /** The caller gives one time per line. */
    CUSTOM
}
