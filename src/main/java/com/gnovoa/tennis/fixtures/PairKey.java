package com.gnovoa.tennis.fixtures;

/** Unordered pair of team ids. */
record PairKey(long low, long high) {

    static PairKey of(long a, long b) {
        return a <= b ? new PairKey(a, b) : new PairKey(b, a);
    }
}
