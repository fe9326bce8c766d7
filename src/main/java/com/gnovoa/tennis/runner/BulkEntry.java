package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.error.ErrorKind;

/**
 * Outcome of one match in a bulk run.
 *
 * @param errorKind why the match was skipped or failed; null on success and on plain skips
 */
public record BulkEntry(long matchId, BulkOutcome outcome, ErrorKind errorKind, String detail) {

    static BulkEntry succeeded(long matchId, String detail) {
        return new BulkEntry(matchId, BulkOutcome.SUCCEEDED, null, detail);
    }

    static BulkEntry skipped(long matchId, ErrorKind kind, String detail) {
        return new BulkEntry(matchId, BulkOutcome.SKIPPED, kind, detail);
    }

    static BulkEntry failed(long matchId, ErrorKind kind, String detail) {
        return new BulkEntry(matchId, BulkOutcome.FAILED, kind, detail);
    }
}
