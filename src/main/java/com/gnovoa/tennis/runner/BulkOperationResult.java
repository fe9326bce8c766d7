package com.gnovoa.tennis.runner;

import java.util.List;

/**
 * Per-match outcomes of a bulk run, in processing order. Counts are computed from the entries.
 *
 * @param dryRun true when nothing was left changed; succeeded entries are what would happen
 */
public record BulkOperationResult(BulkOperation operation, String scope, boolean dryRun, List<BulkEntry> entries) {

    public BulkOperationResult {
        entries = List.copyOf(entries);
    }

    public long succeededCount() { return count(BulkOutcome.SUCCEEDED); }
    public long skippedCount() { return count(BulkOutcome.SKIPPED); }
    public long failedCount() { return count(BulkOutcome.FAILED); }

    /** True when any match was skipped or failed; callers surface such runs as a warning. */
    public boolean hasWarnings() {
        return skippedCount() > 0 || failedCount() > 0;
    }

    public String summaryMessage() {
        String verb = switch (operation) {
            case AUTO_SCHEDULE -> "scheduled";
            case UNSCHEDULE -> "unscheduled";
            case DELETE -> "deleted";
        };
        String msg = succeededCount() + " match(es) " + (dryRun ? "would be " : "") + verb + " (" + scope + ")";
        if (!hasWarnings()) return msg;
        return msg + "; " + skippedCount() + " skipped, " + failedCount() + " failed";
    }

    private long count(BulkOutcome outcome) {
        return entries.stream().filter(e -> e.outcome() == outcome).count();
    }
}
