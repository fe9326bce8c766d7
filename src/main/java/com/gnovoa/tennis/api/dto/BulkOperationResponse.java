package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.runner.BulkEntry;
import com.gnovoa.tennis.runner.BulkOperation;
import com.gnovoa.tennis.runner.BulkOperationResult;

import java.util.List;

/** @param warning true when any match was skipped or failed */
public record BulkOperationResponse(
        BulkOperation operation,
        String scope,
        boolean dryRun,
        long succeededCount,
        long skippedCount,
        long failedCount,
        boolean warning,
        String message,
        List<BulkEntry> details
) {
    public static BulkOperationResponse from(BulkOperationResult r) {
        return new BulkOperationResponse(
                r.operation(),
                r.scope(),
                r.dryRun(),
                r.succeededCount(),
                r.skippedCount(),
                r.failedCount(),
                r.hasWarnings(),
                r.summaryMessage(),
                r.entries()
        );
    }
}
