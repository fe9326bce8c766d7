package com.gnovoa.tennis.api.dto;

import com.gnovoa.tennis.runner.BulkOperation;
import com.gnovoa.tennis.runner.BulkScope;
import com.gnovoa.tennis.runner.MatchFilter;

/**
 * Body of {@code POST /api/matches/bulk}.
 *
 * @param leagueId required when scope is LEAGUE
 * @param filter used when scope is FILTERED; an absent filter matches everything
 * @param dryRun report what would happen without keeping any change
 */
public record BulkOperationRequest(BulkOperation operation, BulkScope.Kind scope, Long leagueId, MatchFilter filter,
                                   Boolean dryRun) {

    public boolean dryRunRequested() {
        return Boolean.TRUE.equals(dryRun);
    }

    public BulkScope toScope() {
        if (operation == null) throw new IllegalArgumentException("operation is required");
        BulkScope.Kind kind = scope == null ? BulkScope.Kind.ALL : scope;
        return switch (kind) {
            case ALL -> BulkScope.all();
            case LEAGUE -> {
                if (leagueId == null) throw new IllegalArgumentException("leagueId is required for scope LEAGUE");
                yield BulkScope.league(leagueId);
            }
            case FILTERED -> {
                MatchFilter f = filter == null ? new MatchFilter(null, null, null, null) : filter;
                yield BulkScope.filtered(f, f.describe());
            }
        };
    }
}
