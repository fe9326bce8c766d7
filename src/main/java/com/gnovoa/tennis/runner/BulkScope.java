package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.model.Match;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * The set of matches a bulk run applies to, passed explicitly by the caller.
 *
 * @param leagueId only set for {@link Kind#LEAGUE}
 * @param description human readable label used in logs and results
 */
public record BulkScope(Kind kind, Long leagueId, Predicate<Match> predicate, String description) {

    public enum Kind { ALL, LEAGUE, FILTERED }

    public BulkScope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(predicate, "predicate");
    }

    public static BulkScope all() {
        return new BulkScope(Kind.ALL, null, m -> true, "all matches");
    }

    public static BulkScope league(long leagueId) {
        return new BulkScope(Kind.LEAGUE, leagueId, m -> m.league().id() == leagueId, "league " + leagueId);
    }

    public static BulkScope filtered(Predicate<Match> predicate, String description) {
        return new BulkScope(Kind.FILTERED, null, predicate, description == null ? "filtered matches" : description);
    }
}
