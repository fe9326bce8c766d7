package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.error.ErrorKind;
import com.gnovoa.tennis.error.NoCandidateDatesException;
import com.gnovoa.tennis.error.SchedulingException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.schedule.MatchScheduler;
import com.gnovoa.tennis.schedule.PlacementSearch;
import com.gnovoa.tennis.schedule.SchedulingOptions;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;

/**
 * Applies one operation to every match of a scope, one match at a time.
 *
 * <p>A failing match never stops the run: its error is recorded in the result and processing moves
 * on. Each match is committed on its own, so earlier successes stay when a later match fails.
 *
 * <p>A dry run reports the same entries without leaving changes behind. Auto-scheduling places
 * matches as usual so that later matches see the courts earlier ones would take, then puts every
 * touched match back once the run is over. Unschedule and delete only check what they would do.
 */
public final class BulkOperationRunner {

    private static final Logger log = LoggerFactory.getLogger(BulkOperationRunner.class);

    private final MatchScheduler scheduler;
    private final PlacementSearch search;
    private final LeagueDataStore store;

    public BulkOperationRunner(MatchScheduler scheduler, PlacementSearch search, LeagueDataStore store) {
        this.scheduler = scheduler;
        this.search = search;
        this.store = store;
    }

    /** Resolves the scope through the store (match id order) and runs the operation. */
    public BulkOperationResult run(BulkOperation operation, BulkScope scope) {
        return run(operation, scope, false);
    }

    public BulkOperationResult run(BulkOperation operation, BulkScope scope, boolean dryRun) {
        return run(operation, scope, store.matches(scope.predicate()), dryRun);
    }

    public BulkOperationResult run(BulkOperation operation, BulkScope scope, List<Match> matches) {
        return run(operation, scope, matches, false);
    }

    public BulkOperationResult run(BulkOperation operation, BulkScope scope, List<Match> matches, boolean dryRun) {
        List<BulkEntry> entries = new ArrayList<>(matches.size());
        Map<Match, Match.Assignment> tentative = new LinkedHashMap<>();
        try {
            for (Match match : matches) {
                entries.add(runOne(operation, match, dryRun ? tentative : null));
            }
        } finally {
            rollBack(tentative);
        }
        BulkOperationResult result = new BulkOperationResult(operation, scope.description(), dryRun, entries);
        log.info("Bulk {}{} over {}: {} succeeded, {} skipped, {} failed", operation, dryRun ? " (dry run)" : "",
                scope.description(), result.succeededCount(), result.skippedCount(), result.failedCount());
        return result;
    }

    /** @param tentative collects the previous state of auto-scheduled matches in a dry run; null otherwise */
    private BulkEntry runOne(BulkOperation operation, Match match, Map<Match, Match.Assignment> tentative) {
        try {
            return switch (operation) {
                case AUTO_SCHEDULE -> autoSchedule(match, tentative);
                case UNSCHEDULE -> unschedule(match, tentative != null);
                case DELETE -> delete(match, tentative != null);
            };
        } catch (SchedulingException e) {
            if (e.kind() == ErrorKind.DELETE_UNSAFE) {
                return BulkEntry.skipped(match.id(), e.kind(), e.getMessage());
            }
            log.warn("Bulk {} failed for match {}: {} ({})", operation, match.id(), e.getMessage(), e.kind());
            return BulkEntry.failed(match.id(), e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Bulk {} hit an unexpected error on match {}", operation, match.id(), e);
            return BulkEntry.failed(match.id(), ErrorKind.UNEXPECTED, e.toString());
        }
    }

    /**
     * Tries every open date, and on each date every candidate facility, until one placement works.
     * The error of the last attempt is reported when none does.
     */
    private BulkEntry autoSchedule(Match match, Map<Match, Match.Assignment> tentative) {
        if (match.isScheduled()) {
            return BulkEntry.skipped(match.id(), null, "Already scheduled");
        }
        List<LocalDate> dates = search.openDates(match);
        List<Facility> facilities = search.facilityOrder(match);
        if (dates.isEmpty() || facilities.isEmpty()) {
            throw new NoCandidateDatesException("No candidate " + (dates.isEmpty() ? "date" : "facility") + " for " + match);
        }

        Match.Assignment before = match.assignment();
        SchedulingException last = null;
        for (LocalDate date : dates) {
            for (Facility facility : facilities) {
                if (facility.isUnavailableOn(date)) continue;
                try {
                    scheduler.schedule(match, facility, date, SchedulingOptions.auto());
                } catch (SchedulingException e) {
                    last = e;
                    continue;
                }
                String where = facility.name() + " on " + date + " at " + match.scheduledTimes();
                if (tentative == null) return BulkEntry.succeeded(match.id(), where);
                tentative.put(match, before);
                return BulkEntry.succeeded(match.id(), "Would be scheduled at " + where);
            }
        }
        if (last == null) {
            throw new NoCandidateDatesException("Every candidate facility is blacked out on every candidate date");
        }
        throw last;
    }

    private BulkEntry unschedule(Match match, boolean dryRun) {
        if (match.isUnscheduled()) {
            return BulkEntry.skipped(match.id(), null, "Already unscheduled");
        }
        if (dryRun) return BulkEntry.succeeded(match.id(), "Would be unscheduled");
        scheduler.unschedule(match);
        return BulkEntry.succeeded(match.id(), "Unscheduled");
    }

    private BulkEntry delete(Match match, boolean dryRun) {
        if (dryRun) {
            scheduler.checkDeletable(match);
            return BulkEntry.succeeded(match.id(), "Would be deleted");
        }
        scheduler.delete(match);
        return BulkEntry.succeeded(match.id(), "Deleted");
    }

    // newest first, so each match gets back exactly what it had before the run
    private void rollBack(Map<Match, Match.Assignment> tentative) {
        if (tentative.isEmpty()) return;
        List<Map.Entry<Match, Match.Assignment>> undo = new ArrayList<>(tentative.entrySet());
        Collections.reverse(undo);
        RuntimeException failure = null;
        for (var e : undo) {
            try {
                scheduler.revert(e.getKey(), e.getValue());
            } catch (RuntimeException ex) {
                log.error("Dry run could not restore match {}", e.getKey().id(), ex);
                if (failure == null) failure = ex;
            }
        }
        if (failure != null) throw new IllegalStateException("Dry run left changes behind", failure);
    }
}
