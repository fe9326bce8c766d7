package com.gnovoa.tennis.runner;

import com.gnovoa.tennis.fixtures.FixtureGenerator;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.League;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.model.TimeSlot;
import com.gnovoa.tennis.schedule.AvailabilityModel;
import com.gnovoa.tennis.schedule.ConflictChecker;
import com.gnovoa.tennis.schedule.MatchScheduler;
import com.gnovoa.tennis.schedule.PlacementSearch;
import com.gnovoa.tennis.schedule.SchedulingOptions;
import com.gnovoa.tennis.schedule.SchedulingPreview;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.IntStream;

/**
 * Entry point used by the API: resolves ids through the store and delegates to the engine.
 * Unknown ids raise {@link NoSuchElementException}.
 */
@Component
public final class SchedulingFacade {

    /** A slot as configured and what is still open once other bookings are counted. */
    public record SlotAvailability(TimeSlot configured, int openCourts) {}

    private final LeagueDataStore store;
    private final FixtureGenerator fixtures;
    private final MatchScheduler scheduler;
    private final BulkOperationRunner bulk;
    private final PlacementSearch search;
    private final AvailabilityModel availability;
    private final ConflictChecker conflicts;

    public SchedulingFacade(LeagueDataStore store, FixtureGenerator fixtures, MatchScheduler scheduler,
                            BulkOperationRunner bulk, PlacementSearch search, AvailabilityModel availability,
                            ConflictChecker conflicts) {
        this.store = store;
        this.fixtures = fixtures;
        this.scheduler = scheduler;
        this.bulk = bulk;
        this.search = search;
        this.availability = availability;
        this.conflicts = conflicts;
    }

    /** Generates the missing fixtures of a league and stores them. */
    public FixtureGenerator.Result generateFixtures(long leagueId) {
        League league = league(leagueId);
        FixtureGenerator.Result result = fixtures.generate(league, store.teamsByLeague(leagueId),
                store.matchesByLeague(leagueId), id -> store.match(id).isPresent());
        result.created().forEach(store::createMatch);
        return result;
    }

    public Match scheduleMatch(long matchId, long facilityId, LocalDate date, SchedulingOptions options) {
        return scheduler.schedule(match(matchId), facility(facilityId), date, options);
    }

    public Match unscheduleMatch(long matchId) {
        return scheduler.unschedule(match(matchId));
    }

    public void deleteMatch(long matchId) {
        scheduler.delete(match(matchId));
    }

    public BulkOperationResult runBulk(BulkOperation operation, BulkScope scope) {
        return runBulk(operation, scope, false);
    }

    public BulkOperationResult runBulk(BulkOperation operation, BulkScope scope, boolean dryRun) {
        if (scope.kind() == BulkScope.Kind.LEAGUE) league(scope.leagueId());
        return bulk.run(operation, scope, dryRun);
    }

    /**
     * What scheduling the match with these options would do. Without a facility id the match's own
     * facility is used, then the home team's.
     */
    public SchedulingPreview previewMatch(long matchId, Long facilityId, LocalDate date, SchedulingOptions options) {
        Match match = match(matchId);
        Facility facility;
        if (facilityId != null) {
            facility = facility(facilityId);
        } else if (match.facility() != null) {
            facility = match.facility();
        } else {
            facility = facility(match.homeTeam().homeFacilityId());
        }
        return scheduler.preview(match, facility, date, options);
    }

    /** Best placements for the match right now, in the order auto-scheduling would try them. */
    public List<MatchScheduler.Placement> placementOptions(long matchId, SchedulingOptions options, int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        return search.options(match(matchId), options, limit);
    }

    public List<Match> leagueMatches(long leagueId) {
        league(leagueId);
        return store.matchesByLeague(leagueId);
    }

    public SchedulingSummary summary(long leagueId) {
        return SchedulingSummary.of(leagueMatches(leagueId));
    }

    public List<SlotAvailability> availability(long facilityId, LocalDate date) {
        Facility facility = facility(facilityId);
        List<TimeSlot> configured = availability.availability(facility, date);
        List<TimeSlot> open = conflicts.remainingAvailability(facility, date, -1L);
        return IntStream.range(0, configured.size())
                .mapToObj(i -> new SlotAvailability(configured.get(i), open.get(i).availableCourts()))
                .toList();
    }

    private League league(long id) {
        return store.league(id).orElseThrow(() -> new NoSuchElementException("League " + id + " not found"));
    }

    private Match match(long id) {
        return store.match(id).orElseThrow(() -> new NoSuchElementException("Match " + id + " not found"));
    }

    private Facility facility(long id) {
        return store.facility(id).orElseThrow(() -> new NoSuchElementException("Facility " + id + " not found"));
    }
}
