package com.gnovoa.tennis.schedule;

import com.gnovoa.tennis.error.SchedulingException;
import com.gnovoa.tennis.model.Facility;
import com.gnovoa.tennis.model.Match;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.*;

/**
 * Where a match could go when nobody says where: candidate dates crossed with candidate
 * facilities, best first.
 *
 * <p>A date on which either team already has a placed match is never offered, whatever the times.
 */
public final class PlacementSearch {

    private static final Logger log = LoggerFactory.getLogger(PlacementSearch.class);

    private final MatchScheduler scheduler;
    private final CandidateDates candidateDates;
    private final LeagueDataStore store;

    public PlacementSearch(MatchScheduler scheduler, CandidateDates candidateDates, LeagueDataStore store) {
        this.scheduler = scheduler;
        this.candidateDates = candidateDates;
        this.store = store;
    }

    /** Candidate dates of the match minus the days either team already plays. */
    public List<LocalDate> openDates(Match match) {
        Set<LocalDate> busy = teamDates(match);
        return candidateDates.candidates(match).stream()
                .filter(d -> !busy.contains(d))
                .toList();
    }

    /** Home team's facility, visitor's facility, league preferred facilities, then all others by id. */
    public List<Facility> facilityOrder(Match match) {
        LinkedHashMap<Long, Facility> ordered = new LinkedHashMap<>();
        List<Long> preferredIds = new ArrayList<>();
        preferredIds.add(match.homeTeam().homeFacilityId());
        preferredIds.add(match.visitorTeam().homeFacilityId());
        preferredIds.addAll(match.league().preferredFacilityIds());
        for (long id : preferredIds) {
            if (!ordered.containsKey(id)) store.facility(id).ifPresent(f -> ordered.put(id, f));
        }
        for (Facility f : store.facilities()) ordered.putIfAbsent(f.id(), f);
        return List.copyOf(ordered.values());
    }

    /**
     * Placements that would work right now, date-major in preference order.
     *
     * @param limit stop after this many
     */
    public List<MatchScheduler.Placement> options(Match match, SchedulingOptions options, int limit) {
        List<MatchScheduler.Placement> found = new ArrayList<>();
        List<Facility> facilities = facilityOrder(match);
        for (LocalDate date : openDates(match)) {
            for (Facility facility : facilities) {
                if (facility.isUnavailableOn(date)) continue;
                try {
                    found.add(scheduler.plan(match, facility, date, options));
                } catch (SchedulingException e) {
                    log.trace("Match {} does not fit {} on {}: {}", match.id(), facility.name(), date, e.kind());
                    continue;
                }
                if (found.size() >= limit) return found;
            }
        }
        return found;
    }

    private Set<LocalDate> teamDates(Match match) {
        long home = match.homeTeam().id();
        long visitor = match.visitorTeam().id();
        Set<LocalDate> dates = new HashSet<>();
        store.matches(m -> m.id() != match.id() && m.isPlaced() && (m.involves(home) || m.involves(visitor)))
                .forEach(m -> dates.add(m.date()));
        return dates;
    }
}
