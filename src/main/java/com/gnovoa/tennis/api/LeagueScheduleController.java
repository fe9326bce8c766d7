package com.gnovoa.tennis.api;

import com.gnovoa.tennis.api.dto.*;
import com.gnovoa.tennis.fixtures.FixtureGenerator;
import com.gnovoa.tennis.runner.SchedulingFacade;
import com.gnovoa.tennis.schedule.SchedulingOptions;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api")
public class LeagueScheduleController {

    private final SchedulingFacade facade;

    public LeagueScheduleController(SchedulingFacade facade) {
        this.facade = facade;
    }

    @PostMapping("/leagues/{leagueId}/fixtures")
    public FixtureGenerationResponse generateFixtures(@PathVariable long leagueId) {
        FixtureGenerator.Result result = facade.generateFixtures(leagueId);
        return new FixtureGenerationResponse(leagueId, result.createdCount(),
                result.created().stream().map(MatchResponse::from).toList());
    }

    @GetMapping("/leagues/{leagueId}/matches")
    public List<MatchResponse> matches(@PathVariable long leagueId) {
        return facade.leagueMatches(leagueId).stream().map(MatchResponse::from).toList();
    }

    @GetMapping("/leagues/{leagueId}/summary")
    public SummaryResponse summary(@PathVariable long leagueId) {
        return SummaryResponse.of(leagueId, facade.summary(leagueId));
    }

    @GetMapping("/facilities/{facilityId}/availability")
    public AvailabilityResponse availability(@PathVariable long facilityId,
                                             @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return AvailabilityResponse.of(facilityId, date, facade.availability(facilityId, date));
    }

    @PostMapping("/matches/{matchId}/schedule")
    public MatchResponse schedule(@PathVariable long matchId, @RequestBody ScheduleMatchRequest req) {
        if (req.facilityId() == null) throw new IllegalArgumentException("facilityId is required");
        return MatchResponse.from(facade.scheduleMatch(matchId, req.facilityId(), req.date(), req.toOptions()));
    }

    @PostMapping("/matches/{matchId}/unschedule")
    public MatchResponse unschedule(@PathVariable long matchId) {
        return MatchResponse.from(facade.unscheduleMatch(matchId));
    }

    @DeleteMapping("/matches/{matchId}")
    public ResponseEntity<Void> delete(@PathVariable long matchId) {
        facade.deleteMatch(matchId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/matches/bulk")
    public BulkOperationResponse bulk(@RequestBody BulkOperationRequest req) {
        return BulkOperationResponse.from(facade.runBulk(req.operation(), req.toScope(), req.dryRunRequested()));
    }

    @PostMapping("/matches/{matchId}/preview")
    public SchedulingPreviewResponse preview(@PathVariable long matchId, @RequestBody ScheduleMatchRequest req) {
        return SchedulingPreviewResponse.from(facade.previewMatch(matchId, req.facilityId(), req.date(), req.toOptions()));
    }

    @GetMapping("/matches/{matchId}/options")
    public List<PlacementOptionResponse> options(@PathVariable long matchId,
                                                 @RequestParam(defaultValue = "10") int limit) {
        return facade.placementOptions(matchId, SchedulingOptions.auto(), limit).stream()
                .map(PlacementOptionResponse::from)
                .toList();
    }
}
