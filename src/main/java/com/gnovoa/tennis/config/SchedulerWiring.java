package com.gnovoa.tennis.config;

import com.gnovoa.tennis.fixtures.FixtureGenerator;
import com.gnovoa.tennis.fixtures.RoundRobinScheduler;
import com.gnovoa.tennis.runner.BulkOperationRunner;
import com.gnovoa.tennis.schedule.*;
import com.gnovoa.tennis.store.LeagueDataStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerWiring {

    @Bean
    public RoundRobinScheduler roundRobinScheduler() {
        return new RoundRobinScheduler();
    }

    @Bean
    public FixtureGenerator fixtureGenerator(RoundRobinScheduler roundRobin) {
        return new FixtureGenerator(roundRobin);
    }

    @Bean
    public AvailabilityModel availabilityModel() {
        return new AvailabilityModel();
    }

    @Bean
    public SlotPlanner slotPlanner() {
        return new SlotPlanner();
    }

    @Bean
    public ConflictChecker conflictChecker(AvailabilityModel availability, LeagueDataStore store, SchedulerProperties props) {
        return new ConflictChecker(availability, store, props);
    }

    @Bean
    public MatchScheduler matchScheduler(AvailabilityModel availability, SlotPlanner planner, ConflictChecker conflicts,
                                         LeagueDataStore store) {
        return new MatchScheduler(availability, planner, conflicts, store);
    }

    @Bean
    public SeasonWindowProvider seasonWindowProvider(Clock clock, SchedulerProperties props) {
        return new LeagueSeasonWindowProvider(clock, props);
    }

    @Bean
    public CandidateDates candidateDates(SeasonWindowProvider seasons, SchedulerProperties props) {
        return new CandidateDates(seasons, props);
    }

    @Bean
    public PlacementSearch placementSearch(MatchScheduler scheduler, CandidateDates dates, LeagueDataStore store) {
        return new PlacementSearch(scheduler, dates, store);
    }

    @Bean
    public BulkOperationRunner bulkOperationRunner(MatchScheduler scheduler, PlacementSearch search, LeagueDataStore store) {
        return new BulkOperationRunner(scheduler, search, store);
    }
}
