package com.gnovoa.tennis.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
        int matchDurationMinutes,
        int defaultSeasonWeeks,
        int maxCandidateDates,
        Catalog catalog
) {
    public SchedulerProperties {
        if (matchDurationMinutes <= 0) matchDurationMinutes = 180;
        if (defaultSeasonWeeks <= 0) defaultSeasonWeeks = 16;
        if (maxCandidateDates <= 0) maxCandidateDates = 50;
        if (catalog == null) catalog = new Catalog(null);
    }

    public static SchedulerProperties defaults() {
        return new SchedulerProperties(0, 0, 0, null);
    }

    /** @param seedFile Spring resource location of a JSON catalog, or blank for none */
    public record Catalog(String seedFile) {}
}
