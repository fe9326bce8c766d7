package com.gnovoa.tennis.api.dto;

import java.util.List;

public record FixtureGenerationResponse(long leagueId, int createdCount, List<MatchResponse> created) {}
