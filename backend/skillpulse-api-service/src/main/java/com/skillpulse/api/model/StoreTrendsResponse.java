package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StoreTrendsResponse(
    @JsonProperty("message") String message,
    @JsonProperty("period") String period,
    @JsonProperty("skills_count") int skillsCount,
    @JsonProperty("total_occurrences") long totalOccurrences
) {}
