package com.skillpulse.processing.trend;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrendRecord(
    @JsonProperty("skill") String skill,
    @JsonProperty("current_count") long currentCount,
    @JsonProperty("previous_count") long previousCount,
    @JsonProperty("absolute_change") long absoluteChange,
    @JsonProperty("percentage_change") double percentageChange,
    @JsonProperty("trend") TrendClassification trend
) {}
