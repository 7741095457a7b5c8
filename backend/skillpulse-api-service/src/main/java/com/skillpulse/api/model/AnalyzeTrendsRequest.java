package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record AnalyzeTrendsRequest(
    @JsonProperty("skill_counts") JsonNode skillCounts,
    @JsonProperty("comparison_period") JsonNode comparisonPeriod,
    @JsonProperty("periods_back") JsonNode periodsBack
) {}
