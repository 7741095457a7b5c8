package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record StoreTrendsRequest(
    @JsonProperty("skill_counts") JsonNode skillCounts,
    @JsonProperty("period") JsonNode period
) {}
