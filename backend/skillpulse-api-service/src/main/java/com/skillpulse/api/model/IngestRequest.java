package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record IngestRequest(
    @JsonProperty("use_mock") JsonNode useMock,
    @JsonProperty("role") JsonNode role,
    @JsonProperty("industry") JsonNode industry,
    @JsonProperty("count") JsonNode count,
    @JsonProperty("job_description") JsonNode jobDescription,
    @JsonProperty("job_descriptions") JsonNode jobDescriptions
) {}
