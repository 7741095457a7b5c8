package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record ExtractSkillsRequest(
    @JsonProperty("text") JsonNode text
) {}
