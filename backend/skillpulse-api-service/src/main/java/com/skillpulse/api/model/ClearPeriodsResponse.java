package com.skillpulse.api.model;

public record ClearPeriodsResponse(
    int removed
) {}
