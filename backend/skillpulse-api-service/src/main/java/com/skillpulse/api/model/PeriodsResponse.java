package com.skillpulse.api.model;

import java.util.List;

public record PeriodsResponse(
    List<String> periods,
    int count
) {}
