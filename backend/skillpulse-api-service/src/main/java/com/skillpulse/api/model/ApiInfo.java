package com.skillpulse.api.model;

public record ApiInfo(
    String name,
    String version,
    String status
) {}
