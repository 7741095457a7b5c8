package com.skillpulse.api.model;

public record NormalizeResponse(
    String input,
    String skill,
    boolean recognized
) {}
