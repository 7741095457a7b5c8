package com.skillpulse.api.model;

import java.util.List;

public record SkillListResponse(
    List<String> skills,
    int count
) {}
