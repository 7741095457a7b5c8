package com.skillpulse.api.model;

import com.skillpulse.processing.text.ExtractedSkill;

import java.util.List;

public record ExtractSkillsResponse(
    List<ExtractedSkill> skills,
    int count
) {
  public static ExtractSkillsResponse of(List<ExtractedSkill> skills) {
    return new ExtractSkillsResponse(skills, skills.size());
  }
}
