package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IngestResponse(
    @JsonProperty("skills") List<SkillFrequency> skills,
    @JsonProperty("total_skill_occurrences") long totalSkillOccurrences,
    @JsonProperty("unique_skills") int uniqueSkills,
    @JsonProperty("job_postings_analyzed") int jobPostingsAnalyzed
) {
  public record SkillFrequency(
      String skill,
      long count,
      double frequency
  ) {}

  public static IngestResponse empty() {
    return new IngestResponse(List.of(), 0, 0, 0);
  }
}
