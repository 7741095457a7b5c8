package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.skillpulse.processing.trend.TrendRecord;
import com.skillpulse.processing.trend.TrendSummary;

import java.util.List;

public record AnalyzeTrendsResponse(
    @JsonProperty("skills") List<TrendRecord> skills,
    @JsonProperty("summary") Summary summary,
    @JsonProperty("total_skills_analyzed") int totalSkillsAnalyzed
) {
  public record Summary(
      @JsonProperty("rising_count") int risingCount,
      @JsonProperty("stable_count") int stableCount,
      @JsonProperty("declining_count") int decliningCount,
      @JsonProperty("rising") List<TrendRecord> rising,
      @JsonProperty("stable") List<TrendRecord> stable,
      @JsonProperty("declining") List<TrendRecord> declining
  ) {
    public static Summary of(TrendSummary s) {
      return new Summary(s.rising().size(), s.stable().size(), s.declining().size(),
          s.rising(), s.stable(), s.declining());
    }
  }
}
