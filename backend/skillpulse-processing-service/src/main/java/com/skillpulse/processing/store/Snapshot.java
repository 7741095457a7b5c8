package com.skillpulse.processing.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated skill counts persisted for one period.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Snapshot(
    @JsonProperty("period") String period,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("counts") Map<String, Long> counts,
    @JsonProperty("total_occurrences") long totalOccurrences,
    @JsonProperty("unique_skills") int uniqueSkills
) {

    public Snapshot {
        TreeMap<String, Long> copy = new TreeMap<>();
        if (counts != null) {
            counts.forEach((skill, count) -> {
                if (skill != null && count != null) copy.put(skill, count);
            });
        }
        counts = Collections.unmodifiableMap(copy);
    }

    public static Snapshot of(String period, String timestamp, Map<String, Long> counts) {
        long total = 0;
        int unique = 0;
        if (counts != null) {
            for (Long c : counts.values()) {
                if (c == null) continue;
                total += c;
                unique++;
            }
        }
        return new Snapshot(period, timestamp, counts, total, unique);
    }
}
