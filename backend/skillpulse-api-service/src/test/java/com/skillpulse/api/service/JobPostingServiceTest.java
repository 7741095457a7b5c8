package com.skillpulse.api.service;

import com.skillpulse.api.model.IngestResponse;
import com.skillpulse.processing.service.SkillStreamProcessor;
import com.skillpulse.processing.store.SnapshotStore;
import com.skillpulse.processing.text.AliasIndex;
import com.skillpulse.processing.text.SkillCatalog;
import com.skillpulse.processing.text.SkillExtractor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class JobPostingServiceTest {

  private SkillStreamProcessor processor;
  private JobPostingService service;

  @BeforeEach
  void setUp() {
    SkillExtractor extractor = new SkillExtractor(AliasIndex.of(SkillCatalog.load("classpath:skills/catalog.json")));
    Clock clock = Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC);
    processor = new SkillStreamProcessor(extractor, mock(SnapshotStore.class), clock, new SimpleMeterRegistry());
    service = new JobPostingService(extractor, processor);
  }

  // ==================== Aggregation ====================

  @Nested
  class Aggregation {

    @Test
    void countsPostingsPerSkillOrderedByCountThenName() {
      Map<String, Long> counts = service.aggregateSkillCounts(List.of(
          "Python and Docker, python again",
          "Docker and Kubernetes",
          "Docker"));

      assertThat(counts).containsExactly(
          Map.entry("Docker", 3L),
          Map.entry("Kubernetes", 1L),
          Map.entry("Python", 1L));
    }

    @Test
    void skipsBlankAndNullDescriptions() {
      Map<String, Long> counts = service.aggregateSkillCounts(Arrays.asList("  ", null, "Java"));

      assertThat(counts).containsExactly(Map.entry("Java", 1L));
    }

    @Test
    void aggregateDoesNotTouchLiveCounts() {
      service.aggregateSkillCounts(List.of("Java"));

      assertThat(processor.currentCounts()).isEmpty();
    }

    @Test
    void ingestFeedsLiveCounts() {
      Map<String, Long> counts = service.ingest(List.of("Java", "Java and Go"));

      assertThat(counts).containsEntry("Java", 2L);
      assertThat(processor.currentCounts()).containsEntry("Java", 2L);
      assertThat(processor.documentsInPeriod()).isEqualTo(2);
    }
  }

  // ==================== Summary ====================

  @Nested
  class Summary {

    @Test
    void computesFrequencyPerPosting() {
      Map<String, Long> counts = new LinkedHashMap<>();
      counts.put("Python", 5L);
      counts.put("Docker", 2L);

      IngestResponse response = service.summarize(counts, 6);

      assertThat(response.skills()).extracting(IngestResponse.SkillFrequency::frequency).containsExactly(0.83, 0.33);
      assertThat(response.totalSkillOccurrences()).isEqualTo(7);
      assertThat(response.uniqueSkills()).isEqualTo(2);
      assertThat(response.jobPostingsAnalyzed()).isEqualTo(6);
    }

    @Test
    void noPostingsGivesEmptyResponse() {
      assertThat(service.summarize(Map.of(), 0)).isEqualTo(IngestResponse.empty());
    }
  }

  // ==================== Sample postings ====================

  @Nested
  class SamplePostings {

    @Test
    void returnsRequestedNumberOfSamples() {
      assertThat(service.sampleDescriptions(null, null, 5)).hasSize(5);
      assertThat(service.sampleDescriptions(null, null, 20)).hasSize(JobPostingService.SAMPLE_POSTINGS.size());
    }

    @Test
    void filtersByRole() {
      assertThat(service.sampleDescriptions("Frontend developer", null, 20))
          .isNotEmpty()
          .allSatisfy(p -> assertThat(p.toLowerCase()).contains("frontend"));
      assertThat(service.sampleDescriptions("DevOps", null, 20))
          .singleElement()
          .satisfies(p -> assertThat(p).contains("DevOps Engineer"));
    }

    @Test
    void filtersByIndustry() {
      assertThat(service.sampleDescriptions("backend", "FinTech", 20))
          .isNotEmpty()
          .allSatisfy(p -> assertThat(p.toLowerCase()).containsAnyOf("fintech", "financial"));
    }

    @Test
    void fallsBackToAllSamplesWhenFiltersMatchNothing() {
      assertThat(service.sampleDescriptions("devops", "finance", 20))
          .hasSize(JobPostingService.SAMPLE_POSTINGS.size());
    }

    @Test
    void samplesYieldKnownSkills() {
      Map<String, Long> counts = service.aggregateSkillCounts(service.sampleDescriptions(null, null, 20));

      assertThat(counts).containsKeys("Docker", "PostgreSQL", "Git", "REST API");
      assertThat(counts.entrySet().iterator().next()).isEqualTo(Map.entry("Docker", 10L));
    }
  }
}
