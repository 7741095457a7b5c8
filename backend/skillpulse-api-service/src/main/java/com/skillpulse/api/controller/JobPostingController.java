package com.skillpulse.api.controller;

import com.skillpulse.api.model.IngestRequest;
import com.skillpulse.api.model.IngestResponse;
import com.skillpulse.api.service.JobPostingService;
import com.skillpulse.api.service.RequestValidation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
public class JobPostingController {

  private static final Logger log = LoggerFactory.getLogger(JobPostingController.class);

  private static final int DEFAULT_SAMPLE_COUNT = 5;
  private static final int MAX_SAMPLE_COUNT = 20;

  private final JobPostingService postings;

  public JobPostingController(JobPostingService postings) {
    this.postings = postings;
  }

  @PostMapping("/api/job-postings/ingest")
  public IngestResponse ingest(@RequestBody(required = false) IngestRequest request) {
    RequestValidation.requireBody(request);

    List<String> descriptions;
    Map<String, Long> counts;
    if (RequestValidation.truthy(request.useMock())) {
      String role = RequestValidation.sanitizeLabel(request.role(), RequestValidation.MAX_LABEL_LENGTH);
      String industry = RequestValidation.sanitizeLabel(request.industry(), RequestValidation.MAX_LABEL_LENGTH);
      int count = RequestValidation.boundedInt(request.count(), DEFAULT_SAMPLE_COUNT, 1, MAX_SAMPLE_COUNT);
      descriptions = postings.sampleDescriptions(role, industry, count);
      counts = postings.aggregateSkillCounts(descriptions);
    } else {
      descriptions = RequestValidation.jobDescriptions(request.jobDescriptions(), request.jobDescription());
      if (descriptions.isEmpty()) return IngestResponse.empty();
      counts = postings.ingest(descriptions);
    }

    IngestResponse response = postings.summarize(counts, descriptions.size());
    log.info("Job posting ingestion completed: {} descriptions, {} unique skills",
        response.jobPostingsAnalyzed(), response.uniqueSkills());
    return response;
  }
}
