package com.skillpulse.api.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.skillpulse.api.model.ApiInfo;
import com.skillpulse.api.model.ExtractSkillsRequest;
import com.skillpulse.api.model.ExtractSkillsResponse;
import com.skillpulse.api.model.NormalizeResponse;
import com.skillpulse.api.model.SkillListResponse;
import com.skillpulse.api.service.InvalidRequestException;
import com.skillpulse.api.service.RequestValidation;
import com.skillpulse.processing.text.ExtractedSkill;
import com.skillpulse.processing.text.SkillExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
public class SkillsController {

  private static final Logger log = LoggerFactory.getLogger(SkillsController.class);

  private final SkillExtractor extractor;
  private final int maxTextLength;

  public SkillsController(SkillExtractor extractor,
                          @Value("${skillpulse.api.max-text-length:10000}") int maxTextLength) {
    this.extractor = extractor;
    this.maxTextLength = maxTextLength;
  }

  @GetMapping({"/api", "/api/"})
  public ApiInfo root() {
    return new ApiInfo("SkillPulse API", "1.0.0", "active");
  }

  @PostMapping("/api/extract-skills")
  public ExtractSkillsResponse extractSkills(@RequestBody(required = false) ExtractSkillsRequest request) {
    JsonNode text = RequestValidation.requireBody(request).text();
    if (text == null || text.isNull()) throw new InvalidRequestException("text field is required");
    if (!text.isTextual()) throw new InvalidRequestException("text must be a string");

    String sanitized = text.textValue().strip();
    if (sanitized.length() > maxTextLength) {
      throw new InvalidRequestException("Text exceeds maximum length of " + maxTextLength + " characters");
    }
    if (sanitized.isEmpty()) return ExtractSkillsResponse.of(List.of());

    List<ExtractedSkill> skills = extractor.extract(sanitized);
    log.info("Skills extracted: {} skills found", skills.size());
    return ExtractSkillsResponse.of(skills);
  }

  @GetMapping("/api/skills")
  public SkillListResponse listSkills() {
    List<String> all = extractor.listAll();
    return new SkillListResponse(all, all.size());
  }

  @GetMapping("/api/skills/normalize")
  public NormalizeResponse normalize(@RequestParam(name = "name") String name) {
    return new NormalizeResponse(name, extractor.normalize(name), extractor.isKnown(name));
  }
}
