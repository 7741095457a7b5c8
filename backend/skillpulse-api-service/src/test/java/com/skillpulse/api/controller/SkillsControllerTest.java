package com.skillpulse.api.controller;

import com.skillpulse.processing.text.AliasIndex;
import com.skillpulse.processing.text.SkillCatalog;
import com.skillpulse.processing.text.SkillExtractor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItems;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SkillsController.class)
@Import(SkillsControllerTest.ExtractorConfig.class)
class SkillsControllerTest {

  @TestConfiguration
  static class ExtractorConfig {
    @Bean
    SkillExtractor skillExtractor() {
      return new SkillExtractor(AliasIndex.of(SkillCatalog.load("classpath:skills/catalog.json")));
    }
  }

  @Autowired
  private MockMvc mockMvc;

  @Test
  void rootDescribesApi() throws Exception {
    mockMvc.perform(get("/api"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("SkillPulse API"))
        .andExpect(jsonPath("$.status").value("active"));
  }

  @Test
  void extractsSkillsWithCategories() throws Exception {
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"text\": \"Node.js developer with postgres and k8s\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(3))
        .andExpect(jsonPath("$.skills[0].skill").value("Kubernetes"))
        .andExpect(jsonPath("$.skills[1].skill").value("Node.js"))
        .andExpect(jsonPath("$.skills[2].skill").value("PostgreSQL"))
        .andExpect(jsonPath("$.skills[2].category").value("Database"));
  }

  @Test
  void blankTextYieldsEmptyResult() throws Exception {
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"text\": \"   \"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(0))
        .andExpect(jsonPath("$.skills").isEmpty());
  }

  @Test
  void rejectsMissingText() throws Exception {
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.success").value(false))
        .andExpect(jsonPath("$.error_type").value("ValidationError"))
        .andExpect(jsonPath("$.message").value("text field is required"));
  }

  @Test
  void rejectsNonStringText() throws Exception {
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"text\": 42}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("text must be a string"));
  }

  @Test
  void rejectsOversizedText() throws Exception {
    String text = "a".repeat(10_001);
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"text\": \"" + text + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_type").value("ValidationError"));
  }

  @Test
  void rejectsMissingBody() throws Exception {
    mockMvc.perform(post("/api/extract-skills").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("Request body is required"));
  }

  @Test
  void rejectsMalformedJson() throws Exception {
    mockMvc.perform(post("/api/extract-skills")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"text\": "))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error_type").value("ValidationError"));
  }

  @Test
  void listsCanonicalSkills() throws Exception {
    mockMvc.perform(get("/api/skills"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.skills", hasItems("Python", "Docker", "CI/CD")));
  }

  @Test
  void normalizesAliases() throws Exception {
    mockMvc.perform(get("/api/skills/normalize").param("name", "k8s"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.input").value("k8s"))
        .andExpect(jsonPath("$.skill").value("Kubernetes"))
        .andExpect(jsonPath("$.recognized").value(true));

    mockMvc.perform(get("/api/skills/normalize").param("name", "COBOL"))
        .andExpect(jsonPath("$.skill").value("COBOL"))
        .andExpect(jsonPath("$.recognized").value(false));
  }

  @Test
  void normalizeRequiresName() throws Exception {
    mockMvc.perform(get("/api/skills/normalize"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("name is required"));
  }
}
