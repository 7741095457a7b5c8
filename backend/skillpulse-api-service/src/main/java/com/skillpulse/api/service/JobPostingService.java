package com.skillpulse.api.service;

import com.skillpulse.api.model.IngestResponse;
import com.skillpulse.processing.service.SkillStreamProcessor;
import com.skillpulse.processing.text.ExtractedSkill;
import com.skillpulse.processing.text.SkillExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

@Service
public class JobPostingService {

  private static final Logger log = LoggerFactory.getLogger(JobPostingService.class);

  private final SkillExtractor extractor;
  private final SkillStreamProcessor processor;

  public JobPostingService(SkillExtractor extractor, SkillStreamProcessor processor) {
    this.extractor = extractor;
    this.processor = processor;
  }

  /**
   * Counts, per skill, how many of the descriptions mention it. Ordered by count descending,
   * then by name. Blank descriptions are skipped.
   */
  public Map<String, Long> aggregateSkillCounts(List<String> descriptions) {
    return aggregate(descriptions, extractor::extract);
  }

  /**
   * Same as {@link #aggregateSkillCounts} but routes every description through the live
   * stream processor, so the counts also land in the next periodic snapshot.
   */
  public Map<String, Long> ingest(List<String> descriptions) {
    return aggregate(descriptions, processor::handleMessage);
  }

  public IngestResponse summarize(Map<String, Long> counts, int postings) {
    if (postings <= 0) return IngestResponse.empty();
    List<IngestResponse.SkillFrequency> skills = new ArrayList<>(counts.size());
    long total = 0;
    for (Map.Entry<String, Long> e : counts.entrySet()) {
      double frequency = BigDecimal.valueOf(e.getValue())
          .divide(BigDecimal.valueOf(postings), 2, RoundingMode.HALF_UP)
          .doubleValue();
      skills.add(new IngestResponse.SkillFrequency(e.getKey(), e.getValue(), frequency));
      total += e.getValue();
    }
    return new IngestResponse(skills, total, counts.size(), postings);
  }

  /**
   * Built-in sample postings, optionally narrowed by role and industry keywords. Falls back to
   * the full set when the filters leave nothing.
   */
  public List<String> sampleDescriptions(String role, String industry, int count) {
    List<String> filtered = SAMPLE_POSTINGS;
    if (role != null && !role.isBlank()) {
      String r = role.toLowerCase(Locale.ROOT);
      if (r.contains("backend") || r.contains("engineer")) {
        filtered = matching(filtered, "backend", "engineer");
      } else if (r.contains("frontend")) {
        filtered = matching(filtered, "frontend");
      } else if (r.contains("full") || r.contains("stack")) {
        filtered = matching(filtered, "full", "stack");
      } else if (r.contains("devops")) {
        filtered = matching(filtered, "devops");
      }
    }
    if (industry != null && !industry.isBlank()) {
      String i = industry.toLowerCase(Locale.ROOT);
      if (i.contains("fintech") || i.contains("finance")) {
        filtered = matching(filtered, "fintech", "financial");
      }
    }
    if (filtered.isEmpty()) filtered = SAMPLE_POSTINGS;
    return filtered.subList(0, Math.min(Math.max(count, 0), filtered.size()));
  }

  private static List<String> matching(List<String> postings, String... keywords) {
    List<String> out = new ArrayList<>();
    for (String p : postings) {
      String lower = p.toLowerCase(Locale.ROOT);
      for (String k : keywords) {
        if (lower.contains(k)) {
          out.add(p);
          break;
        }
      }
    }
    return out;
  }

  private Map<String, Long> aggregate(List<String> descriptions, Function<String, List<ExtractedSkill>> extract) {
    Map<String, Long> counts = new HashMap<>();
    int analysed = 0;
    for (String d : descriptions) {
      if (d == null || d.isBlank()) continue;
      analysed++;
      for (ExtractedSkill s : extract.apply(d)) {
        counts.merge(s.skill(), 1L, Long::sum);
      }
    }
    Map<String, Long> ordered = new LinkedHashMap<>();
    counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.comparingByKey()))
        .forEachOrdered(e -> ordered.put(e.getKey(), e.getValue()));
    log.info("Aggregated {} unique skills from {} job postings", ordered.size(), analysed);
    return ordered;
  }

  static final List<String> SAMPLE_POSTINGS = List.of(
      """
      Backend Engineer - FinTech Startup

      We are seeking an experienced Backend Engineer to join our growing FinTech team.
      You will be responsible for building scalable backend services using Python and FastAPI.

      Requirements:
      - 3+ years of experience with Python
      - Strong knowledge of REST API design
      - Experience with PostgreSQL databases
      - Familiarity with Docker and containerization
      - Understanding of microservices architecture
      - Knowledge of CI/CD pipelines
      - Experience with cloud platforms (AWS preferred)

      Nice to have:
      - Experience with Redis for caching
      - GraphQL API development
      - Experience in the financial services industry""",
      """
      Senior Full Stack Developer - E-commerce Platform

      Join our dynamic team building the next-generation e-commerce platform.
      We're looking for a Full Stack Developer with expertise in modern web technologies.

      Required Skills:
      - JavaScript and TypeScript
      - React.js for frontend development
      - Node.js and Express.js for backend
      - PostgreSQL database experience
      - REST API development
      - Git version control

      Additional Skills:
      - Next.js framework experience
      - Docker and Kubernetes
      - AWS cloud services
      - HTML and CSS expertise
      - Experience with Tailwind CSS""",
      """
      Backend Developer - Cloud Services

      We're hiring a Backend Developer to build robust cloud-based solutions.
      You'll work on distributed systems and API services.

      Technical Requirements:
      - Java programming experience
      - Spring Boot framework
      - Microservices architecture
      - Docker containerization
      - Kubernetes orchestration
      - REST API design
      - Database design with MySQL or PostgreSQL
      - Git and version control

      Bonus:
      - AWS or Azure cloud experience
      - CI/CD implementation experience
      - GraphQL knowledge""",
      """
      Frontend Engineer - SaaS Product

      Looking for a Frontend Engineer to help build beautiful, responsive user interfaces
      for our SaaS platform.

      Required:
      - React.js and TypeScript
      - HTML5 and CSS3
      - Next.js framework
      - JavaScript (ES6+)
      - REST API integration
      - Git workflow

      Preferred:
      - Tailwind CSS or SASS
      - Vue.js experience
      - GraphQL client experience
      - Docker basics""",
      """
      DevOps Engineer - Infrastructure Team

      We need a DevOps Engineer to help maintain and scale our infrastructure.

      Must Have:
      - Docker containerization
      - Kubernetes experience
      - CI/CD pipeline setup
      - AWS cloud platform
      - Git version control
      - Linux system administration

      Nice to Have:
      - Azure or GCP experience
      - Microservices deployment experience
      - Infrastructure as Code (IaC)
      - Monitoring and observability tools""",
      """
      Python Developer - Data Platform

      Join our data platform team building scalable data processing systems.

      Requirements:
      - Python programming (Python 3.x)
      - PostgreSQL database
      - REST API development
      - Docker containerization
      - Git version control
      - API design and development

      Additional:
      - FastAPI or Flask framework
      - Redis caching
      - AWS services
      - Microservices architecture""",
      """
      Node.js Developer - Real-time Applications

      We're building real-time communication features and need a skilled Node.js developer.

      Technical Skills:
      - Node.js runtime
      - Express.js framework
      - JavaScript and TypeScript
      - REST API and GraphQL
      - PostgreSQL or MongoDB
      - Docker containers
      - Git workflow

      Preferred:
      - Microservices experience
      - Redis caching
      - AWS cloud services
      - CI/CD pipelines""",
      """
      React Developer - Financial Dashboard

      Build beautiful financial dashboards and data visualization tools.

      Required Skills:
      - React.js framework
      - TypeScript
      - JavaScript
      - HTML and CSS
      - REST API integration
      - Git version control

      Additional:
      - Next.js experience
      - Tailwind CSS
      - PostgreSQL knowledge
      - Docker basics""",
      """
      Java Backend Developer - Enterprise Software

      Develop robust enterprise-grade backend services using Java.

      Must Have:
      - Java programming (Java 8+)
      - Spring Boot framework
      - REST API development
      - PostgreSQL or MySQL
      - Docker and Kubernetes
      - Git version control
      - Microservices architecture

      Preferred:
      - AWS cloud experience
      - CI/CD experience
      - API gateway experience
      - GraphQL knowledge""",
      """
      Full Stack Engineer - Startup

      Fast-growing startup seeking a Full Stack Engineer to build our core product.

      Tech Stack:
      - JavaScript and TypeScript
      - React.js frontend
      - Node.js backend
      - Express.js framework
      - PostgreSQL database
      - Docker containers
      - AWS cloud platform
      - Git version control

      Additional:
      - Next.js framework
      - REST API design
      - CI/CD pipelines
      - Microservices architecture""");
}
