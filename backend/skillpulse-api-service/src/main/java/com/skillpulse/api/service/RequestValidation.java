package com.skillpulse.api.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Checks and cleans the loosely typed fields of API request bodies. Violations raise
 * {@link InvalidRequestException}; lenient fields fall back to their defaults instead.
 */
public final class RequestValidation {

  public static final int MAX_SKILL_NAME_LENGTH = 100;
  public static final int MAX_LABEL_LENGTH = 100;
  public static final int MAX_JOB_DESCRIPTIONS = 100;
  public static final int MAX_JOB_DESCRIPTION_LENGTH = 50_000;

  private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x1f\\x7f-\\x9f]");

  private RequestValidation() {}

  public static <T> T requireBody(T body) {
    if (body == null) throw new InvalidRequestException("Request body is required");
    return body;
  }

  static boolean absent(JsonNode node) {
    return node == null || node.isNull() || node.isMissingNode();
  }

  /**
   * Trims, strips control characters and caps the length of a free-text label.
   *
   * @return the cleaned value, or null when the node is not a non-empty string
   */
  public static String sanitizeLabel(JsonNode node, int maxLength) {
    if (absent(node) || !node.isTextual()) return null;
    String s = CONTROL_CHARS.matcher(node.textValue().strip()).replaceAll("");
    if (s.length() > maxLength) s = s.substring(0, maxLength);
    return s.isEmpty() ? null : s;
  }

  // Integral value within [min, max], otherwise the default
  public static int boundedInt(JsonNode node, int defaultValue, int min, int max) {
    if (absent(node) || !node.isIntegralNumber() || !node.canConvertToInt()) return defaultValue;
    int v = node.intValue();
    return v < min || v > max ? defaultValue : v;
  }

  public static boolean truthy(JsonNode node) {
    if (absent(node)) return false;
    if (node.isBoolean()) return node.booleanValue();
    if (node.isNumber()) return node.doubleValue() != 0;
    if (node.isTextual()) return !node.textValue().isEmpty();
    return node.size() > 0;
  }

  /**
   * Reads a {@code skill -> count} object. Counts must be non-negative numbers and are
   * truncated to whole numbers; skill names are trimmed and capped and must not be blank.
   * Keys that trim to the same name have their counts summed.
   */
  public static Map<String, Long> skillCounts(JsonNode node) {
    if (absent(node) || (node.isObject() && node.isEmpty())) {
      throw new InvalidRequestException("skill_counts is required");
    }
    if (!node.isObject()) {
      throw new InvalidRequestException("skill_counts must be an object");
    }
    Map<String, Long> counts = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      JsonNode value = e.getValue();
      if (value == null || !value.isNumber() || value.doubleValue() < 0) {
        throw new InvalidRequestException(
            "Invalid count for skill \"" + e.getKey() + "\": must be a non-negative number");
      }
      String name = skillName(e.getKey());
      if (name.isEmpty()) throw new InvalidRequestException("Skill names in skill_counts must not be blank");
      counts.merge(name, value.longValue(), Long::sum);
    }
    return counts;
  }

  static String skillName(String raw) {
    String s = raw.strip();
    return s.length() > MAX_SKILL_NAME_LENGTH ? s.substring(0, MAX_SKILL_NAME_LENGTH) : s;
  }

  /**
   * Collects the job descriptions of an ingest request, preferring the array form over the
   * single one.
   */
  public static List<String> jobDescriptions(JsonNode many, JsonNode single) {
    if (truthy(many)) {
      if (!many.isArray()) throw new InvalidRequestException("job_descriptions must be an array");
      if (many.size() > MAX_JOB_DESCRIPTIONS) {
        throw new InvalidRequestException("Maximum " + MAX_JOB_DESCRIPTIONS + " job descriptions allowed");
      }
      List<String> out = new ArrayList<>(many.size());
      for (int i = 0; i < many.size(); i++) {
        JsonNode desc = many.get(i);
        if (desc == null || !desc.isTextual()) {
          throw new InvalidRequestException("job_descriptions[" + i + "] must be a string");
        }
        String s = capDescription(desc.textValue());
        if (!s.isEmpty()) out.add(s);
      }
      return out;
    }
    if (truthy(single)) {
      if (!single.isTextual()) throw new InvalidRequestException("job_description must be a string");
      String s = capDescription(single.textValue());
      if (s.isEmpty()) throw new InvalidRequestException("job_description cannot be empty");
      return List.of(s);
    }
    throw new InvalidRequestException("Either job_description, job_descriptions, or use_mock=true is required");
  }

  private static String capDescription(String raw) {
    String s = raw.strip();
    return s.length() > MAX_JOB_DESCRIPTION_LENGTH ? s.substring(0, MAX_JOB_DESCRIPTION_LENGTH) : s;
  }
}
