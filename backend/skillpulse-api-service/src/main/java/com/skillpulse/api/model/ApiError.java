package com.skillpulse.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("error_type") String errorType
) {
  private static final int MAX_MESSAGE_LENGTH = 500;

  public static ApiError of(String message, String errorType) {
    String m = message == null ? "" : message;
    if (m.length() > MAX_MESSAGE_LENGTH) m = m.substring(0, MAX_MESSAGE_LENGTH);
    return new ApiError(false, m, errorType);
  }
}
