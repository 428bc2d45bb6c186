package com.hrsynth.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(T data, String status, String error, List<String> details) {
  public static <T> ApiResponse<T> success(T data) {
    return new ApiResponse<>(data, "ok", null, null);
  }

  public static <T> ApiResponse<T> error(String message) {
    return new ApiResponse<>(null, "error", message, null);
  }

  public static <T> ApiResponse<T> error(String message, List<String> details) {
    return new ApiResponse<>(null, "error", message, details.isEmpty() ? null : details);
  }
}
