package com.flamingo.ai.clouddocs.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import lombok.Builder;

/**
 * A page that could not be fetched or normalized. Keyed by {@code url}.
 *
 * @param service service code
 * @param url page URL
 * @param title navigation title, may be null
 * @param error last error message
 * @param attempts attempts spent on the latest failure
 * @param lastAttempt time of the latest failure
 * @param willRetry when true the page is retried on the next targeted retry regardless of age
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailedPageRecord(
    String service,
    String url,
    String title,
    String error,
    int attempts,
    Instant lastAttempt,
    Boolean willRetry) {

  @JsonIgnore
  public boolean isMarkedForRetry() {
    return Boolean.TRUE.equals(willRetry);
  }
}
