package com.flamingo.ai.clouddocs.domain.model;

import com.flamingo.ai.clouddocs.domain.enums.DocumentCategory;
import com.flamingo.ai.clouddocs.domain.enums.PageStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/** A documentation page discovered from a service's navigation tree. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class DocumentPage {

  /** Stable page id derived from the canonical URL. Unique within a service. */
  private String id;

  private String url;
  private String title;
  private String service;

  @Builder.Default private DocumentCategory category = DocumentCategory.OTHER;

  private String handbookCode;

  /** Navigation depth, 1 for top-level entries. */
  @Builder.Default private int level = 1;

  @Builder.Default private PageStatus status = PageStatus.PENDING;

  private Integer contentLength;

  /** Error message if the fetch or normalization failed. */
  private String error;

  private Instant scrapedAt;

  /** Marks the page as being fetched. */
  public void startProcessing() {
    transitionTo(PageStatus.PROCESSING);
  }

  /** Marks the page as stored with the given markdown length. */
  public void markScraped(int contentLength, Instant at) {
    transitionTo(PageStatus.SCRAPED);
    this.contentLength = contentLength;
    this.scrapedAt = at;
    this.error = null;
  }

  /** Marks the page as failed with an error message. */
  public void markFailed(String errorMessage) {
    transitionTo(PageStatus.FAILED);
    this.error = errorMessage;
  }

  private void transitionTo(PageStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "Page " + service + "/" + id + " cannot move from " + status + " to " + next);
    }
    this.status = next;
  }
}
