package com.flamingo.ai.clouddocs.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Kind of documentation a page belongs to, derived from its handbook code. */
public enum DocumentCategory {
  API_REFERENCE("api-reference"),
  USER_GUIDE("user-guide"),
  BEST_PRACTICES("best-practices"),
  FAQ("faq"),
  PRODUCT_DESCRIPTION("product-description"),
  QUICK_START("quick-start"),
  TROUBLESHOOTING("troubleshooting"),
  OTHER("other");

  private final String code;

  DocumentCategory(String code) {
    this.code = code;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  @JsonCreator
  public static DocumentCategory fromCode(String code) {
    if (code == null) {
      return OTHER;
    }
    for (DocumentCategory category : values()) {
      if (category.code.equalsIgnoreCase(code) || category.name().equalsIgnoreCase(code)) {
        return category;
      }
    }
    return OTHER;
  }

  /**
   * Maps a navigation handbook code to a category. Rules are checked in order; developer guides
   * ("dg") are filed under the user guide.
   *
   * @param handbookCode the {@code data-handbookcode} attribute, may be null
   * @return the matching category, {@link #OTHER} when nothing matches
   */
  public static DocumentCategory fromHandbookCode(String handbookCode) {
    String code = handbookCode == null ? "" : handbookCode.toLowerCase(Locale.ROOT);
    if (code.contains("api")) {
      return API_REFERENCE;
    }
    if (code.contains("productdesc")) {
      return PRODUCT_DESCRIPTION;
    }
    if (code.contains("qs") || code.contains("quickstart")) {
      return QUICK_START;
    }
    if (code.contains("ug") || code.contains("usermanual")) {
      return USER_GUIDE;
    }
    if (code.contains("bestpractice")) {
      return BEST_PRACTICES;
    }
    if (code.contains("trouble") || code.contains("faq")) {
      return FAQ;
    }
    if (code.contains("dg")) {
      return USER_GUIDE;
    }
    return OTHER;
  }
}
