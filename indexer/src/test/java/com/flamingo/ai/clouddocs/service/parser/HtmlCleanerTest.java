package com.flamingo.ai.clouddocs.service.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HtmlCleaner Tests")
class HtmlCleanerTest {

  private HtmlCleaner htmlCleaner;

  @BeforeEach
  void setUp() {
    htmlCleaner = new HtmlCleaner();
  }

  static String fixture(String name) throws IOException {
    try (InputStream in = HtmlCleanerTest.class.getResourceAsStream("/fixtures/" + name)) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  @Nested
  @DisplayName("clean")
  class Clean {

    @Test
    @DisplayName("Should keep the main content container without site chrome")
    void shouldKeepMainContent() throws IOException {
      String cleaned = htmlCleaner.clean(fixture("ecs-page.html"));

      assertThat(cleaned)
          .contains("<h1>Creating an ECS</h1>")
          .contains("Prerequisites")
          .contains("openstack server create")
          .doesNotContain("HUAWEI CLOUD")
          .doesNotContain("User Guide")
          .doesNotContain("Related documents")
          .doesNotContain("Copyright")
          .doesNotContain("Was this page helpful")
          .doesNotContain("analytics")
          .doesNotContain("generated by doc build");
    }

    @Test
    @DisplayName("Should strip data and event attributes")
    void shouldStripScriptingAttributes() {
      String html =
          "<div class=\"help-doc-content\"><p data-id=\"1\" onmouseover=\"x()\" class=\"lead\">"
              + "a".repeat(150)
              + "</p></div>";

      String cleaned = htmlCleaner.clean(html);

      assertThat(cleaned)
          .contains("class=\"lead\"")
          .doesNotContain("data-id")
          .doesNotContain("onmouseover");
    }

    @Test
    @DisplayName("Should fall back to the body when no container has enough text")
    void shouldFallBackToBody() {
      String html =
          "<body><div class=\"help-doc-content\">Short</div><p>Other text</p></body>";

      String cleaned = htmlCleaner.clean(html);

      assertThat(cleaned).contains("Short").contains("Other text");
    }

    @Test
    @DisplayName("Should return an empty string for blank input")
    void shouldReturnEmptyForBlankInput() {
      assertThat(htmlCleaner.clean(null)).isEmpty();
      assertThat(htmlCleaner.clean("   ")).isEmpty();
    }
  }

  @Nested
  @DisplayName("extractTitle")
  class ExtractTitle {

    @Test
    @DisplayName("Should prefer the first h1")
    void shouldPreferHeading() throws IOException {
      assertThat(htmlCleaner.extractTitle(fixture("ecs-page.html"))).isEqualTo("Creating an ECS");
    }

    @Test
    @DisplayName("Should fall back to the title element")
    void shouldFallBackToTitleElement() {
      String html = "<html><head><title>Billing FAQ</title></head><body><p>x</p></body></html>";

      assertThat(htmlCleaner.extractTitle(html)).isEqualTo("Billing FAQ");
    }

    @Test
    @DisplayName("Should skip blank headings")
    void shouldSkipBlankHeadings() {
      assertThat(htmlCleaner.extractTitle("<h1>  </h1><h2>Overview</h2>")).isEqualTo("Overview");
    }

    @Test
    @DisplayName("Should return Untitled when nothing matches")
    void shouldReturnUntitled() {
      assertThat(htmlCleaner.extractTitle("<p>No title here</p>")).isEqualTo("Untitled");
      assertThat(htmlCleaner.extractTitle("")).isEqualTo("Untitled");
    }
  }
}
