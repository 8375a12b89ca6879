package com.flamingo.ai.clouddocs.service.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Converts cleaned documentation markup to markdown.
 *
 * <p>Headings use ATX style, code blocks are fenced with the language taken from a {@code
 * language-x}, {@code lang-x} or {@code code-x} class, tables become pipe tables surrounded by
 * blank lines, anchors without text are dropped and images without a source are dropped.
 */
@Component
@Slf4j
public class MarkdownConverter {

  private static final Pattern CODE_LANGUAGE =
      Pattern.compile("(?:language|lang|code)-([a-z0-9+#_]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{4,}");
  private static final Pattern HEADING_SPACING = Pattern.compile("(?m)^(#{1,6})[ \\t]+");
  private static final Pattern TRAILING_WHITESPACE = Pattern.compile("(?m)[ \\t]+$");
  private static final String FENCE = "```";

  private static final Set<String> BLOCK_TAGS =
      Set.of(
          "p", "div", "section", "article", "main", "header", "footer", "figure", "figcaption",
          "dl", "dt", "dd", "form", "fieldset", "center", "details", "summary", "body");
  private static final Set<String> SKIPPED_TAGS =
      Set.of("script", "style", "noscript", "head", "meta", "link", "iframe", "button", "input");

  /**
   * Converts markup to markdown. Never throws.
   *
   * @param html cleaned markup, may be null
   * @return markdown, or an empty string for empty or unparseable input
   */
  public String convert(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    try {
      Document document = Jsoup.parseBodyFragment(html);
      MarkdownBuilder out = new MarkdownBuilder();
      renderChildren(document.body(), out);
      return postProcess(out.toString());
    } catch (RuntimeException | StackOverflowError e) {
      log.error("Error converting HTML to markdown: {}", e.getMessage());
      return "";
    }
  }

  /**
   * Cleans up converted markdown outside code fences: at most two consecutive blank lines, one
   * space after heading markers, no trailing whitespace. Fence bodies are kept as they are apart
   * from blank lines directly inside the fence markers.
   */
  String postProcess(String markdown) {
    StringBuilder result = new StringBuilder();
    StringBuilder prose = new StringBuilder();
    boolean inFence = false;
    for (String line : tightenFences(markdown).split("\n", -1)) {
      if (inFence && line.startsWith(FENCE)) {
        // the closing line's newline belongs to the following text
        result.append(line);
        prose.append('\n');
        inFence = false;
      } else if (inFence) {
        result.append(line).append('\n');
      } else if (line.startsWith(FENCE)) {
        result.append(cleanProse(prose.toString())).append(line).append('\n');
        prose.setLength(0);
        inFence = true;
      } else {
        prose.append(line).append('\n');
      }
    }
    result.append(cleanProse(prose.toString()));
    return result.toString().trim();
  }

  private static String cleanProse(String prose) {
    String result = EXCESS_BLANK_LINES.matcher(prose).replaceAll("\n\n\n");
    result = HEADING_SPACING.matcher(result).replaceAll("$1 ");
    return TRAILING_WHITESPACE.matcher(result).replaceAll("");
  }

  private static String tightenFences(String markdown) {
    String[] lines = markdown.split("\n", -1);
    List<String> out = new ArrayList<>(lines.length);
    boolean inFence = false;
    for (String line : lines) {
      if (line.startsWith(FENCE)) {
        if (inFence) {
          while (!out.isEmpty() && out.get(out.size() - 1).isBlank()) {
            out.remove(out.size() - 1);
          }
        }
        out.add(line);
        inFence = !inFence;
        continue;
      }
      boolean afterOpeningFence = !out.isEmpty() && out.get(out.size() - 1).startsWith(FENCE);
      if (inFence && line.isBlank() && afterOpeningFence) {
        continue;
      }
      out.add(line);
    }
    return String.join("\n", out);
  }

  private void renderChildren(Element parent, MarkdownBuilder out) {
    for (Node child : parent.childNodes()) {
      renderNode(child, out);
    }
  }

  private void renderNode(Node node, MarkdownBuilder out) {
    if (node instanceof TextNode textNode) {
      out.text(textNode.getWholeText());
      return;
    }
    if (!(node instanceof Element element)) {
      return;
    }
    String tag = element.normalName().toLowerCase(Locale.ROOT);
    if (SKIPPED_TAGS.contains(tag)) {
      return;
    }
    switch (tag) {
      case "h1", "h2", "h3", "h4", "h5", "h6" -> renderHeading(element, tag, out);
      case "pre" -> renderCodeBlock(element, out);
      case "code", "kbd", "samp" -> renderInlineCode(element, out);
      case "strong", "b" -> renderWrapped(element, "**", out);
      case "em", "i" -> renderWrapped(element, "_", out);
      case "a" -> renderLink(element, out);
      case "img" -> renderImage(element, out);
      case "br" -> out.newline();
      case "hr" -> {
        out.blankLine();
        out.raw("---");
        out.blankLine();
      }
      case "ul", "ol" -> renderList(element, tag.equals("ol"), out);
      case "table" -> renderTable(element, out);
      case "blockquote" -> renderBlockquote(element, out);
      default -> {
        if (BLOCK_TAGS.contains(tag)) {
          out.blankLine();
          renderChildren(element, out);
          out.blankLine();
        } else {
          renderChildren(element, out);
        }
      }
    }
  }

  private void renderHeading(Element element, String tag, MarkdownBuilder out) {
    String text = singleLine(renderFragment(element));
    if (text.isEmpty()) {
      return;
    }
    int level = tag.charAt(1) - '0';
    out.blankLine();
    out.raw("#".repeat(level) + " " + text);
    out.blankLine();
  }

  private void renderCodeBlock(Element pre, MarkdownBuilder out) {
    Element code = pre.selectFirst("code");
    String classes = pre.className() + " " + (code != null ? code.className() : "");
    Matcher matcher = CODE_LANGUAGE.matcher(classes);
    String language = matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : "";
    String content = (code != null ? code : pre).wholeText();
    content = content.replaceAll("^\n+|\n+$", "");
    out.blankLine();
    out.raw(FENCE + language + "\n" + content + "\n" + FENCE);
    out.blankLine();
  }

  private void renderInlineCode(Element element, MarkdownBuilder out) {
    String text = element.wholeText();
    if (text.isBlank()) {
      return;
    }
    String fence = text.contains("`") ? "``" : "`";
    out.inline(fence + text.replace('\n', ' ') + fence);
  }

  private void renderWrapped(Element element, String delimiter, MarkdownBuilder out) {
    String inner = singleLine(renderFragment(element));
    if (inner.isEmpty()) {
      return;
    }
    out.inline(delimiter + inner + delimiter);
  }

  private void renderLink(Element anchor, MarkdownBuilder out) {
    String inner = singleLine(renderFragment(anchor));
    if (inner.isEmpty()) {
      return;
    }
    String href = anchor.attr("href").trim();
    if (href.isEmpty() || href.toLowerCase(Locale.ROOT).startsWith("javascript:")) {
      out.inline(inner);
      return;
    }
    out.inline("[" + inner + "](" + href + ")");
  }

  private void renderImage(Element image, MarkdownBuilder out) {
    String src = image.attr("src").trim();
    if (src.isEmpty()) {
      return;
    }
    out.inline("![" + image.attr("alt").trim() + "](" + src + ")");
  }

  private void renderList(Element list, boolean ordered, MarkdownBuilder out) {
    out.blankLine();
    int index = 1;
    for (Element item : list.children()) {
      if (!item.normalName().equals("li")) {
        continue;
      }
      String marker = ordered ? (index++) + ". " : "- ";
      String body = renderFragment(item).trim().replaceAll("\n{2,}", "\n");
      String indent = " ".repeat(marker.length());
      String[] lines = body.split("\n", -1);
      StringBuilder rendered = new StringBuilder(marker).append(lines[0]);
      for (int i = 1; i < lines.length; i++) {
        rendered.append('\n');
        if (!lines[i].isEmpty()) {
          rendered.append(indent).append(lines[i]);
        }
      }
      out.newline();
      out.raw(rendered.toString());
      out.newline();
    }
    out.blankLine();
  }

  private void renderTable(Element table, MarkdownBuilder out) {
    List<List<String>> rows = new ArrayList<>();
    int columns = 0;
    for (Element row : table.select("tr")) {
      if (row.closest("table") != table) {
        continue;
      }
      List<String> cells = new ArrayList<>();
      for (Element cell : row.children()) {
        String name = cell.normalName();
        if (name.equals("td") || name.equals("th")) {
          cells.add(singleLine(renderFragment(cell)).replace("|", "\\|"));
        }
      }
      if (!cells.isEmpty()) {
        rows.add(cells);
        columns = Math.max(columns, cells.size());
      }
    }
    if (rows.isEmpty()) {
      return;
    }
    StringBuilder rendered = new StringBuilder();
    for (int r = 0; r < rows.size(); r++) {
      List<String> cells = rows.get(r);
      rendered.append('|');
      for (int c = 0; c < columns; c++) {
        rendered.append(' ').append(c < cells.size() ? cells.get(c) : "").append(" |");
      }
      rendered.append('\n');
      if (r == 0) {
        rendered.append('|').append(" --- |".repeat(columns)).append('\n');
      }
    }
    out.blankLine();
    out.raw(rendered.toString().stripTrailing());
    out.blankLine();
  }

  private void renderBlockquote(Element quote, MarkdownBuilder out) {
    String body = renderFragment(quote).trim();
    if (body.isEmpty()) {
      return;
    }
    StringBuilder rendered = new StringBuilder();
    for (String line : body.split("\n", -1)) {
      rendered.append(line.isEmpty() ? ">" : "> " + line).append('\n');
    }
    out.blankLine();
    out.raw(rendered.toString().stripTrailing());
    out.blankLine();
  }

  private String renderFragment(Element element) {
    MarkdownBuilder fragment = new MarkdownBuilder();
    renderChildren(element, fragment);
    return fragment.toString().trim();
  }

  private static String singleLine(String text) {
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /** Accumulates markdown while keeping block separation and inline spacing consistent. */
  private static final class MarkdownBuilder {

    private final StringBuilder sb = new StringBuilder();

    void text(String raw) {
      String text = WHITESPACE.matcher(raw).replaceAll(" ");
      if (text.isEmpty()) {
        return;
      }
      if ((sb.length() == 0 || endsWith('\n') || endsWith(' ')) && text.startsWith(" ")) {
        text = text.substring(1);
      }
      sb.append(text);
    }

    void inline(String markdown) {
      sb.append(markdown);
    }

    void raw(String markdown) {
      sb.append(markdown);
    }

    void newline() {
      stripTrailingSpaces();
      if (sb.length() > 0 && !endsWith('\n')) {
        sb.append('\n');
      }
    }

    void blankLine() {
      stripTrailingSpaces();
      if (sb.length() == 0) {
        return;
      }
      int trailing = 0;
      for (int i = sb.length() - 1; i >= 0 && sb.charAt(i) == '\n' && trailing < 2; i--) {
        trailing++;
      }
      sb.append("\n".repeat(2 - trailing));
    }

    private void stripTrailingSpaces() {
      int end = sb.length();
      while (end > 0 && (sb.charAt(end - 1) == ' ' || sb.charAt(end - 1) == '\t')) {
        end--;
      }
      sb.setLength(end);
    }

    private boolean endsWith(char c) {
      return sb.length() > 0 && sb.charAt(sb.length() - 1) == c;
    }

    @Override
    public String toString() {
      return sb.toString();
    }
  }
}
