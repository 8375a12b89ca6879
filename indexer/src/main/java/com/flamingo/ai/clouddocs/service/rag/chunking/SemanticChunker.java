package com.flamingo.ai.clouddocs.service.rag.chunking;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.CleanDocument;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.commonmark.node.Code;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits markdown documents into chunks aligned to heading sections.
 *
 * <p>Each heading opens a section whose path is the stack of enclosing headings. Content before
 * the first heading forms a section with an empty path. Sections under {@code minSize} tokens are
 * dropped; sections over {@code maxSize} are split at paragraph boundaries. Headings are found by
 * a CommonMark parse, so lines inside fenced or indented code are never treated as headings.
 */
@Component
@Slf4j
public class SemanticChunker {

  private static final Parser PARSER =
      Parser.builder().includeSourceSpans(IncludeSourceSpans.BLOCKS).build();
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\n+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ChunkingOptions defaults;

  @Autowired
  public SemanticChunker(RagConfig ragConfig) {
    this(ChunkingOptions.from(ragConfig.getChunking()));
  }

  public SemanticChunker(ChunkingOptions defaults) {
    this.defaults = defaults;
  }

  record Header(int level, String text, int start, int end) {}

  record Section(List<String> headers, String body) {}

  public List<DocumentChunk> chunkDocument(CleanDocument document) {
    return chunkDocument(document, defaults);
  }

  /**
   * Chunks one document.
   *
   * @param document normalized page
   * @param options token limits
   * @return chunks with document-unique, gap-free positions starting at zero
   */
  public List<DocumentChunk> chunkDocument(CleanDocument document, ChunkingOptions options) {
    CleanDocument.Metadata metadata = document.metadata();
    List<Section> sections = splitByHeaders(document.content());
    List<DocumentChunk> chunks = new ArrayList<>();

    for (Section section : sections) {
      int tokens = Tokenizer.count(section.body());
      if (tokens < options.minSize()) {
        continue;
      }
      if (tokens > options.maxSize()) {
        for (String part : splitLargeSection(section.body(), options)) {
          chunks.add(toChunk(metadata, section.headers(), part, chunks.size()));
        }
      } else {
        chunks.add(toChunk(metadata, section.headers(), section.body(), chunks.size()));
      }
    }

    log.debug(
        "Chunked {}/{} into {} chunks from {} sections",
        metadata.service(),
        metadata.id(),
        chunks.size(),
        sections.size());
    return chunks;
  }

  /** Top-level ATX headings with the offsets of the line each one occupies. */
  List<Header> extractHeaders(String content) {
    List<Integer> lineStarts = lineStarts(content);
    List<Header> headers = new ArrayList<>();
    Node document = PARSER.parse(content);
    for (Node node = document.getFirstChild(); node != null; node = node.getNext()) {
      if (!(node instanceof Heading heading) || heading.getSourceSpans().isEmpty()) {
        continue;
      }
      SourceSpan span = heading.getSourceSpans().get(0);
      int start = lineStarts.get(span.getLineIndex());
      int lineEnd = content.indexOf('\n', start);
      lineEnd = lineEnd < 0 ? content.length() : lineEnd;
      // setext headings span two lines and are left to the body
      if (!content.substring(start, lineEnd).stripLeading().startsWith("#")) {
        continue;
      }
      String text = extractText(heading);
      if (!text.isEmpty()) {
        headers.add(new Header(heading.getLevel(), text, start, lineEnd));
      }
    }
    return headers;
  }

  private static List<Integer> lineStarts(String content) {
    List<Integer> starts = new ArrayList<>();
    starts.add(0);
    for (int i = 0; i < content.length(); i++) {
      if (content.charAt(i) == '\n') {
        starts.add(i + 1);
      }
    }
    return starts;
  }

  private static String extractText(Node node) {
    StringBuilder sb = new StringBuilder();
    collectNodeText(node, sb);
    return sb.toString().trim();
  }

  private static void collectNodeText(Node node, StringBuilder sb) {
    if (node instanceof Text textNode) {
      sb.append(textNode.getLiteral());
    } else if (node instanceof Code code) {
      sb.append(code.getLiteral());
    } else if (node instanceof SoftLineBreak) {
      sb.append(" ");
    } else {
      Node child = node.getFirstChild();
      while (child != null) {
        collectNodeText(child, sb);
        child = child.getNext();
      }
    }
  }

  List<Section> splitByHeaders(String content) {
    if (content == null || content.isBlank()) {
      return List.of();
    }
    List<Header> headers = extractHeaders(content);
    if (headers.isEmpty()) {
      return List.of(new Section(List.of(), content.trim()));
    }

    List<Section> sections = new ArrayList<>();
    String preamble = content.substring(0, headers.get(0).start()).trim();
    if (!preamble.isEmpty()) {
      sections.add(new Section(List.of(), preamble));
    }

    Deque<Header> stack = new ArrayDeque<>();
    for (int i = 0; i < headers.size(); i++) {
      Header current = headers.get(i);
      while (!stack.isEmpty() && stack.peekLast().level() >= current.level()) {
        stack.removeLast();
      }
      stack.addLast(current);

      int bodyStart = Math.min(current.end(), content.length());
      int bodyEnd = i + 1 < headers.size() ? headers.get(i + 1).start() : content.length();
      String body = content.substring(bodyStart, Math.max(bodyStart, bodyEnd)).trim();
      if (!body.isEmpty()) {
        sections.add(new Section(stack.stream().map(Header::text).toList(), body));
      }
    }
    return sections;
  }

  private List<String> splitLargeSection(String body, ChunkingOptions options) {
    List<String> parts = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    int bufferTokens = 0;

    for (String paragraph : PARAGRAPH_BREAK.split(body)) {
      int paragraphTokens = Tokenizer.count(paragraph);
      if (bufferTokens > 0 && bufferTokens + paragraphTokens > options.maxSize()) {
        parts.add(buffer.toString());
        buffer.setLength(0);
        buffer.append(paragraph);
        bufferTokens = paragraphTokens;
      } else {
        if (buffer.length() > 0) {
          buffer.append("\n\n");
        }
        buffer.append(paragraph);
        bufferTokens += paragraphTokens;
      }
    }

    if (bufferTokens >= options.minSize() && bufferTokens > 0) {
      parts.add(buffer.toString());
    }
    return parts;
  }

  private static DocumentChunk toChunk(
      CleanDocument.Metadata metadata, List<String> headers, String body, int position) {
    String content = WHITESPACE.matcher(body).replaceAll(" ").trim();
    return new DocumentChunk(
        DocumentChunk.chunkId(metadata.service(), metadata.id(), position),
        content,
        metadata.service(),
        metadata.id(),
        headers,
        metadata.url(),
        position,
        Tokenizer.count(content));
  }
}
