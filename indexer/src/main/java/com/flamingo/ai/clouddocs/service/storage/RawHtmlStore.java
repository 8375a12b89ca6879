package com.flamingo.ai.clouddocs.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.RawHtmlDocument;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Raw page markup, stored as {@code {service}/{id}.html} with response metadata. */
@Component
public class RawHtmlStore extends AbstractDocumentStore<RawHtmlDocument.Metadata, RawHtmlDocument> {

  @Autowired
  public RawHtmlStore(CrawlerConfig crawlerConfig, ObjectMapper objectMapper, Clock clock) {
    this(Path.of(crawlerConfig.getStorage().getRawDir()), objectMapper, clock);
  }

  public RawHtmlStore(Path baseDir, ObjectMapper objectMapper, Clock clock) {
    super(baseDir, ".html", RawHtmlDocument.Metadata.class, objectMapper, clock);
  }

  @Override
  protected String serviceOf(RawHtmlDocument.Metadata metadata) {
    return metadata.service();
  }

  @Override
  protected String idOf(RawHtmlDocument.Metadata metadata) {
    return metadata.id();
  }

  @Override
  protected RawHtmlDocument.Metadata metadataOf(RawHtmlDocument document) {
    return document.metadata();
  }

  @Override
  protected String contentOf(RawHtmlDocument document) {
    return document.html();
  }

  @Override
  protected RawHtmlDocument assemble(RawHtmlDocument.Metadata metadata, String content) {
    return new RawHtmlDocument(metadata, content);
  }

  @Override
  protected String label() {
    return "raw";
  }
}
