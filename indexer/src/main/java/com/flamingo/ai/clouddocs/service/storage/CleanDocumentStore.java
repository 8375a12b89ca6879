package com.flamingo.ai.clouddocs.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.CrawlerConfig;
import com.flamingo.ai.clouddocs.domain.model.CleanDocument;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Normalized markdown, stored as {@code {service}/{id}.md} with page metadata. */
@Component
public class CleanDocumentStore
    extends AbstractDocumentStore<CleanDocument.Metadata, CleanDocument> {

  @Autowired
  public CleanDocumentStore(CrawlerConfig crawlerConfig, ObjectMapper objectMapper, Clock clock) {
    this(Path.of(crawlerConfig.getStorage().getCleanDir()), objectMapper, clock);
  }

  public CleanDocumentStore(Path baseDir, ObjectMapper objectMapper, Clock clock) {
    super(baseDir, ".md", CleanDocument.Metadata.class, objectMapper, clock);
  }

  @Override
  protected String serviceOf(CleanDocument.Metadata metadata) {
    return metadata.service();
  }

  @Override
  protected String idOf(CleanDocument.Metadata metadata) {
    return metadata.id();
  }

  @Override
  protected CleanDocument.Metadata metadataOf(CleanDocument document) {
    return document.metadata();
  }

  @Override
  protected String contentOf(CleanDocument document) {
    return document.content();
  }

  @Override
  protected CleanDocument assemble(CleanDocument.Metadata metadata, String content) {
    return new CleanDocument(metadata, content);
  }

  @Override
  protected String label() {
    return "clean";
  }
}
