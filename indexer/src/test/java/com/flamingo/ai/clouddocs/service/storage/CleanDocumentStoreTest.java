package com.flamingo.ai.clouddocs.service.storage;

import static com.flamingo.ai.clouddocs.support.TestDocuments.cleanDocument;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.clouddocs.config.JsonConfig;
import com.flamingo.ai.clouddocs.domain.enums.DocumentCategory;
import com.flamingo.ai.clouddocs.domain.model.CleanDocument;
import com.flamingo.ai.clouddocs.support.MutableClock;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CleanDocumentStore Tests")
class CleanDocumentStoreTest {

  @TempDir Path tempDir;

  private CleanDocumentStore store;

  @BeforeEach
  void setUp() {
    store =
        new CleanDocumentStore(
            tempDir.resolve("clean_docs"),
            JsonConfig.storageObjectMapper(),
            MutableClock.at("2025-01-20T00:00:00Z"));
  }

  @Test
  @DisplayName("Should lay out content and metadata side by side")
  void shouldWriteSiblingFiles() {
    store.saveDocument(cleanDocument("ecs", "ecs_03_0001", "# Creating an ECS\n\nBody"));

    Path serviceDir = tempDir.resolve("clean_docs/ecs");
    assertThat(serviceDir.resolve("ecs_03_0001.md")).hasContent("# Creating an ECS\n\nBody");
    assertThat(serviceDir.resolve("ecs_03_0001.json")).exists();
    assertThat(store.exists("ecs", "ecs_03_0001")).isTrue();
  }

  @Test
  @DisplayName("Should load what it saved")
  void shouldLoadSavedDocument() {
    CleanDocument document = cleanDocument("ecs", "intro", "Some markdown");
    store.saveDocument(document);

    Optional<CleanDocument> loaded = store.loadDocument("ecs", "intro");

    assertThat(loaded).contains(document);
    assertThat(loaded.get().metadata().category()).isEqualTo(DocumentCategory.USER_GUIDE);
    assertThat(loaded.get().metadata().processedAt())
        .isEqualTo(Instant.parse("2025-01-15T12:00:00Z"));
  }

  @Test
  @DisplayName("Should return empty for missing or corrupt documents")
  void shouldReturnEmptyForMissingOrCorrupt() throws IOException {
    assertThat(store.loadDocument("ecs", "nope")).isEmpty();

    store.saveDocument(cleanDocument("ecs", "broken", "text"));
    Files.writeString(tempDir.resolve("clean_docs/ecs/broken.json"), "{oops");

    assertThat(store.loadDocument("ecs", "broken")).isEmpty();
  }

  @Test
  @DisplayName("Should list services and documents in sorted order")
  void shouldListServicesAndDocuments() {
    store.saveDocument(cleanDocument("vpc", "b", "x"));
    store.saveDocument(cleanDocument("ecs", "z", "x"));
    store.saveDocument(cleanDocument("ecs", "a", "x"));

    assertThat(store.getServices()).containsExactly("ecs", "vpc");
    assertThat(store.getServiceDocuments("ecs")).containsExactly("a", "z");
    assertThat(store.getServiceDocuments("missing")).isEmpty();
    assertThat(store.getTotalCount()).isEqualTo(3);
    assertThat(store.loadAllDocuments()).hasSize(3);
  }

  @Test
  @DisplayName("Should overwrite an existing document")
  void shouldOverwrite() {
    store.saveDocument(cleanDocument("ecs", "a", "old"));
    store.saveDocument(cleanDocument("ecs", "a", "new"));

    assertThat(store.loadDocument("ecs", "a")).map(CleanDocument::content).contains("new");
    assertThat(store.getTotalCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should write and read the store summary")
  void shouldWriteSummary() {
    store.saveDocument(cleanDocument("ecs", "a", "x"));
    store.saveDocument(cleanDocument("ecs", "b", "x"));
    store.saveDocument(cleanDocument("obs", "c", "x"));

    StoreSummary summary = store.saveSummary();

    assertThat(summary.totalServices()).isEqualTo(2);
    assertThat(summary.totalDocuments()).isEqualTo(3);
    assertThat(summary.services()).containsEntry("ecs", 2).containsEntry("obs", 1);
    assertThat(summary.timestamp()).isEqualTo(Instant.parse("2025-01-20T00:00:00Z"));
    assertThat(store.loadSummary()).contains(summary);
    assertThat(store.getServices()).containsExactly("ecs", "obs");
  }

  @Test
  @DisplayName("Should report an empty store when the directory does not exist")
  void shouldHandleMissingBaseDir() {
    assertThat(store.getServices()).isEmpty();
    assertThat(store.getTotalCount()).isZero();
    assertThat(store.loadSummary()).isEmpty();
  }
}
