package com.flamingo.ai.clouddocs.vectorstore;

import static com.flamingo.ai.clouddocs.support.TestDocuments.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.JsonConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LocalVectorStore Tests")
class LocalVectorStoreTest {

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = JsonConfig.storageObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private LocalVectorStore store;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    store = newStore(3);
    store.initialize();
  }

  private LocalVectorStore newStore(int dimension) {
    return new LocalVectorStore(tempDir, "huawei_docs", dimension, 4, objectMapper, meterRegistry);
  }

  private void add(DocumentChunk chunk, float... vector) {
    store.addChunks(List.of(chunk), Map.of(chunk.id(), vector));
  }

  @Nested
  @DisplayName("search")
  class Search {

    @Test
    @DisplayName("Should rank by descending cosine similarity")
    void shouldRankByCosine() {
      add(chunk("ecs", "a", 0, "east"), 0f, 1f, 0f);
      add(chunk("ecs", "b", 0, "north"), 1f, 0f, 0f);
      add(chunk("ecs", "c", 0, "north-east"), 0.7071f, 0.7071f, 0f);

      List<SearchResult> results = store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(3));

      assertThat(results)
          .extracting(r -> r.chunk().pageId())
          .containsExactly("b", "c", "a");
      assertThat(results.get(0).score()).isCloseTo(1.0, within(1e-6));
      assertThat(results.get(0).distance()).isCloseTo(0.0, within(1e-6));
      assertThat(results.get(2).score()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    @DisplayName("Should keep insertion order for equal scores")
    void shouldBreakTiesByInsertionOrder() {
      Map<String, float[]> vectors = new LinkedHashMap<>();
      List<DocumentChunk> chunks =
          List.of(chunk("ecs", "p", 0, "x"), chunk("ecs", "p", 1, "y"), chunk("ecs", "p", 2, "z"));
      chunks.forEach(c -> vectors.put(c.id(), new float[] {0f, 0f, 1f}));
      store.addChunks(chunks, vectors);

      List<SearchResult> results = store.search(new float[] {0f, 0f, 1f}, SearchOptions.of(3));

      assertThat(results).extracting(r -> r.chunk().position()).containsExactly(0, 1, 2);
    }

    @Test
    @DisplayName("Should filter by service before ranking")
    void shouldFilterByService() {
      add(chunk("ecs", "a", 0, "best"), 1f, 0f, 0f);
      add(chunk("obs", "b", 0, "worse"), 0f, 1f, 0f);
      add(chunk("obs", "c", 0, "worst"), -1f, 0f, 0f);

      List<SearchResult> results =
          store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(1).withService("obs"));

      assertThat(results).extracting(r -> r.chunk().pageId()).containsExactly("b");
    }

    @Test
    @DisplayName("Should clamp topK to the configured maximum")
    void shouldClampTopK() {
      for (int i = 0; i < 6; i++) {
        add(chunk("ecs", "p" + i, 0, "c"), 1f, i, 0f);
      }

      assertThat(store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(50))).hasSize(4);
      assertThat(store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(0))).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a query of the wrong dimension")
    void shouldRejectWrongDimension() {
      assertThatThrownBy(() -> store.search(new float[] {1f, 0f}, SearchOptions.of(1)))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("expected 3, got 2");
    }

    @Test
    @DisplayName("Should return nothing from an empty collection")
    void shouldHandleEmptyCollection() {
      assertThat(store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(5))).isEmpty();
    }
  }

  @Nested
  @DisplayName("addChunks")
  class AddChunks {

    @Test
    @DisplayName("Should skip chunks without an embedding")
    void shouldSkipMissingEmbeddings() {
      DocumentChunk first = chunk("ecs", "p", 0, "a");
      DocumentChunk second = chunk("ecs", "p", 1, "b");

      int added = store.addChunks(List.of(first, second), Map.of(first.id(), new float[3]));

      assertThat(added).isEqualTo(1);
      assertThat(store.getStats().count()).isEqualTo(1);
      assertThat(meterRegistry.counter("vectorstore.chunks.added", "type", "local").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should replace a chunk with the same id")
    void shouldReplaceById() {
      add(chunk("ecs", "p", 0, "old"), 1f, 0f, 0f);
      add(chunk("ecs", "p", 0, "new"), 1f, 0f, 0f);

      assertThat(store.getStats().count()).isEqualTo(1);
      List<SearchResult> results = store.search(new float[] {1f, 0f, 0f}, SearchOptions.of(1));
      assertThat(results.get(0).chunk().content()).isEqualTo("new");
    }

    @Test
    @DisplayName("Should reject vectors of the wrong dimension")
    void shouldRejectWrongDimension() {
      DocumentChunk chunk = chunk("ecs", "p", 0, "a");

      assertThatThrownBy(() -> store.addChunks(List.of(chunk), Map.of(chunk.id(), new float[4])))
          .isInstanceOf(SearchException.class);
    }
  }

  @Nested
  @DisplayName("Persistence")
  class Persistence {

    @Test
    @DisplayName("Should reload the collection in a new instance")
    void shouldReloadCollection() {
      add(chunk("ecs", "a", 0, "first"), 1f, 0f, 0f);
      add(chunk("vpc", "b", 0, "second"), 0f, 1f, 0f);
      store.flush();

      LocalVectorStore reopened = newStore(3);
      reopened.initialize();

      VectorStoreStats stats = reopened.getStats();
      assertThat(stats.count()).isEqualTo(2);
      assertThat(stats.collectionName()).isEqualTo("huawei_docs");
      assertThat(stats.dimension()).isEqualTo(3);
      assertThat(stats.type()).isEqualTo("local");
      List<SearchResult> results = reopened.search(new float[] {0f, 1f, 0f}, SearchOptions.of(1));
      assertThat(results.get(0).chunk()).isEqualTo(chunk("vpc", "b", 0, "second"));
      assertThat(tempDir.resolve("huawei_docs.json")).exists();
    }

    @Test
    @DisplayName("Should write the collection file only on flush")
    void shouldWriteOnlyOnFlush() throws Exception {
      Path file = tempDir.resolve("huawei_docs.json");
      add(chunk("ecs", "a", 0, "first"), 1f, 0f, 0f);
      add(chunk("ecs", "b", 0, "second"), 0f, 1f, 0f);

      assertThat(file).doesNotExist();
      assertThat(store.search(new float[] {0f, 1f, 0f}, SearchOptions.of(1)))
          .extracting(r -> r.chunk().pageId())
          .containsExactly("b");

      store.flush();
      assertThat(file).exists();
      Files.setLastModifiedTime(file, FileTime.fromMillis(0));
      store.flush();

      assertThat(Files.getLastModifiedTime(file)).isEqualTo(FileTime.fromMillis(0));
      LocalVectorStore reopened = newStore(3);
      reopened.initialize();
      assertThat(reopened.getStats().count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should refuse to open a collection of another dimension")
    void shouldRejectDimensionChange() {
      add(chunk("ecs", "a", 0, "first"), 1f, 0f, 0f);
      store.flush();

      LocalVectorStore reopened = newStore(384);

      assertThatThrownBy(reopened::initialize)
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("has dimension 3");
    }

    @Test
    @DisplayName("Should remove the collection file on clear")
    void shouldClear() {
      add(chunk("ecs", "a", 0, "first"), 1f, 0f, 0f);
      store.flush();

      store.clear();

      assertThat(store.getStats().count()).isZero();
      assertThat(tempDir.resolve("huawei_docs.json")).doesNotExist();
      LocalVectorStore reopened = newStore(3);
      reopened.initialize();
      assertThat(reopened.getStats().count()).isZero();
    }
  }
}
