package com.flamingo.ai.clouddocs.service.rag.ingest;

import static com.flamingo.ai.clouddocs.support.TestDocuments.cleanDocument;
import static com.flamingo.ai.clouddocs.support.TestDocuments.words;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.config.JsonConfig;
import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.domain.model.DocumentChunk;
import com.flamingo.ai.clouddocs.exception.EmbeddingException;
import com.flamingo.ai.clouddocs.service.rag.chunking.ChunkingOptions;
import com.flamingo.ai.clouddocs.service.rag.chunking.SemanticChunker;
import com.flamingo.ai.clouddocs.service.rag.embedding.ChunkEmbedder;
import com.flamingo.ai.clouddocs.service.storage.CleanDocumentStore;
import com.flamingo.ai.clouddocs.support.MutableClock;
import com.flamingo.ai.clouddocs.vectorstore.LocalVectorStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.stubbing.Answer;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

  @TempDir Path tempDir;

  @Mock private ChunkEmbedder embedder;

  private final ObjectMapper objectMapper = JsonConfig.storageObjectMapper();
  private SimpleMeterRegistry meterRegistry;
  private RagConfig ragConfig;
  private CleanDocumentStore cleanStore;
  private LocalVectorStore vectorStore;
  private IngestionService ingestionService;
  private Path logsDir;

  @BeforeEach
  void setUp() {
    MutableClock clock = MutableClock.at("2025-04-01T00:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
    ragConfig = new RagConfig();
    logsDir = tempDir.resolve("logs");
    ragConfig.setLogsDir(logsDir.toString());
    cleanStore = new CleanDocumentStore(tempDir.resolve("clean"), objectMapper, clock);
    vectorStore =
        new LocalVectorStore(
            tempDir.resolve("index"), "huawei_docs", 3, 20, objectMapper, meterRegistry);
    ingestionService =
        new IngestionService(
            cleanStore,
            new SemanticChunker(ChunkingOptions.DEFAULT),
            embedder,
            vectorStore,
            ragConfig,
            objectMapper,
            meterRegistry,
            clock);
  }

  private static Answer<Map<String, float[]>> unitVectors() {
    return invocation -> {
      List<DocumentChunk> chunks = invocation.getArgument(0);
      Map<String, float[]> vectors = new LinkedHashMap<>();
      for (DocumentChunk chunk : chunks) {
        vectors.put(chunk.id(), new float[] {1f, 0f, 0f});
      }
      return vectors;
    };
  }

  private static String paragraphs(int count, int tokensEach) {
    return IntStream.range(0, count)
        .mapToObj(i -> words("p" + i + "w", tokensEach))
        .collect(Collectors.joining("\n\n"));
  }

  private void storeSyntheticService() {
    cleanStore.saveDocument(cleanDocument("svc", "page1", words("a", 50)));
    cleanStore.saveDocument(cleanDocument("svc", "page2", paragraphs(2, 300)));
    cleanStore.saveDocument(cleanDocument("svc", "page3", paragraphs(5, 300)));
  }

  @Test
  @DisplayName("Should index every chunk of a synthetic service")
  void shouldIndexSyntheticService() throws IOException {
    storeSyntheticService();
    when(embedder.embedChunks(anyList(), anyInt())).thenAnswer(unitVectors());

    IngestionStats stats = ingestionService.ingest(IngestionOptions.defaults());

    assertThat(stats.totalDocuments()).isEqualTo(3);
    assertThat(stats.processedDocuments()).isEqualTo(3);
    assertThat(stats.failedDocuments()).isZero();
    assertThat(stats.totalChunks()).isEqualTo(3);
    assertThat(stats.collectionSize()).isEqualTo(3);
    assertThat(stats.dryRun()).isFalse();
    assertThat(meterRegistry.counter("ingestion.chunks.indexed").count()).isEqualTo(3.0);

    JsonNode written = objectMapper.readTree(logsDir.resolve(IngestionService.STATS_FILE).toFile());
    assertThat(written.get("totalChunks").asLong()).isEqualTo(3);
    assertThat(logsDir.resolve(IngestionService.ERRORS_FILE)).doesNotExist();
  }

  @Test
  @DisplayName("Should only count documents in a dry run")
  void shouldEstimateInDryRun() {
    storeSyntheticService();
    cleanStore.saveDocument(cleanDocument("obs", "page", words("o", 200)));

    IngestionStats stats = ingestionService.ingest(new IngestionOptions(false, true, null));

    assertThat(stats.dryRun()).isTrue();
    assertThat(stats.totalDocuments()).isEqualTo(4);
    assertThat(stats.totalChunks()).isEqualTo(10);
    assertThat(stats.collectionSize()).isEqualTo(-1);
    assertThat(logsDir).doesNotExist();
    verifyNoInteractions(embedder);
  }

  @Test
  @DisplayName("Should record a failing document and continue")
  void shouldContinueAfterFailure() throws IOException {
    storeSyntheticService();
    when(embedder.embedChunks(anyList(), anyInt()))
        .thenAnswer(
            invocation -> {
              List<DocumentChunk> chunks = invocation.getArgument(0);
              if (chunks.get(0).pageId().equals("page2")) {
                throw new EmbeddingException("model offline");
              }
              return unitVectors().answer(invocation);
            });

    IngestionStats stats = ingestionService.ingest(IngestionOptions.defaults());

    assertThat(stats.processedDocuments()).isEqualTo(2);
    assertThat(stats.failedDocuments()).isEqualTo(1);
    assertThat(stats.totalChunks()).isEqualTo(2);
    assertThat(stats.errors()).containsExactly("svc/page2: model offline");
    assertThat(meterRegistry.counter("ingestion.documents.failed").count()).isEqualTo(1.0);
    assertThat(Files.readString(logsDir.resolve(IngestionService.ERRORS_FILE)))
        .isEqualTo("svc/page2: model offline");
  }

  @Test
  @DisplayName("Should write the index once at the end of the run")
  void shouldFlushIndexOnce() {
    storeSyntheticService();
    when(embedder.embedChunks(anyList(), anyInt())).thenAnswer(unitVectors());
    LocalVectorStore spiedStore = spy(vectorStore);
    IngestionService service =
        new IngestionService(
            cleanStore,
            new SemanticChunker(ChunkingOptions.DEFAULT),
            embedder,
            spiedStore,
            ragConfig,
            objectMapper,
            meterRegistry,
            MutableClock.at("2025-04-01T00:00:00Z"));

    service.ingest(IngestionOptions.defaults());

    verify(spiedStore, times(2)).addChunks(anyList(), anyMap());
    verify(spiedStore, times(1)).flush();
    assertThat(tempDir.resolve("index").resolve("huawei_docs.json")).exists();
    LocalVectorStore reopened =
        new LocalVectorStore(
            tempDir.resolve("index"), "huawei_docs", 3, 20, objectMapper, meterRegistry);
    reopened.initialize();
    assertThat(reopened.getStats().count()).isEqualTo(3);
  }

  @Test
  @DisplayName("Should count an unreadable document as failed")
  void shouldFailUnreadableDocument() throws IOException {
    cleanStore.saveDocument(cleanDocument("svc", "broken", words("b", 200)));
    Files.writeString(tempDir.resolve("clean/svc/broken.json"), "{");

    IngestionStats stats = ingestionService.ingest(IngestionOptions.defaults());

    assertThat(stats.failedDocuments()).isEqualTo(1);
    assertThat(stats.errors()).singleElement().asString().startsWith("svc/broken: ");
    verifyNoInteractions(embedder);
  }

  @Test
  @DisplayName("Should clear the collection first when asked")
  void shouldClearCollection() {
    DocumentChunk stale =
        new DocumentChunk("old_x_chunk0", "stale", "old", "x", List.of(), null, 0, 1);
    vectorStore.addChunks(List.of(stale), Map.of(stale.id(), new float[] {0f, 1f, 0f}));
    cleanStore.saveDocument(cleanDocument("svc", "page", words("a", 150)));
    when(embedder.embedChunks(anyList(), anyInt())).thenAnswer(unitVectors());

    IngestionStats stats = ingestionService.ingest(new IngestionOptions(true, false, null));

    assertThat(stats.collectionSize()).isEqualTo(1);
  }

  @Test
  @DisplayName("Should pass the requested batch size to the embedder")
  void shouldUseBatchSize() {
    cleanStore.saveDocument(cleanDocument("svc", "page", words("a", 150)));
    when(embedder.embedChunks(anyList(), anyInt())).thenAnswer(unitVectors());

    ingestionService.ingest(new IngestionOptions(false, false, 7));
    ingestionService.ingest(IngestionOptions.defaults());

    verify(embedder).embedChunks(argThat(chunks -> chunks.size() == 1), eq(7));
    verify(embedder).embedChunks(anyList(), eq(ragConfig.getEmbedding().getBatchSize()));
  }
}
