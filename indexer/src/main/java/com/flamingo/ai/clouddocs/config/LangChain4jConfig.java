package com.flamingo.ai.clouddocs.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the LangChain4j embedding model. */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String openAiModelName;

  /**
   * Embedding model selected by {@code rag.embedding.provider}: the bundled quantized
   * all-MiniLM-L6-v2 ONNX model ({@code local}) or OpenAI ({@code openai}).
   */
  @Bean
  public EmbeddingModel embeddingModel(RagConfig ragConfig) {
    String provider = ragConfig.getEmbedding().getProvider().toLowerCase(Locale.ROOT);
    switch (provider) {
      case "local" -> {
        log.info("Using local embedding model {}", ragConfig.getEmbedding().getModelName());
        return new AllMiniLmL6V2QuantizedEmbeddingModel();
      }
      case "openai" -> {
        validateApiKey();
        log.info(
            "Using OpenAI embedding model {} ({} dimensions)",
            openAiModelName,
            ragConfig.getEmbedding().getDimension());
        return OpenAiEmbeddingModel.builder()
            .apiKey(openAiApiKey)
            .modelName(openAiModelName)
            .dimensions(ragConfig.getEmbedding().getDimension())
            .timeout(Duration.ofSeconds(30))
            .build();
      }
      default ->
          throw new IllegalStateException(
              "Unknown embedding provider '" + provider + "', expected 'local' or 'openai'");
    }
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
