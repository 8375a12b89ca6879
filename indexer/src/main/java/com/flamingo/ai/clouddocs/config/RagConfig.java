package com.flamingo.ai.clouddocs.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for chunking, embedding and retrieval. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private VectorStore vectorStore = new VectorStore();
  private Retrieval retrieval = new Retrieval();
  private Evaluation evaluation = new Evaluation();
  private String logsDir = "logs";

  @Getter
  @Setter
  public static class Chunking {
    private int targetSize = 500;
    private int maxSize = 1000;
    private int minSize = 100;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Either "local" (bundled ONNX model) or "openai". */
    private String provider = "local";

    private String modelName = "all-MiniLM-L6-v2-q";
    private int dimension = 384;
    private int batchSize = 64;
    private int maxBatchSize = 128;

    /** Chunks are truncated to this many whitespace tokens before encoding. */
    private int maxTokens = 512;
  }

  @Getter
  @Setter
  public static class VectorStore {
    /** Either "local" or "elasticsearch". */
    private String type = "local";

    private String collectionName = "huawei_docs";
    private String indexDir = "rag_cache/vector_index";
    private String distanceMetric = "cosine";
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 5;
    private int maxTopK = 20;
    private Hybrid hybrid = new Hybrid();
  }

  /** Keyword and service re-ranking applied on top of the vector search. */
  @Getter
  @Setter
  public static class Hybrid {
    /** Vector candidates fetched per requested result, still bounded by max-top-k. */
    private int candidatesMultiplier = 5;

    private double vectorWeight = 0.7;
    private double keywordWeight = 0.3;
    private String thesaurusResource = "retrieval/thesaurus.json";
  }

  @Getter
  @Setter
  public static class Evaluation {
    private String queriesResource = "evaluation/test-queries.json";

    /** Fraction of failing queries above which the run is reported as failed. */
    private double failureThreshold = 0.5;
  }
}
