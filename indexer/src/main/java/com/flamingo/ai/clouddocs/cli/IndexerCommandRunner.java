package com.flamingo.ai.clouddocs.cli;

import com.flamingo.ai.clouddocs.config.RagConfig;
import com.flamingo.ai.clouddocs.service.crawl.CrawlOptions;
import com.flamingo.ai.clouddocs.service.crawl.CrawlReport;
import com.flamingo.ai.clouddocs.service.crawl.DocumentCrawler;
import com.flamingo.ai.clouddocs.service.rag.evaluation.EvaluationOptions;
import com.flamingo.ai.clouddocs.service.rag.evaluation.EvaluationReport;
import com.flamingo.ai.clouddocs.service.rag.evaluation.RetrievalEvaluator;
import com.flamingo.ai.clouddocs.service.rag.ingest.IngestionOptions;
import com.flamingo.ai.clouddocs.service.rag.ingest.IngestionService;
import com.flamingo.ai.clouddocs.service.rag.query.OutputFormat;
import com.flamingo.ai.clouddocs.service.rag.query.QueryService;
import com.flamingo.ai.clouddocs.vectorstore.VectorStore;
import com.google.common.annotations.VisibleForTesting;
import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

/**
 * Dispatches the command named by the first non-option argument.
 *
 * <p>Exit codes: 0 on success or when no command is given, 1 for usage errors, fatal errors and
 * evaluations whose failures exceed the configured threshold.
 */
@Component
@Slf4j
public class IndexerCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final String USAGE =
      """
      Usage: <command> [options]

        crawl         [--services=a,b] [--force] [--max-pages=N] [--skip-failed]
        retry-failed
        ingest        [--clear] [--dry-run] [--batch-size=N]
        query         [--q=text] [--top-k=N] [--service=code] [--format=table|json|compact]
                      [--interactive] [--hybrid]
        evaluate      [--top-k=N] [--query-id=id] [--save-results] [--hybrid]

      Any command accepts --verbose for debug logging.""";

  private static final String BASE_PACKAGE = "com.flamingo.ai.clouddocs";

  private final DocumentCrawler documentCrawler;
  private final IngestionService ingestionService;
  private final QueryService queryService;
  private final RetrievalEvaluator retrievalEvaluator;
  private final VectorStore vectorStore;
  private final RagConfig ragConfig;
  private final LoggingSystem loggingSystem;
  private final InputStream in;
  private final PrintStream out;

  private int exitCode;

  @Autowired
  public IndexerCommandRunner(
      DocumentCrawler documentCrawler,
      IngestionService ingestionService,
      QueryService queryService,
      RetrievalEvaluator retrievalEvaluator,
      VectorStore vectorStore,
      RagConfig ragConfig,
      LoggingSystem loggingSystem) {
    this(
        documentCrawler,
        ingestionService,
        queryService,
        retrievalEvaluator,
        vectorStore,
        ragConfig,
        loggingSystem,
        System.in,
        System.out);
  }

  /** Constructor for testing - allows replacing the console streams. */
  @VisibleForTesting
  IndexerCommandRunner(
      DocumentCrawler documentCrawler,
      IngestionService ingestionService,
      QueryService queryService,
      RetrievalEvaluator retrievalEvaluator,
      VectorStore vectorStore,
      RagConfig ragConfig,
      LoggingSystem loggingSystem,
      InputStream in,
      PrintStream out) {
    this.documentCrawler = documentCrawler;
    this.ingestionService = ingestionService;
    this.queryService = queryService;
    this.retrievalEvaluator = retrievalEvaluator;
    this.vectorStore = vectorStore;
    this.ragConfig = ragConfig;
    this.loggingSystem = loggingSystem;
    this.in = in;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (commands.isEmpty()) {
      log.info("No command given\n{}", USAGE);
      exitCode = 0;
      return;
    }
    if (args.containsOption("verbose")) {
      loggingSystem.setLogLevel(BASE_PACKAGE, LogLevel.DEBUG);
    }

    String command = commands.get(0).toLowerCase(Locale.ROOT);
    try {
      exitCode =
          switch (command) {
            case "crawl" -> crawl(args);
            case "retry-failed" -> retryFailed();
            case "ingest" -> ingest(args);
            case "query" -> query(args);
            case "evaluate" -> evaluate(args);
            default -> throw new UsageException("Unknown command: " + command);
          };
    } catch (UsageException | IllegalArgumentException e) {
      log.error("{}\n{}", e.getMessage(), USAGE);
      exitCode = 1;
    } catch (RuntimeException e) {
      log.error("Command {} failed: {}", command, e.getMessage(), e);
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private int crawl(ApplicationArguments args) {
    List<String> services =
        stringOption(args, "services")
            .map(
                value ->
                    Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList())
            .orElse(List.of());
    CrawlOptions options =
        new CrawlOptions(
            services,
            args.containsOption("force"),
            intOption(args, "max-pages"),
            args.containsOption("skip-failed"));
    CrawlReport report = documentCrawler.crawl(options);
    log.info(
        "Crawl finished: {} pages from {} services, {} failed",
        report.totalPages(),
        report.totalServices(),
        report.failedPages().size());
    return 0;
  }

  private int retryFailed() {
    CrawlReport report = documentCrawler.retryFailed();
    log.info(
        "Retry finished: {} pages recovered, {} still failing",
        report.totalPages(),
        report.failedPages().size());
    return 0;
  }

  private int ingest(ApplicationArguments args) {
    ingestionService.ingest(
        new IngestionOptions(
            args.containsOption("clear"),
            args.containsOption("dry-run"),
            intOption(args, "batch-size")));
    return 0;
  }

  private int query(ApplicationArguments args) {
    Integer topK = intOption(args, "top-k");
    String service = stringOption(args, "service").orElse(null);
    OutputFormat format = OutputFormat.fromString(stringOption(args, "format").orElse(null));
    boolean hybrid = args.containsOption("hybrid");
    vectorStore.initialize();

    Optional<String> text = stringOption(args, "q");
    if (text.isPresent()) {
      queryService.runQuery(text.get(), topK, service, hybrid, format, out);
      if (!args.containsOption("interactive")) {
        return 0;
      }
    }
    BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    queryService.interactive(reader, out, topK, service, hybrid, format);
    return 0;
  }

  private int evaluate(ApplicationArguments args) {
    Integer topK = intOption(args, "top-k");
    vectorStore.initialize();
    EvaluationReport report =
        retrievalEvaluator.evaluate(
            new EvaluationOptions(
                topK != null ? topK : ragConfig.getRetrieval().getDefaultTopK(),
                stringOption(args, "query-id").orElse(null),
                args.containsOption("save-results"),
                args.containsOption("hybrid")));
    return report.tooManyFailures() ? 1 : 0;
  }

  static Optional<String> stringOption(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return Optional.empty();
    }
    String value = values.get(values.size() - 1);
    if (value == null || value.isBlank()) {
      throw new UsageException("Option --" + name + " requires a value");
    }
    return Optional.of(value.trim());
  }

  static Integer intOption(ApplicationArguments args, String name) {
    return stringOption(args, name)
        .map(
            value -> {
              try {
                return Integer.parseInt(value);
              } catch (NumberFormatException e) {
                throw new UsageException(
                    "Option --" + name + " expects a number, got '" + value + "'", e);
              }
            })
        .orElse(null);
  }
}
