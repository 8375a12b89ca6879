package com.flamingo.ai.clouddocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Command-line indexer for cloud provider documentation.
 *
 * <p>Crawls service documentation into local stores, chunks and embeds it into a vector index,
 * and answers or evaluates similarity queries against that index. The command is the first
 * non-option argument, see {@link com.flamingo.ai.clouddocs.cli.IndexerCommandRunner}.
 */
@SpringBootApplication
public class CloudDocsIndexerApplication {

  public static void main(String[] args) {
    ConfigurableApplicationContext context =
        SpringApplication.run(CloudDocsIndexerApplication.class, args);
    System.exit(SpringApplication.exit(context));
  }
}
