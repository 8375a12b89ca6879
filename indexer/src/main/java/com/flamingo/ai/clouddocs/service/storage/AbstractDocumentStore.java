package com.flamingo.ai.clouddocs.service.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.clouddocs.exception.StorageException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/**
 * File-backed store of per-page documents laid out as {@code {base}/{service}/{id}.{ext}} with a
 * sibling {@code {id}.json} holding the metadata.
 *
 * @param <M> metadata type, serialized with Jackson
 * @param <D> document type
 */
@Slf4j
public abstract class AbstractDocumentStore<M, D> {

  static final String SUMMARY_FILE = "metadata.json";
  private static final String METADATA_EXTENSION = ".json";

  private final Path baseDir;
  private final String contentExtension;
  private final Class<M> metadataType;
  protected final ObjectMapper objectMapper;
  protected final Clock clock;

  protected AbstractDocumentStore(
      Path baseDir,
      String contentExtension,
      Class<M> metadataType,
      ObjectMapper objectMapper,
      Clock clock) {
    this.baseDir = baseDir;
    this.contentExtension = contentExtension;
    this.metadataType = metadataType;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  protected abstract String serviceOf(M metadata);

  protected abstract String idOf(M metadata);

  protected abstract M metadataOf(D document);

  protected abstract String contentOf(D document);

  protected abstract D assemble(M metadata, String content);

  /** Short label used in log messages. */
  protected abstract String label();

  public Path getBaseDir() {
    return baseDir;
  }

  /** Returns true if the content file of the page exists. */
  public boolean exists(String serviceCode, String pageId) {
    return Files.isRegularFile(contentPath(serviceCode, pageId));
  }

  /**
   * Writes the document content and its metadata, overwriting any previous version.
   *
   * @throws StorageException if either file cannot be written
   */
  public void saveDocument(D document) {
    M metadata = metadataOf(document);
    String service = serviceOf(metadata);
    String id = idOf(metadata);
    Path contentPath = contentPath(service, id);
    try {
      Files.createDirectories(contentPath.getParent());
      Files.writeString(contentPath, contentOf(document), StandardCharsets.UTF_8);
      objectMapper.writeValue(metadataPath(service, id).toFile(), metadata);
    } catch (IOException e) {
      throw new StorageException(
          contentPath.toString(), "Failed to save " + label() + " " + service + "/" + id, e);
    }
    log.debug("Saved {} {}/{} ({} chars)", label(), service, id, contentOf(document).length());
  }

  /**
   * Loads a document. Missing files yield an empty result; unreadable or malformed files are
   * logged and also yield an empty result.
   */
  public Optional<D> loadDocument(String serviceCode, String pageId) {
    Path contentPath = contentPath(serviceCode, pageId);
    Path metadataPath = metadataPath(serviceCode, pageId);
    if (!Files.isRegularFile(contentPath) || !Files.isRegularFile(metadataPath)) {
      return Optional.empty();
    }
    try {
      String content = Files.readString(contentPath, StandardCharsets.UTF_8);
      M metadata = objectMapper.readValue(metadataPath.toFile(), metadataType);
      return Optional.of(assemble(metadata, content));
    } catch (IOException e) {
      log.error(
          "Error loading {} {}/{}: {}", label(), serviceCode, pageId, e.getMessage());
      return Optional.empty();
    }
  }

  /** Loads every readable document of every service, in directory-name order. */
  public List<D> loadAllDocuments() {
    List<D> documents = new ArrayList<>();
    List<String> services = getServices();
    log.info("Loading {} documents from {} services...", label(), services.size());
    for (String service : services) {
      for (String pageId : getServiceDocuments(service)) {
        loadDocument(service, pageId).ifPresent(documents::add);
      }
    }
    log.info("Loaded {} {} documents", documents.size(), label());
    return documents;
  }

  /** Service codes with a directory in the store, sorted. */
  public List<String> getServices() {
    if (!Files.isDirectory(baseDir)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(baseDir)) {
      return entries
          .filter(Files::isDirectory)
          .map(path -> path.getFileName().toString())
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new StorageException(baseDir.toString(), "Failed to list " + label() + " store", e);
    }
  }

  /** Page ids stored for a service, sorted. */
  public List<String> getServiceDocuments(String serviceCode) {
    Path serviceDir = baseDir.resolve(serviceCode);
    if (!Files.isDirectory(serviceDir)) {
      return List.of();
    }
    try (Stream<Path> entries = Files.list(serviceDir)) {
      return entries
          .map(path -> path.getFileName().toString())
          .filter(name -> name.endsWith(contentExtension))
          .map(name -> name.substring(0, name.length() - contentExtension.length()))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new StorageException(
          serviceDir.toString(), "Failed to list " + label() + " documents of " + serviceCode, e);
    }
  }

  public int getTotalCount() {
    return getServices().stream().mapToInt(service -> getServiceDocuments(service).size()).sum();
  }

  public Map<String, Integer> getCountsByService() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String service : getServices()) {
      counts.put(service, getServiceDocuments(service).size());
    }
    return counts;
  }

  /** Writes {@code metadata.json} from the current contents of the store. */
  public StoreSummary saveSummary() {
    Map<String, Integer> counts = getCountsByService();
    int total = counts.values().stream().mapToInt(Integer::intValue).sum();
    StoreSummary summary = new StoreSummary(clock.instant(), counts.size(), total, counts);
    Path path = baseDir.resolve(SUMMARY_FILE);
    try {
      Files.createDirectories(baseDir);
      objectMapper.writeValue(path.toFile(), summary);
    } catch (IOException e) {
      throw new StorageException(path.toString(), "Failed to save " + label() + " summary", e);
    }
    return summary;
  }

  public Optional<StoreSummary> loadSummary() {
    Path path = baseDir.resolve(SUMMARY_FILE);
    if (!Files.isRegularFile(path)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(path.toFile(), StoreSummary.class));
    } catch (IOException e) {
      log.warn("Ignoring unreadable {} summary {}: {}", label(), path, e.getMessage());
      return Optional.empty();
    }
  }

  private Path contentPath(String serviceCode, String pageId) {
    return baseDir.resolve(serviceCode).resolve(pageId + contentExtension);
  }

  private Path metadataPath(String serviceCode, String pageId) {
    return baseDir.resolve(serviceCode).resolve(pageId + METADATA_EXTENSION);
  }
}
