package com.flamingo.ai.clouddocs.vectorstore;

/**
 * Size and shape of a collection.
 *
 * @param collectionName collection or index name
 * @param count number of stored chunks
 * @param dimension embedding dimension
 * @param type store implementation, {@code local} or {@code elasticsearch}
 */
public record VectorStoreStats(String collectionName, long count, int dimension, String type) {}
