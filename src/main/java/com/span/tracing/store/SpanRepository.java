package com.span.tracing.store;

import java.util.List;

/**
 * Durable storage for ended spans.
 * Implementations provide different storage backends (in-memory, JDBC, graph DB).
 */
public interface SpanRepository {

    /**
     * Writes a batch of spans as one unit. Records whose id is already stored are
     * skipped, so writing the same batch twice is safe.
     *
     * @return the number of records actually inserted
     * @throws SpanStorageException if the batch could not be written; nothing of
     *                              the batch is stored in that case
     */
    int saveAll(List<SpanRecord> records);

    /**
     * Reads stored spans matching the query, newest first.
     *
     * @throws SpanStorageException if the store cannot be read
     */
    List<SpanRecord> query(SpanQuery query);

    /**
     * Gets the total number of stored spans.
     */
    int count();
}
