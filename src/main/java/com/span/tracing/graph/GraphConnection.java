package com.span.tracing.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database that stores spans.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query, with {@code $name} parameter placeholders
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns results.
     *
     * @param query  the Cypher query, with {@code $name} parameter placeholders
     * @param params query parameters
     * @return list of result records as maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    @Override
    void close();
}
