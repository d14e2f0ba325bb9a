package com.records.resolution.graph;

import java.util.List;
import java.util.Map;

/**
 * Interface for graph database connection management.
 * Abstracts the underlying graph database implementation.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher query that modifies the graph.
     *
     * @param query  the Cypher query
     * @param params query parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns results.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return list of result records as maps
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    /**
     * Checks if the connection is alive.
     */
    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes entity resolution relies on, if they don't exist.
     */
    void createIndexes();

    /**
     * Closes the connection. Narrowed from {@link AutoCloseable#close()} to throw no checked exception.
     */
    @Override
    void close();
}
