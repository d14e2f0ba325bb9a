package com.records.resolution.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import com.records.resolution.core.model.IdentifierKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-specific implementation using the JFalkorDB client.
 * Parameters are passed to the driver, which binds them as a {@code CYPHER} prefix.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this(FalkorDB.driver(host, port), graphName);
    }

    FalkorDBConnection(Driver driver, String graphName) {
        this.driver = driver;
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB connection initialized for graph: {}", graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("Executing: {}", query);
        run(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("Querying: {}", query);

        ResultSet resultSet = run(query, params);
        List<Map<String, Object>> results = new ArrayList<>();

        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            results.add(row);
        }

        log.debug("Query returned {} results", results.size());
        return results;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Connection check failed", e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("Creating indexes for entity resolution...");

        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.id)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.nameKey)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.type)");
        safeExecute("CREATE INDEX FOR (e:Entity) ON (e.createdAt)");
        for (IdentifierKind kind : IdentifierKind.values()) {
            safeExecute("CREATE INDEX FOR (e:Entity) ON (e." + kind.getAttributeKey() + ")");
        }

        log.info("Index creation complete");
    }

    private ResultSet run(String query, Map<String, Object> params) {
        if (params == null || params.isEmpty()) {
            return graph.query(query);
        }
        return graph.query(query, params);
    }

    private void safeExecute(String query) {
        try {
            graph.query(query);
        } catch (Exception e) {
            // Index might already exist
            log.debug("Index creation query result: {} - {}", query, e.getMessage());
        }
    }

    @Override
    public void close() {
        if (driver != null) {
            try {
                driver.close();
            } catch (Exception e) {
                log.warn("Error closing FalkorDB connection", e);
            }
        }
        log.info("FalkorDB connection closed");
    }
}
