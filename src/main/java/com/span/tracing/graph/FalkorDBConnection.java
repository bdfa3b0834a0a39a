package com.span.tracing.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB-specific implementation using JFalkorDB client.
 * Creates the {@code :Span} indexes used by span queries on construction.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("FalkorDB span graph connection initialized: {}", graphName);
        createSpanIndexes();
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        String bound = CypherParameters.bind(query, params);
        log.debug("Executing: {}", bound);
        graph.query(bound);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        String bound = CypherParameters.bind(query, params);
        log.debug("Querying: {}", bound);

        ResultSet resultSet = graph.query(bound);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("Span graph connection check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    private void createSpanIndexes() {
        for (String property : List.of("id", "traceId", "projectId", "name", "startTime")) {
            String statement = "CREATE INDEX FOR (s:Span) ON (s." + property + ")";
            try {
                graph.query(statement);
            } catch (Exception e) {
                // already exists
                log.debug("Index creation result: {} - {}", statement, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("Error closing FalkorDB driver: {}", e.getMessage());
        }
    }
}
