package com.span.tracing.store;

import com.span.tracing.SpanKind;
import com.span.tracing.StatusCode;
import com.span.tracing.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph-backed implementation of SpanRepository.
 * Persists each span as a {@code :Span} node. Attributes and events are stored
 * as JSON strings, timestamps as fixed-width ISO-8601 strings.
 *
 * <p>A batch is written with a single Cypher statement made of one
 * {@code MERGE ... ON CREATE SET} clause per span, so the batch is applied
 * atomically and spans that already exist are left unchanged.</p>
 */
public class GraphSpanRepository implements SpanRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphSpanRepository.class);

    private static final String RETURN_COLUMNS = """
            RETURN s.id as id, s.traceId as traceId, s.parentSpanId as parentSpanId, s.name as name,
                   s.kind as kind, s.startTime as startTime, s.endTime as endTime,
                   s.durationMs as durationMs, s.statusCode as statusCode,
                   s.statusMessage as statusMessage, s.attributes as attributes, s.events as events,
                   s.agentId as agentId, s.projectId as projectId,
                   s.classification as classification, s.createdAt as createdAt
            """;

    private static final List<String> PROPERTIES = List.of(
            "traceId", "parentSpanId", "name", "kind", "startTime", "endTime", "durationMs",
            "statusCode", "statusMessage", "attributes", "events", "agentId", "projectId",
            "classification", "createdAt");

    private final GraphConnection connection;
    private final SpanJsonCodec codec;

    public GraphSpanRepository(GraphConnection connection) {
        this(connection, new SpanJsonCodec());
    }

    public GraphSpanRepository(GraphConnection connection, SpanJsonCodec codec) {
        this.connection = connection;
        this.codec = codec;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The graph does not report which nodes were created, so the returned
     * count is the number of distinct spans submitted.</p>
     */
    @Override
    public int saveAll(List<SpanRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        Map<String, SpanRecord> unique = new LinkedHashMap<>();
        for (SpanRecord record : records) {
            unique.putIfAbsent(record.id(), record);
        }

        StringBuilder query = new StringBuilder();
        Map<String, Object> params = new HashMap<>();
        int index = 0;
        for (SpanRecord record : unique.values()) {
            appendMerge(query, params, "s" + index, record);
            index++;
        }
        try {
            connection.execute(query.toString(), params);
        } catch (RuntimeException e) {
            throw new SpanStorageException("Failed to persist " + unique.size() + " spans to graph "
                    + connection.getGraphName(), e);
        }
        log.debug("Merged {} span nodes into graph {}", unique.size(), connection.getGraphName());
        return unique.size();
    }

    private void appendMerge(StringBuilder query, Map<String, Object> params, String var, SpanRecord record) {
        query.append("MERGE (").append(var).append(":Span {id: $").append(var).append("_id})\n");
        query.append("ON CREATE SET ");
        for (int i = 0; i < PROPERTIES.size(); i++) {
            String property = PROPERTIES.get(i);
            if (i > 0) {
                query.append(", ");
            }
            query.append(var).append('.').append(property).append(" = $").append(var).append('_').append(property);
        }
        query.append('\n');

        params.put(var + "_id", record.id());
        params.put(var + "_traceId", record.traceId());
        params.put(var + "_parentSpanId", record.parentSpanId());
        params.put(var + "_name", record.name());
        params.put(var + "_kind", record.kind().name());
        params.put(var + "_startTime", SpanTimestamps.format(record.startTime()));
        params.put(var + "_endTime", SpanTimestamps.format(record.endTime()));
        params.put(var + "_durationMs", record.durationMs());
        params.put(var + "_statusCode", record.statusCode().name());
        params.put(var + "_statusMessage", record.statusMessage());
        params.put(var + "_attributes", codec.writeAttributes(record.attributes()));
        params.put(var + "_events", codec.writeEvents(record.events()));
        params.put(var + "_agentId", record.agentId());
        params.put(var + "_projectId", record.projectId());
        params.put(var + "_classification", record.classification());
        params.put(var + "_createdAt", SpanTimestamps.format(record.createdAt()));
    }

    @Override
    public List<SpanRecord> query(SpanQuery query) {
        List<String> conditions = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();
        if (query.traceId() != null) {
            conditions.add("s.traceId = $traceId");
            params.put("traceId", query.traceId());
        }
        if (query.projectId() != null) {
            conditions.add("s.projectId = $projectId");
            params.put("projectId", query.projectId());
        }
        if (query.name() != null) {
            conditions.add("s.name = $name");
            params.put("name", query.name());
        }
        params.put("limit", query.limit());

        StringBuilder cypher = new StringBuilder("MATCH (s:Span)\n");
        if (!conditions.isEmpty()) {
            cypher.append("WHERE ").append(String.join(" AND ", conditions)).append('\n');
        }
        cypher.append(RETURN_COLUMNS)
                .append("ORDER BY s.startTime DESC\n")
                .append("LIMIT $limit\n");

        try {
            return connection.query(cypher.toString(), params).stream().map(this::mapRow).toList();
        } catch (RuntimeException e) {
            throw new SpanStorageException("Failed to query spans from graph " + connection.getGraphName(), e);
        }
    }

    @Override
    public int count() {
        List<Map<String, Object>> results = connection.query("MATCH (s:Span) RETURN count(s) as cnt");
        if (results.isEmpty()) {
            return 0;
        }
        return ((Number) results.get(0).get("cnt")).intValue();
    }

    private SpanRecord mapRow(Map<String, Object> row) {
        Object duration = row.get("durationMs");
        String status = (String) row.get("statusCode");
        return SpanRecord.builder()
                .id((String) row.get("id"))
                .traceId((String) row.get("traceId"))
                .parentSpanId((String) row.get("parentSpanId"))
                .name((String) row.get("name"))
                .kind(SpanKind.fromString((String) row.get("kind")))
                .startTime(SpanTimestamps.parse((String) row.get("startTime")))
                .endTime(SpanTimestamps.parse((String) row.get("endTime")))
                .durationMs(duration instanceof Number n ? n.longValue() : 0L)
                .statusCode(status != null ? StatusCode.valueOf(status) : StatusCode.UNSET)
                .statusMessage((String) row.get("statusMessage"))
                .attributes(codec.readAttributes((String) row.get("attributes")))
                .events(codec.readEvents((String) row.get("events")))
                .agentId((String) row.get("agentId"))
                .projectId((String) row.get("projectId"))
                .classification((String) row.get("classification"))
                .createdAt(SpanTimestamps.parse((String) row.get("createdAt")))
                .build();
    }
}
