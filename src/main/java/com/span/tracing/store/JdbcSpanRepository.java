package com.span.tracing.store;

import com.span.tracing.SpanKind;
import com.span.tracing.StatusCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JDBC-backed implementation of SpanRepository.
 * Persists one row per span in the {@code otel_spans} table. Attributes and events
 * are stored as JSON text; timestamps as fixed-width ISO-8601 strings.
 *
 * <p>Each call to {@link #saveAll(List)} runs in a single transaction: ids that
 * already exist are skipped and the remaining rows are inserted as one batch with
 * {@code ON CONFLICT DO NOTHING}, so a row committed by a concurrent writer between
 * the lookup and the insert is ignored instead of failing the batch. The
 * database must accept that clause (PostgreSQL, SQLite, H2 in PostgreSQL mode).</p>
 */
public class JdbcSpanRepository implements SpanRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcSpanRepository.class);

    public static final String TABLE = "otel_spans";

    private static final int ID_LOOKUP_CHUNK = 500;

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS otel_spans (
                id VARCHAR(32) PRIMARY KEY,
                trace_id VARCHAR(32) NOT NULL,
                parent_span_id VARCHAR(32),
                name VARCHAR(512) NOT NULL,
                kind VARCHAR(16) DEFAULT 'INTERNAL',
                start_time VARCHAR(32) NOT NULL,
                end_time VARCHAR(32),
                duration_ms BIGINT DEFAULT 0,
                status_code VARCHAR(8) DEFAULT 'UNSET',
                status_message TEXT,
                attributes TEXT,
                events TEXT,
                agent_id VARCHAR(255),
                project_id VARCHAR(255),
                classification VARCHAR(64) DEFAULT 'CUI',
                created_at VARCHAR(32)
            )
            """;

    private static final String INSERT = """
            INSERT INTO otel_spans (id, trace_id, parent_span_id, name, kind, start_time, end_time,
                duration_ms, status_code, status_message, attributes, events, agent_id, project_id,
                classification, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT DO NOTHING
            """;

    private static final String SELECT_COLUMNS = """
            SELECT id, trace_id, parent_span_id, name, kind, start_time, end_time, duration_ms,
                status_code, status_message, attributes, events, agent_id, project_id,
                classification, created_at
            FROM otel_spans
            """;

    private final DataSource dataSource;
    private final SpanJsonCodec codec;

    public JdbcSpanRepository(DataSource dataSource) {
        this(dataSource, new SpanJsonCodec());
    }

    public JdbcSpanRepository(DataSource dataSource, SpanJsonCodec codec) {
        this.dataSource = dataSource;
        this.codec = codec;
    }

    /**
     * Creates the {@code otel_spans} table and its indexes if they do not exist.
     */
    public void createSchema() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE);
            safeExecute(statement, "CREATE INDEX IF NOT EXISTS idx_otel_spans_trace ON otel_spans (trace_id)");
            safeExecute(statement, "CREATE INDEX IF NOT EXISTS idx_otel_spans_project ON otel_spans (project_id)");
            safeExecute(statement, "CREATE INDEX IF NOT EXISTS idx_otel_spans_start ON otel_spans (start_time)");
            log.info("Span table {} ready", TABLE);
        } catch (SQLException e) {
            throw new SpanStorageException("Failed to create span table " + TABLE, e);
        }
    }

    private void safeExecute(Statement statement, String sql) {
        try {
            statement.execute(sql);
        } catch (SQLException e) {
            log.debug("Index creation statement result: {} - {}", sql, e.getMessage());
        }
    }

    @Override
    public int saveAll(List<SpanRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        Map<String, SpanRecord> unique = new LinkedHashMap<>();
        for (SpanRecord record : records) {
            unique.putIfAbsent(record.id(), record);
        }

        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                Set<String> existing = findExistingIds(connection, unique.keySet());
                int inserted = insertMissing(connection, unique, existing);
                connection.commit();
                log.debug("Persisted {} spans ({} already stored)", inserted, unique.size() - inserted);
                return inserted;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(connection);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new SpanStorageException("Failed to persist " + records.size() + " spans", e);
        }
    }

    Set<String> findExistingIds(Connection connection, Set<String> ids) throws SQLException {
        Set<String> existing = new HashSet<>();
        List<String> all = new ArrayList<>(ids);
        for (int from = 0; from < all.size(); from += ID_LOOKUP_CHUNK) {
            List<String> chunk = all.subList(from, Math.min(from + ID_LOOKUP_CHUNK, all.size()));
            String placeholders = String.join(", ", Collections.nCopies(chunk.size(), "?"));
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT id FROM otel_spans WHERE id IN (" + placeholders + ")")) {
                for (int i = 0; i < chunk.size(); i++) {
                    ps.setString(i + 1, chunk.get(i));
                }
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        existing.add(rs.getString(1));
                    }
                }
            }
        }
        return existing;
    }

    private int insertMissing(Connection connection, Map<String, SpanRecord> records, Set<String> existing)
            throws SQLException {
        int batched = 0;
        int inserted = 0;
        try (PreparedStatement ps = connection.prepareStatement(INSERT)) {
            for (SpanRecord record : records.values()) {
                if (existing.contains(record.id())) {
                    continue;
                }
                bind(ps, record);
                ps.addBatch();
                batched++;
            }
            if (batched == 0) {
                return 0;
            }
            for (int count : ps.executeBatch()) {
                if (count > 0 || count == Statement.SUCCESS_NO_INFO) {
                    inserted++;
                }
            }
        }
        return inserted;
    }

    private void bind(PreparedStatement ps, SpanRecord record) throws SQLException {
        ps.setString(1, record.id());
        ps.setString(2, record.traceId());
        ps.setString(3, record.parentSpanId());
        ps.setString(4, record.name());
        ps.setString(5, record.kind().name());
        ps.setString(6, SpanTimestamps.format(record.startTime()));
        ps.setString(7, SpanTimestamps.format(record.endTime()));
        ps.setLong(8, record.durationMs());
        ps.setString(9, record.statusCode().name());
        ps.setString(10, record.statusMessage());
        ps.setString(11, codec.writeAttributes(record.attributes()));
        ps.setString(12, codec.writeEvents(record.events()));
        ps.setString(13, record.agentId());
        ps.setString(14, record.projectId());
        ps.setString(15, record.classification());
        ps.setString(16, SpanTimestamps.format(record.createdAt()));
    }

    private void rollbackQuietly(Connection connection) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            log.warn("Rollback of span batch failed: {}", e.getMessage());
        }
    }

    @Override
    public List<SpanRecord> query(SpanQuery query) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS);
        List<String> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        if (query.traceId() != null) {
            conditions.add("trace_id = ?");
            params.add(query.traceId());
        }
        if (query.projectId() != null) {
            conditions.add("project_id = ?");
            params.add(query.projectId());
        }
        if (query.name() != null) {
            conditions.add("name = ?");
            params.add(query.name());
        }
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY start_time DESC LIMIT ?");

        try (Connection connection = dataSource.getConnection();
             PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            int index = 1;
            for (String param : params) {
                ps.setString(index++, param);
            }
            ps.setInt(index, query.limit());
            List<SpanRecord> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            log.debug("Span query {} returned {} rows", query, results.size());
            return results;
        } catch (SQLException e) {
            throw new SpanStorageException("Failed to query spans", e);
        }
    }

    @Override
    public int count() {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM otel_spans")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new SpanStorageException("Failed to count spans", e);
        }
    }

    private SpanRecord mapRow(ResultSet rs) throws SQLException {
        String kind = rs.getString("kind");
        String status = rs.getString("status_code");
        return SpanRecord.builder()
                .id(rs.getString("id"))
                .traceId(rs.getString("trace_id"))
                .parentSpanId(rs.getString("parent_span_id"))
                .name(rs.getString("name"))
                .kind(SpanKind.fromString(kind))
                .startTime(SpanTimestamps.parse(rs.getString("start_time")))
                .endTime(SpanTimestamps.parse(rs.getString("end_time")))
                .durationMs(rs.getLong("duration_ms"))
                .statusCode(status != null ? StatusCode.valueOf(status) : StatusCode.UNSET)
                .statusMessage(rs.getString("status_message"))
                .attributes(codec.readAttributes(rs.getString("attributes")))
                .events(codec.readEvents(rs.getString("events")))
                .agentId(rs.getString("agent_id"))
                .projectId(rs.getString("project_id"))
                .classification(rs.getString("classification"))
                .createdAt(SpanTimestamps.parse(rs.getString("created_at")))
                .build();
    }
}
