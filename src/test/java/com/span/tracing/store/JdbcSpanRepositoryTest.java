package com.span.tracing.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.span.tracing.store.SpanRecords.fullRecord;
import static com.span.tracing.store.SpanRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("JdbcSpanRepository Tests")
class JdbcSpanRepositoryTest {

    private JdbcDataSource dataSource;
    private JdbcSpanRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:spans_" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");
        repository = new JdbcSpanRepository(dataSource);
        repository.createSchema();
    }

    @Nested
    @DisplayName("Schema")
    class SchemaTests {

        @Test
        @DisplayName("createSchema should be idempotent")
        void idempotent() {
            assertDoesNotThrow(repository::createSchema);
            assertEquals(0, repository.count());
        }
    }

    @Nested
    @DisplayName("saveAll")
    class SaveTests {

        @Test
        @DisplayName("Should persist every column and read it back")
        void roundTripsColumns() {
            SpanRecord original = fullRecord("a1b2c3d4e5f60718", "0af7651916cd43dd8448eb211c80319c", "00f067aa0ba902b7");

            assertEquals(1, repository.saveAll(List.of(original)));

            SpanRecord stored = repository.query(SpanQuery.byTraceId(original.traceId())).get(0);
            assertEquals(original, stored);
        }

        @Test
        @DisplayName("Should store timestamps as fixed-width ISO-8601 strings")
        void timestampFormat() throws SQLException {
            repository.saveAll(List.of(record("s1", "t1", "a", 0)));

            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement();
                 ResultSet rs = statement.executeQuery("SELECT start_time, attributes, events FROM otel_spans")) {
                assertTrue(rs.next());
                assertEquals("2024-05-01T10:00:00.123456Z", rs.getString("start_time"));
                assertEquals("{}", rs.getString("attributes"));
                assertEquals("[]", rs.getString("events"));
            }
        }

        @Test
        @DisplayName("Should ignore records whose id is already stored")
        void ignoresDuplicates() {
            repository.saveAll(List.of(record("s1", "t1", "first", 0)));

            int inserted = repository.saveAll(List.of(
                    record("s1", "t1", "second", 0),
                    record("s2", "t1", "b", 1),
                    record("s2", "t1", "b-again", 1)));

            assertEquals(1, inserted);
            assertEquals(2, repository.count());
            assertTrue(repository.query(SpanQuery.builder().name("second").build()).isEmpty());
        }

        @Test
        @DisplayName("A row committed after the id lookup should be skipped, not fail the batch")
        void rowWrittenAfterLookup() {
            repository.saveAll(List.of(record("s1", "t1", "first", 0)));
            JdbcSpanRepository staleLookup = new JdbcSpanRepository(dataSource) {
                @Override
                Set<String> findExistingIds(Connection connection, Set<String> ids) {
                    return Set.of();
                }
            };

            int inserted = assertDoesNotThrow(() -> staleLookup.saveAll(List.of(
                    record("s1", "t1", "second", 0),
                    record("s2", "t1", "b", 1))));

            assertEquals(1, inserted);
            assertEquals(2, repository.count());
            assertEquals(1, repository.query(SpanQuery.builder().name("first").build()).size());
            assertTrue(repository.query(SpanQuery.builder().name("second").build()).isEmpty());
        }

        @Test
        @DisplayName("Should handle batches larger than one id lookup")
        void largeBatch() {
            List<SpanRecord> records = new ArrayList<>();
            for (int i = 0; i < 1200; i++) {
                records.add(record("span-" + i, "t1", "op", i));
            }

            assertEquals(1200, repository.saveAll(records));
            assertEquals(0, repository.saveAll(records));
            assertEquals(1200, repository.count());
        }

        @Test
        @DisplayName("Empty batch should be a no-op")
        void emptyBatch() {
            assertEquals(0, repository.saveAll(List.of()));
        }

        @Test
        @DisplayName("A failed batch should be rolled back entirely")
        void rollsBack() {
            SpanRecord tooLong = record("s-bad", "t".repeat(40), "op", 0);

            SpanStorageException e = assertThrows(SpanStorageException.class,
                    () -> repository.saveAll(List.of(record("s-good", "t1", "op", 0), tooLong)));

            assertNotNull(e.getCause());
            assertEquals(0, repository.count());
        }

        @Test
        @DisplayName("Connection failures should surface as SpanStorageException")
        void connectionFailure() throws SQLException {
            DataSource broken = mock(DataSource.class);
            when(broken.getConnection()).thenThrow(new SQLException("refused"));
            JdbcSpanRepository failing = new JdbcSpanRepository(broken);

            assertThrows(SpanStorageException.class, () -> failing.saveAll(List.of(record("s1", "t1", "a", 0))));
            assertThrows(SpanStorageException.class, () -> failing.query(SpanQuery.all()));
            assertThrows(SpanStorageException.class, failing::count);
        }
    }

    @Nested
    @DisplayName("query")
    class QueryTests {

        @BeforeEach
        void seed() {
            repository.saveAll(List.of(
                    record("s1", "t1", "a", 0),
                    record("s2", "t1", "b", 10),
                    record("s3", "t2", "a", 5),
                    record("s4", "t1", "a", 20)));
        }

        @Test
        @DisplayName("Should filter by trace and order newest first")
        void byTrace() {
            List<SpanRecord> results = repository.query(SpanQuery.byTraceId("t1"));
            assertEquals(List.of("s4", "s2", "s1"), results.stream().map(SpanRecord::id).toList());
        }

        @Test
        @DisplayName("Should AND-combine criteria")
        void combined() {
            List<SpanRecord> results = repository.query(
                    SpanQuery.builder().traceId("t1").projectId("proj-1").name("a").build());
            assertEquals(List.of("s4", "s1"), results.stream().map(SpanRecord::id).toList());
        }

        @Test
        @DisplayName("Should cap results at the limit")
        void limit() {
            assertEquals(2, repository.query(SpanQuery.builder().limit(2).build()).size());
        }

        @Test
        @DisplayName("Unknown trace should yield an empty list")
        void unknownTrace() {
            assertTrue(repository.query(SpanQuery.byTraceId("missing")).isEmpty());
        }
    }
}
