package com.span.tracing.store;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of SpanRepository.
 * Thread-safe via ConcurrentHashMap keyed by span id.
 * Used in tests and as the fallback store when no durable store is configured.
 */
public class InMemorySpanRepository implements SpanRepository {

    private final Map<String, SpanRecord> spans = new ConcurrentHashMap<>();

    @Override
    public int saveAll(List<SpanRecord> records) {
        int inserted = 0;
        for (SpanRecord record : records) {
            if (spans.putIfAbsent(record.id(), record) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public List<SpanRecord> query(SpanQuery query) {
        return spans.values().stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(SpanRecord::startTime).reversed())
                .limit(query.limit())
                .toList();
    }

    @Override
    public int count() {
        return spans.size();
    }

    /**
     * Removes every stored span.
     */
    public void clear() {
        spans.clear();
    }
}
