package com.span.tracing.buffered;

import com.span.tracing.store.SpanRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ended spans waiting to be written. The lock is held only to append a record
 * or to swap the pending list for an empty one; no I/O happens under it.
 */
final class SpanBuffer {

    private final ReentrantLock lock = new ReentrantLock();
    private List<SpanRecord> pending = new ArrayList<>();

    /**
     * @return the number of pending records after the append
     */
    int add(SpanRecord record) {
        lock.lock();
        try {
            pending.add(record);
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically takes every pending record, leaving the buffer empty.
     */
    List<SpanRecord> drain() {
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return List.of();
            }
            List<SpanRecord> drained = pending;
            pending = new ArrayList<>();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }
}
