package com.driftsentinel.core.window;

import com.driftsentinel.core.model.PredictionRecord;
import com.driftsentinel.core.model.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, arrival-ordered store of {@link PredictionRecord}s.
 *
 * <h3>Eviction</h3>
 * <ul>
 * <li>Count: when an append pushes the size past {@code capacity}, the oldest
 * records are dropped (FIFO).</li>
 * <li>Age: when {@code maxAge} is positive, every record older than
 * {@code maxAge} relative to the record just appended is dropped.</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Appends are serialized by a lock so that eviction and size bookkeeping are
 * atomic. Readers call {@link #snapshot()}, which copies the contents under
 * the same lock and hands back an immutable {@link WindowSnapshot}.
 * </p>
 *
 * @since 1.0.0
 */
public class ObservationWindow {

    private static final Logger LOG = LoggerFactory.getLogger(ObservationWindow.class);

    private final int capacity;
    private final Duration maxAge;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<PredictionRecord> records = new ArrayDeque<>();

    private long totalAppended;
    private long totalEvicted;

    /**
     * @param capacity maximum number of records; must be {@code >= 1}
     * @param maxAge   maximum record age; {@link Duration#ZERO} disables age
     *                 eviction
     * @param clock    clock used to stamp snapshots
     * @throws IllegalArgumentException if {@code capacity < 1} or
     *                                  {@code maxAge} is negative
     */
    public ObservationWindow(int capacity, Duration maxAge, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative, got: " + maxAge);
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Validate and append a record, then evict overflowing or expired entries.
     *
     * @param record the record to append; must not be {@code null}
     * @throws ValidationException if the record is malformed; the window is
     *                             left unchanged
     */
    public void append(PredictionRecord record) {
        PredictionValidator.validate(record);

        lock.lock();
        try {
            records.addLast(record);
            totalAppended++;

            int evicted = 0;
            while (records.size() > capacity) {
                records.pollFirst();
                evicted++;
            }
            if (!maxAge.isZero()) {
                Instant newest = record.getTimestamp();
                Iterator<PredictionRecord> it = records.iterator();
                while (it.hasNext()) {
                    if (Duration.between(it.next().getTimestamp(), newest).compareTo(maxAge) > 0) {
                        it.remove();
                        evicted++;
                    }
                }
            }
            totalEvicted += evicted;

            if (evicted > 0) {
                LOG.trace("Evicted {} record(s); window size={}", evicted, records.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable copy of the current contents, oldest first
     */
    public WindowSnapshot snapshot() {
        lock.lock();
        try {
            return new WindowSnapshot(List.copyOf(records), clock.instant());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public Duration getMaxAge() {
        return maxAge;
    }

    /**
     * @return number of records ever accepted
     */
    public long getTotalAppended() {
        lock.lock();
        try {
            return totalAppended;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of records dropped by count or age eviction
     */
    public long getTotalEvicted() {
        lock.lock();
        try {
            return totalEvicted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ObservationWindow{capacity=" + capacity + ", maxAge=" + maxAge + ", size=" + size() + '}';
    }
}
