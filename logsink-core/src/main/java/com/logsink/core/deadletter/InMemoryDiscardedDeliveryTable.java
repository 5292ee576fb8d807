package com.logsink.core.deadletter;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Bounded in-process discard log; the oldest entries are evicted first. */
public class InMemoryDiscardedDeliveryTable implements DiscardedDeliveryTable {

    public static final int DEFAULT_CAPACITY = 1000;

    public record Entry(
            Instant recordedAt, String messageId, String payload, String reason, String detail, String source) {}

    private final int capacity;
    private final Clock clock;
    private final List<Entry> entries = new ArrayList<>();

    public InMemoryDiscardedDeliveryTable() {
        this(DEFAULT_CAPACITY, Clock.systemUTC());
    }

    public InMemoryDiscardedDeliveryTable(Clock clock) {
        this(DEFAULT_CAPACITY, clock);
    }

    public InMemoryDiscardedDeliveryTable(int capacity, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void record(String messageId, String payload, String reason, String detail, String source) {
        if (entries.size() == capacity) {
            entries.remove(0);
        }
        entries.add(new Entry(clock.instant(), messageId, payload, reason, detail, source));
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }
}
