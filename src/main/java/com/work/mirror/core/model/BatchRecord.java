package com.work.mirror.core.model;

import java.time.Instant;

public final class BatchRecord {

    private final Long id;
    private final Instant observedAt;
    private final int total;
    private final int availableCount;
    private final int unavailableCount;

    public BatchRecord(Long id, Instant observedAt, int total, int availableCount, int unavailableCount) {
        this.id = id;
        this.observedAt = observedAt;
        this.total = total;
        this.availableCount = availableCount;
        this.unavailableCount = unavailableCount;
    }

    public static BatchRecord of(ProbeBatch batch) {
        return new BatchRecord(null, batch.getObservedAt(), batch.getTotal(),
                batch.getAvailableCount(), batch.getUnavailableCount());
    }

    public Long getId() {
        return id;
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public int getTotal() {
        return total;
    }

    public int getAvailableCount() {
        return availableCount;
    }

    public int getUnavailableCount() {
        return unavailableCount;
    }
}
