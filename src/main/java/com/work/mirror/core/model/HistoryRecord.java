package com.work.mirror.core.model;

import java.time.Instant;

/**
 * durable history 中的一行。
 */
public final class HistoryRecord {

    private final Long id;
    private final ProbeResult result;
    private final Instant createdAt;

    public HistoryRecord(Long id, ProbeResult result, Instant createdAt) {
        this.id = id;
        this.result = result;
        this.createdAt = createdAt;
    }

    public Long getId() {
        return id;
    }

    public ProbeResult getResult() {
        return result;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
