package com.work.mirror.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 最新一次批次结果的缓存快照，整体替换，读者只拿到不可变引用。
 */
public final class CachedSnapshot {

    private final List<ProbeResult> results;
    private final int total;
    private final int availableCount;
    private final int unavailableCount;
    private final Instant lastUpdate;
    private final Instant nextUpdate;

    @JsonCreator
    public CachedSnapshot(@JsonProperty("results") List<ProbeResult> results,
                          @JsonProperty("total") int total,
                          @JsonProperty("available") int availableCount,
                          @JsonProperty("unavailable") int unavailableCount,
                          @JsonProperty("last_update") Instant lastUpdate,
                          @JsonProperty("next_update") Instant nextUpdate) {
        this.results = results == null ? Collections.emptyList() : Collections.unmodifiableList(results);
        this.total = total;
        this.availableCount = availableCount;
        this.unavailableCount = unavailableCount;
        this.lastUpdate = lastUpdate;
        this.nextUpdate = nextUpdate;
    }

    public static CachedSnapshot of(ProbeBatch batch, Instant lastUpdate, Duration interval) {
        return new CachedSnapshot(batch.getResults(), batch.getTotal(), batch.getAvailableCount(),
                batch.getUnavailableCount(), lastUpdate, lastUpdate.plus(interval));
    }

    @JsonProperty("results")
    public List<ProbeResult> getResults() {
        return results;
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }

    @JsonProperty("available")
    public int getAvailableCount() {
        return availableCount;
    }

    @JsonProperty("unavailable")
    public int getUnavailableCount() {
        return unavailableCount;
    }

    @JsonProperty("last_update")
    public Instant getLastUpdate() {
        return lastUpdate;
    }

    @JsonProperty("next_update")
    public Instant getNextUpdate() {
        return nextUpdate;
    }

    public boolean hasResults() {
        return !results.isEmpty();
    }
}
