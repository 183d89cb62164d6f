package com.work.mirror.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次聚合运行的完整结果。结果列表按 {@link ProbeResult#RANKING} 排序，
 * 计数只统计实际完成的探测（被放弃的任务不计入）。
 */
public final class ProbeBatch {

    private final Instant observedAt;
    private final List<ProbeResult> results;
    private final int availableCount;

    private ProbeBatch(Instant observedAt, List<ProbeResult> results, int availableCount) {
        this.observedAt = observedAt;
        this.results = results;
        this.availableCount = availableCount;
    }

    /**
     * 排序并统计，返回不可变的 batch。
     */
    public static ProbeBatch of(Instant observedAt, List<ProbeResult> completed) {
        List<ProbeResult> sorted = new ArrayList<>(completed);
        sorted.sort(ProbeResult.RANKING);
        int available = 0;
        for (ProbeResult r : sorted) {
            if (r.isAvailable()) {
                available++;
            }
        }
        return new ProbeBatch(observedAt, Collections.unmodifiableList(sorted), available);
    }

    public Instant getObservedAt() {
        return observedAt;
    }

    public List<ProbeResult> getResults() {
        return results;
    }

    public int getTotal() {
        return results.size();
    }

    public int getAvailableCount() {
        return availableCount;
    }

    public int getUnavailableCount() {
        return results.size() - availableCount;
    }
}
