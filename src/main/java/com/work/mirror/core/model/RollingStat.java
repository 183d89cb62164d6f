package com.work.mirror.core.model;

import java.time.Instant;

/**
 * 单个镜像的累计统计。
 *
 * <p>avgResponseTimeMs 是所有探测（含失败）的累计均值：
 * {@code (oldAvg * oldTotal + latency) / (oldTotal + 1)}，失败探测测得的耗时同样计入。</p>
 */
public final class RollingStat {

    private final String endpoint;
    private final long totalTests;
    private final long successCount;
    private final long failCount;
    private final double avgResponseTimeMs;
    private final Instant lastSuccessAt;
    private final Instant lastFailAt;
    private final boolean currentStatus;
    private final Instant updatedAt;

    public RollingStat(String endpoint, long totalTests, long successCount, long failCount,
                       double avgResponseTimeMs, Instant lastSuccessAt, Instant lastFailAt,
                       boolean currentStatus, Instant updatedAt) {
        this.endpoint = endpoint;
        this.totalTests = totalTests;
        this.successCount = successCount;
        this.failCount = failCount;
        this.avgResponseTimeMs = avgResponseTimeMs;
        this.lastSuccessAt = lastSuccessAt;
        this.lastFailAt = lastFailAt;
        this.currentStatus = currentStatus;
        this.updatedAt = updatedAt;
    }

    /**
     * 首次出现的镜像：以本次结果初始化。
     */
    public static RollingStat first(ProbeResult result) {
        return new RollingStat(null, 0, 0, 0, 0.0, null, null, false, null).accumulate(result);
    }

    /**
     * 累加一次探测结果，返回新的统计值。与 durable store 中的 upsert 语句语义一致。
     */
    public RollingStat accumulate(ProbeResult result) {
        boolean ok = result.isAvailable();
        long newTotal = totalTests + 1;
        double newAvg = (avgResponseTimeMs * totalTests + result.getResponseTimeMs()) / newTotal;
        return new RollingStat(
                result.getEndpoint(),
                newTotal,
                successCount + (ok ? 1 : 0),
                failCount + (ok ? 0 : 1),
                newAvg,
                ok ? result.getObservedAt() : lastSuccessAt,
                ok ? lastFailAt : result.getObservedAt(),
                ok,
                result.getObservedAt());
    }

    public String getEndpoint() {
        return endpoint;
    }

    public long getTotalTests() {
        return totalTests;
    }

    public long getSuccessCount() {
        return successCount;
    }

    public long getFailCount() {
        return failCount;
    }

    public double getAvgResponseTimeMs() {
        return avgResponseTimeMs;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public Instant getLastFailAt() {
        return lastFailAt;
    }

    public boolean isCurrentStatus() {
        return currentStatus;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
