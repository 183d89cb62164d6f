package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.RollingStat;

import java.time.Instant;

public class StatisticsView {

    private String mirrorUrl;
    private long totalTests;
    private long successCount;
    private long failCount;
    private double avgResponseTime;
    private Instant lastSuccessTime;
    private Instant lastFailTime;
    private boolean currentStatus;
    private Instant updatedAt;

    public static StatisticsView fromStat(RollingStat stat) {
        StatisticsView v = new StatisticsView();
        v.mirrorUrl = stat.getEndpoint();
        v.totalTests = stat.getTotalTests();
        v.successCount = stat.getSuccessCount();
        v.failCount = stat.getFailCount();
        v.avgResponseTime = stat.getAvgResponseTimeMs();
        v.lastSuccessTime = stat.getLastSuccessAt();
        v.lastFailTime = stat.getLastFailAt();
        v.currentStatus = stat.isCurrentStatus();
        v.updatedAt = stat.getUpdatedAt();
        return v;
    }

    @JsonProperty("mirror_url")
    public String getMirrorUrl() {
        return mirrorUrl;
    }

    @JsonProperty("total_tests")
    public long getTotalTests() {
        return totalTests;
    }

    @JsonProperty("success_count")
    public long getSuccessCount() {
        return successCount;
    }

    @JsonProperty("fail_count")
    public long getFailCount() {
        return failCount;
    }

    @JsonProperty("avg_response_time")
    public double getAvgResponseTime() {
        return avgResponseTime;
    }

    @JsonProperty("last_success_time")
    public Instant getLastSuccessTime() {
        return lastSuccessTime;
    }

    @JsonProperty("last_fail_time")
    public Instant getLastFailTime() {
        return lastFailTime;
    }

    @JsonProperty("current_status")
    public boolean isCurrentStatus() {
        return currentStatus;
    }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
