package com.work.mirror.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Comparator;

/**
 * 单次探测结果，创建后不可变。
 *
 * <p>JSON 字段名沿用对外接口既有的命名（mirror / status / response_time ...），
 * 缓存在 volatile tier 中的快照也使用同一格式。</p>
 */
public final class ProbeResult {

    /**
     * 可用的排在前面，组内按响应时间升序。
     */
    public static final Comparator<ProbeResult> RANKING =
            Comparator.comparing((ProbeResult r) -> !r.isAvailable())
                    .thenComparingDouble(ProbeResult::getResponseTimeMs);

    private final String endpoint;
    private final boolean available;
    private final String statusLabel;
    private final int statusCode;
    private final double responseTimeMs;
    private final Instant observedAt;

    @JsonCreator
    public ProbeResult(@JsonProperty("mirror") String endpoint,
                       @JsonProperty("available") boolean available,
                       @JsonProperty("status") String statusLabel,
                       @JsonProperty("status_code") int statusCode,
                       @JsonProperty("response_time") double responseTimeMs,
                       @JsonProperty("test_time") Instant observedAt) {
        this.endpoint = endpoint;
        this.available = available;
        this.statusLabel = statusLabel;
        this.statusCode = statusCode;
        this.responseTimeMs = responseTimeMs;
        this.observedAt = observedAt;
    }

    @JsonProperty("mirror")
    public String getEndpoint() {
        return endpoint;
    }

    @JsonProperty("available")
    public boolean isAvailable() {
        return available;
    }

    @JsonProperty("status")
    public String getStatusLabel() {
        return statusLabel;
    }

    @JsonProperty("status_code")
    public int getStatusCode() {
        return statusCode;
    }

    @JsonProperty("response_time")
    public double getResponseTimeMs() {
        return responseTimeMs;
    }

    @JsonProperty("test_time")
    public Instant getObservedAt() {
        return observedAt;
    }

    @Override
    public String toString() {
        return "ProbeResult{endpoint=" + endpoint + ", available=" + available + ", status=" + statusLabel
                + ", code=" + statusCode + ", responseTimeMs=" + responseTimeMs + '}';
    }
}
