package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeResult;

import java.time.Instant;

/**
 * 历史记录行的对外视图，字段名与表结构一致。
 */
public class HistoryView {

    private Long id;
    private String mirrorUrl;
    private boolean available;
    private String status;
    private int statusCode;
    private double responseTime;
    private Instant testTime;
    private Instant createdAt;

    public static HistoryView fromRecord(HistoryRecord record) {
        ProbeResult r = record.getResult();
        HistoryView v = new HistoryView();
        v.id = record.getId();
        v.mirrorUrl = r.getEndpoint();
        v.available = r.isAvailable();
        v.status = r.getStatusLabel();
        v.statusCode = r.getStatusCode();
        v.responseTime = r.getResponseTimeMs();
        v.testTime = r.getObservedAt();
        v.createdAt = record.getCreatedAt();
        return v;
    }

    @JsonProperty("id")
    public Long getId() {
        return id;
    }

    @JsonProperty("mirror_url")
    public String getMirrorUrl() {
        return mirrorUrl;
    }

    @JsonProperty("available")
    public boolean isAvailable() {
        return available;
    }

    @JsonProperty("status")
    public String getStatus() {
        return status;
    }

    @JsonProperty("status_code")
    public int getStatusCode() {
        return statusCode;
    }

    @JsonProperty("response_time")
    public double getResponseTime() {
        return responseTime;
    }

    @JsonProperty("test_time")
    public Instant getTestTime() {
        return testTime;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }
}
