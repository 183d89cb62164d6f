package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;

import java.util.List;

/**
 * 一次批量检测的汇总视图；流式模式下作为最后一条事件，done=true。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchResponse {

    private final Boolean done;
    private final List<ProbeResult> results;
    private final int total;
    private final int available;
    private final int unavailable;

    private BatchResponse(Boolean done, ProbeBatch batch) {
        this.done = done;
        this.results = batch.getResults();
        this.total = batch.getTotal();
        this.available = batch.getAvailableCount();
        this.unavailable = batch.getUnavailableCount();
    }

    public static BatchResponse fromBatch(ProbeBatch batch) {
        return new BatchResponse(null, batch);
    }

    public static BatchResponse finished(ProbeBatch batch) {
        return new BatchResponse(Boolean.TRUE, batch);
    }

    @JsonProperty("done")
    public Boolean getDone() {
        return done;
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
    public int getAvailable() {
        return available;
    }

    @JsonProperty("unavailable")
    public int getUnavailable() {
        return unavailable;
    }
}
