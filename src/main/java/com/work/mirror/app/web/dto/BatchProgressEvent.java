package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.ProbeResult;

/**
 * 顺序检测时每完成一个镜像推送一次的进度事件。
 */
public class BatchProgressEvent {

    private final int progress;
    private final int total;
    private final ProbeResult result;

    public BatchProgressEvent(int progress, int total, ProbeResult result) {
        this.progress = progress;
        this.total = total;
        this.result = result;
    }

    @JsonProperty("progress")
    public int getProgress() {
        return progress;
    }

    @JsonProperty("total")
    public int getTotal() {
        return total;
    }

    @JsonProperty("result")
    public ProbeResult getResult() {
        return result;
    }
}
