package com.work.mirror.app.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.work.mirror.core.model.RecommendedConfig;
import com.work.mirror.core.synth.DaemonConfigWriter;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 推荐配置视图。无数据或无可用镜像时只带 error，config 为 null。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendedConfigResponse {

    public static final String NO_DATA_MESSAGE = "暂无检测数据";
    public static final String NO_AVAILABLE_MESSAGE = "暂无可用的镜像源";

    private String error;
    private Map<String, List<String>> config;
    private List<String> mirrors;
    private Integer count;
    private Integer totalAvailable;
    private Instant lastUpdate;
    private Instant nextUpdate;

    public static RecommendedConfigResponse error(String message) {
        RecommendedConfigResponse r = new RecommendedConfigResponse();
        r.error = message;
        return r;
    }

    public static RecommendedConfigResponse fromConfig(RecommendedConfig config) {
        if (config.isEmpty()) {
            return error(NO_AVAILABLE_MESSAGE);
        }
        RecommendedConfigResponse r = new RecommendedConfigResponse();
        r.config = Collections.singletonMap(DaemonConfigWriter.MIRRORS_FIELD, config.getMirrors());
        r.mirrors = config.getMirrors();
        r.count = config.getCount();
        r.totalAvailable = config.getTotalAvailable();
        r.lastUpdate = config.getLastUpdate();
        r.nextUpdate = config.getNextUpdate();
        return r;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    // 无数据时也需要显式输出 "config": null
    @JsonProperty("config")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Map<String, List<String>> getConfig() {
        return config;
    }

    @JsonProperty("mirrors")
    public List<String> getMirrors() {
        return mirrors;
    }

    @JsonProperty("count")
    public Integer getCount() {
        return count;
    }

    @JsonProperty("total_available")
    public Integer getTotalAvailable() {
        return totalAvailable;
    }

    @JsonProperty("last_update")
    public Instant getLastUpdate() {
        return lastUpdate;
    }

    @JsonProperty("next_update")
    public Instant getNextUpdate() {
        return nextUpdate;
    }
}
