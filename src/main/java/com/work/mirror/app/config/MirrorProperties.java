package com.work.mirror.app.config;

import com.work.mirror.core.config.MirrorCheckConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 仅存在于宿主侧，用于从 application.yml 读取配置。
 * 再由配置类转换为 core 包所需的 {@link MirrorCheckConfig}。
 */
@ConfigurationProperties(prefix = "mirror")
public class MirrorProperties {

    /**
     * 待检测的镜像列表，未配置时使用内置默认列表
     */
    private List<String> mirrors = new ArrayList<>(MirrorCheckConfig.DEFAULT_MIRRORS);

    /**
     * 单个 URL 的建连/读取超时
     */
    private Duration probeTimeout = Duration.ofSeconds(5);

    /**
     * 批次内单个任务的等待上限（从批次开始计时），超过即放弃该镜像
     */
    private Duration taskCeiling = Duration.ofSeconds(10);

    private int probeWorkers = 32;

    /**
     * 定时检测间隔，同时作为 volatile tier 的 TTL
     */
    private Duration checkInterval = Duration.ofHours(1);

    /**
     * 启动后首次检测的延迟
     */
    private Duration initialDelay = Duration.ZERO;

    private boolean schedulerEnabled = true;

    private int recommendCount = 5;

    /**
     * 每次定时检测后是否自动写入 daemon 配置
     */
    private boolean autoApply = true;

    private String daemonJson = "/etc/docker/daemon.json";

    private String daemonJsonBackup = "/etc/docker/daemon.json.bak";

    private String cacheKey = "mirror_test_results";

    /**
     * redis 或 local
     */
    private String volatileStore = "redis";

    /**
     * postgres 或 memory
     */
    private String durableStore = "postgres";

    private int historyMaxLimit = 1000;

    public List<String> getMirrors() {
        return mirrors;
    }

    public void setMirrors(List<String> mirrors) {
        this.mirrors = mirrors;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getTaskCeiling() {
        return taskCeiling;
    }

    public void setTaskCeiling(Duration taskCeiling) {
        this.taskCeiling = taskCeiling;
    }

    public int getProbeWorkers() {
        return probeWorkers;
    }

    public void setProbeWorkers(int probeWorkers) {
        this.probeWorkers = probeWorkers;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public int getRecommendCount() {
        return recommendCount;
    }

    public void setRecommendCount(int recommendCount) {
        this.recommendCount = recommendCount;
    }

    public boolean isAutoApply() {
        return autoApply;
    }

    public void setAutoApply(boolean autoApply) {
        this.autoApply = autoApply;
    }

    public String getDaemonJson() {
        return daemonJson;
    }

    public void setDaemonJson(String daemonJson) {
        this.daemonJson = daemonJson;
    }

    public String getDaemonJsonBackup() {
        return daemonJsonBackup;
    }

    public void setDaemonJsonBackup(String daemonJsonBackup) {
        this.daemonJsonBackup = daemonJsonBackup;
    }

    public String getCacheKey() {
        return cacheKey;
    }

    public void setCacheKey(String cacheKey) {
        this.cacheKey = cacheKey;
    }

    public String getVolatileStore() {
        return volatileStore;
    }

    public void setVolatileStore(String volatileStore) {
        this.volatileStore = volatileStore;
    }

    public String getDurableStore() {
        return durableStore;
    }

    public void setDurableStore(String durableStore) {
        this.durableStore = durableStore;
    }

    public int getHistoryMaxLimit() {
        return historyMaxLimit;
    }

    public void setHistoryMaxLimit(int historyMaxLimit) {
        this.historyMaxLimit = historyMaxLimit;
    }
}
