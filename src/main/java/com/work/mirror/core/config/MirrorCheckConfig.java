package com.work.mirror.core.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 纯组件侧的配置定义，不依赖任意框架。宿主应用（如 Spring Boot）只需在装配时
 * 将自身读取到的配置参数注入即可，确保 core 包保持与框架解耦。
 */
public class MirrorCheckConfig {

    /**
     * 默认镜像站列表
     */
    public static final List<String> DEFAULT_MIRRORS = Collections.unmodifiableList(Arrays.asList(
            "https://docker.1ms.run",
            "https://docker.1panel.live",
            "https://docker.m.ixdev.cn",
            "https://hub.rat.dev",
            "https://docker.xuanyuan.me",
            "https://dockerproxy.net",
            "https://docker.hlmirror.com",
            "https://hub1.nat.tf",
            "https://hub2.nat.tf",
            "https://hub3.nat.tf",
            "https://hub4.nat.tf",
            "https://docker.m.daocloud.io",
            "https://docker.kejilion.pro",
            "https://hub.1panel.dev",
            "https://dockerproxy.cool",
            "https://proxy.vvvv.ee",
            "https://dockerproxy.com",
            "https://docker.mirrors.ustc.edu.cn",
            "https://docker.nju.edu.cn"));

    private final List<String> mirrors;
    private final Duration probeTimeout;
    private final Duration taskCeiling;
    private final Duration checkInterval;
    private final Duration initialDelay;
    private final int recommendCount;
    private final boolean autoApply;
    private final Path daemonJson;
    private final Path daemonJsonBackup;

    public MirrorCheckConfig(List<String> mirrors,
                             Duration probeTimeout,
                             Duration taskCeiling,
                             Duration checkInterval,
                             int recommendCount,
                             boolean autoApply,
                             Path daemonJson,
                             Path daemonJsonBackup) {
        this(mirrors, probeTimeout, taskCeiling, checkInterval, Duration.ZERO,
                recommendCount, autoApply, daemonJson, daemonJsonBackup);
    }

    public MirrorCheckConfig(List<String> mirrors,
                             Duration probeTimeout,
                             Duration taskCeiling,
                             Duration checkInterval,
                             Duration initialDelay,
                             int recommendCount,
                             boolean autoApply,
                             Path daemonJson,
                             Path daemonJsonBackup) {
        this.mirrors = Collections.unmodifiableList(mirrors);
        this.probeTimeout = probeTimeout;
        this.taskCeiling = taskCeiling;
        this.checkInterval = checkInterval;
        this.initialDelay = initialDelay;
        this.recommendCount = recommendCount;
        this.autoApply = autoApply;
        this.daemonJson = daemonJson;
        this.daemonJsonBackup = daemonJsonBackup;
    }

    public static MirrorCheckConfig defaultConfig() {
        return new MirrorCheckConfig(DEFAULT_MIRRORS, Duration.ofSeconds(5), Duration.ofSeconds(10),
                Duration.ofHours(1), 5, true,
                Paths.get("/etc/docker/daemon.json"), Paths.get("/etc/docker/daemon.json.bak"));
    }

    public List<String> getMirrors() {
        return mirrors;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public Duration getTaskCeiling() {
        return taskCeiling;
    }

    /**
     * 定时检测间隔，同时也是 volatile tier 的 TTL。
     */
    public Duration getCheckInterval() {
        return checkInterval;
    }

    /**
     * 启动后首次检测前的等待时间，默认立即执行。
     */
    public Duration getInitialDelay() {
        return initialDelay;
    }

    public int getRecommendCount() {
        return recommendCount;
    }

    public boolean isAutoApply() {
        return autoApply;
    }

    public Path getDaemonJson() {
        return daemonJson;
    }

    public Path getDaemonJsonBackup() {
        return daemonJsonBackup;
    }
}
