package com.work.mirror.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 由最新快照推导出的推荐镜像列表，只在请求或写配置时即时计算，不落库。
 */
public final class RecommendedConfig {

    private final List<String> mirrors;
    private final int totalAvailable;
    private final Instant lastUpdate;
    private final Instant nextUpdate;

    public RecommendedConfig(List<String> mirrors, int totalAvailable, Instant lastUpdate, Instant nextUpdate) {
        this.mirrors = Collections.unmodifiableList(mirrors);
        this.totalAvailable = totalAvailable;
        this.lastUpdate = lastUpdate;
        this.nextUpdate = nextUpdate;
    }

    public List<String> getMirrors() {
        return mirrors;
    }

    public int getCount() {
        return mirrors.size();
    }

    public int getTotalAvailable() {
        return totalAvailable;
    }

    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public Instant getNextUpdate() {
        return nextUpdate;
    }

    public boolean isEmpty() {
        return mirrors.isEmpty();
    }
}
