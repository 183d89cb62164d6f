package com.work.mirror.app.service;

import com.work.mirror.core.aggregate.BatchAggregator;
import com.work.mirror.core.aggregate.ProbeProgressListener;
import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.cache.TieredSnapshotCache;
import com.work.mirror.core.config.MirrorCheckConfig;
import com.work.mirror.core.model.ApplyResult;
import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RecommendedConfig;
import com.work.mirror.core.model.RollingStat;
import com.work.mirror.core.synth.ConfigSynthesizer;
import com.work.mirror.core.synth.DaemonConfigWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.util.List;
import java.util.Optional;

import static com.work.mirror.core.support.ValidationUtils.requireEndpointList;
import static com.work.mirror.core.support.ValidationUtils.requireNonEmpty;

/**
 * 对外查询面：HTTP 层只做参数搬运，所有规则都在这里。
 *
 * <p>手动触发的批次与定时批次互不加锁：逐条落库可以交错，快照以最后完成者为准。</p>
 */
@Service
public class MirrorCheckService {

    private static final Logger log = LoggerFactory.getLogger(MirrorCheckService.class);

    private final MirrorCheckConfig config;
    private final BatchAggregator aggregator;
    private final DurableResultLog durableLog;
    private final TieredSnapshotCache snapshotCache;
    private final ConfigSynthesizer synthesizer;
    private final DaemonConfigWriter configWriter;

    public MirrorCheckService(MirrorCheckConfig config,
                              BatchAggregator aggregator,
                              DurableResultLog durableLog,
                              TieredSnapshotCache snapshotCache,
                              ConfigSynthesizer synthesizer,
                              DaemonConfigWriter configWriter) {
        this.config = config;
        this.aggregator = aggregator;
        this.durableLog = durableLog;
        this.snapshotCache = snapshotCache;
        this.synthesizer = synthesizer;
        this.configWriter = configWriter;
    }

    @PostConstruct
    public void warmUp() {
        if (snapshotCache.warmUp()) {
            log.info("[mirror] 从 volatile tier 加载缓存数据成功");
        }
    }

    public List<String> configuredMirrors() {
        return config.getMirrors();
    }

    public Optional<CachedSnapshot> currentSnapshot() {
        return snapshotCache.current();
    }

    /**
     * 基于当前快照推导推荐配置；没有数据时返回 empty。
     * 有数据但没有可用镜像时返回 mirrors 为空的配置，由调用方区分。
     */
    public Optional<RecommendedConfig> recommendedConfig() {
        Optional<CachedSnapshot> snapshot = snapshotCache.current();
        if (!snapshot.isPresent() || !snapshot.get().hasResults()) {
            return Optional.empty();
        }
        return Optional.of(synthesizer.synthesize(snapshot.get()));
    }

    /**
     * 立即检测一批镜像并发布快照。
     *
     * @param endpoints null 表示使用配置的列表；否则必须是字符串列表
     * @throws IllegalArgumentException 请求形状不合法，任何探测开始之前抛出
     */
    public ProbeBatch runOnDemand(Object endpoints) {
        List<String> targets = resolveEndpoints(endpoints);
        ProbeBatch batch = aggregator.runBatch(targets, config.getProbeTimeout(), true);
        durableLog.recordBatch(batch);
        snapshotCache.publish(batch);
        return batch;
    }

    /**
     * 顺序检测并逐个回调进度，适用于需要流式展示的调用方。
     */
    public ProbeBatch streamBatch(Object endpoints, ProbeProgressListener listener) {
        List<String> targets = resolveEndpoints(endpoints);
        return aggregator.runSequential(targets, config.getProbeTimeout(), true, listener);
    }

    public ProbeResult probeOne(String endpoint) {
        requireNonEmpty(endpoint, "mirror");
        return aggregator.probeOne(endpoint.trim(), config.getProbeTimeout(), true);
    }

    /**
     * 手动把当前快照推导出的推荐配置写入外部文件。
     */
    public ApplyResult applyConfig() {
        Optional<CachedSnapshot> snapshot = snapshotCache.current();
        if (!snapshot.isPresent() || !snapshot.get().hasResults()) {
            return ApplyResult.noData(configWriter.getConfigPath());
        }
        return configWriter.apply(synthesizer.synthesize(snapshot.get()));
    }

    public List<HistoryRecord> history(String endpoint, int limit) {
        return durableLog.history(endpoint, limit);
    }

    public List<RollingStat> statistics() {
        return durableLog.statistics();
    }

    /**
     * 校验请求中的镜像列表；null 表示使用配置的列表。
     */
    public List<String> resolveEndpoints(Object endpoints) {
        if (endpoints == null) {
            return config.getMirrors();
        }
        return requireEndpointList(endpoints, "mirrors");
    }
}
