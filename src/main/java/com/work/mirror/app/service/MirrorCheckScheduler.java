package com.work.mirror.app.service;

import com.work.mirror.core.aggregate.BatchAggregator;
import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.cache.TieredSnapshotCache;
import com.work.mirror.core.config.MirrorCheckConfig;
import com.work.mirror.core.model.ApplyResult;
import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.support.metrics.MirrorCheckMetrics;
import com.work.mirror.core.synth.ConfigSynthesizer;
import com.work.mirror.core.synth.DaemonConfigWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * 定时检测任务：IDLE -> RUNNING -> IDLE。
 *
 * <p>fixedDelay 语义：下一次在本次结束后才计时，慢探测不会导致运行堆积。
 * gate 只做 tryLock，已有运行中的实例时本次 tick 直接跳过。
 * 运行中的任何异常都在这里吞掉并记录，保证下一次调度照常触发。</p>
 */
@Component
@ConditionalOnProperty(prefix = "mirror", name = "scheduler-enabled", havingValue = "true", matchIfMissing = true)
public class MirrorCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(MirrorCheckScheduler.class);

    private final MirrorCheckConfig config;
    private final BatchAggregator aggregator;
    private final DurableResultLog durableLog;
    private final TieredSnapshotCache snapshotCache;
    private final ConfigSynthesizer synthesizer;
    private final DaemonConfigWriter configWriter;
    private final MirrorCheckMetrics metrics;

    private final ReentrantLock gate = new ReentrantLock();

    public MirrorCheckScheduler(MirrorCheckConfig config,
                                BatchAggregator aggregator,
                                DurableResultLog durableLog,
                                TieredSnapshotCache snapshotCache,
                                ConfigSynthesizer synthesizer,
                                DaemonConfigWriter configWriter,
                                MirrorCheckMetrics metrics) {
        this.config = config;
        this.aggregator = aggregator;
        this.durableLog = durableLog;
        this.snapshotCache = snapshotCache;
        this.synthesizer = synthesizer;
        this.configWriter = configWriter;
        this.metrics = metrics;
    }

    @Scheduled(fixedDelayString = "#{@mirrorCheckConfig.checkInterval.toMillis()}",
            initialDelayString = "#{@mirrorCheckConfig.initialDelay.toMillis()}")
    public void scheduledCheck() {
        tick();
    }

    /**
     * @return true 表示本次实际执行了一次检测，false 表示因已有运行而跳过
     */
    public boolean tick() {
        if (!gate.tryLock()) {
            log.debug("[mirror] 上一次检测仍在进行，跳过本次 tick");
            metrics.scheduledRun("skipped");
            return false;
        }
        try {
            runOnce();
            metrics.scheduledRun("success");
        } catch (Exception e) {
            log.error("[mirror] 定时检测出错", e);
            metrics.scheduledRun("error");
        } finally {
            gate.unlock();
        }
        return true;
    }

    public boolean isRunning() {
        return gate.isLocked();
    }

    private void runOnce() {
        log.info("[mirror] 开始定时检测镜像源状态 mirrors={}", config.getMirrors().size());

        ProbeBatch batch = aggregator.runBatch(config.getMirrors(), config.getProbeTimeout(), true);
        durableLog.recordBatch(batch);
        CachedSnapshot snapshot = snapshotCache.publish(batch);

        if (config.isAutoApply()) {
            ApplyResult applied = configWriter.apply(synthesizer.synthesize(snapshot));
            metrics.configApply(applied.getStatus().name());
            if (!applied.isSuccess()) {
                log.warn("[mirror] 自动更新配置未完成 status={} message={}", applied.getStatus(), applied.getMessage());
            }
        }

        log.info("[mirror] 定时检测完成: 可用 {}/{} 个镜像源，下次检测 {}",
                snapshot.getAvailableCount(), snapshot.getTotal(), snapshot.getNextUpdate());
    }
}
