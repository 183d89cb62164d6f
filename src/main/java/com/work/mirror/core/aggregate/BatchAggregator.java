package com.work.mirror.core.aggregate;

import com.work.mirror.core.cache.DurableResultLog;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.probe.MirrorProbe;
import com.work.mirror.core.support.metrics.MirrorCheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLongArray;

import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 并发探测一组镜像并汇总为 {@link ProbeBatch}。
 *
 * 策略：
 * - 每个镜像一个任务，跑在有界 worker 池上；任务自行落库（persist=true 时），单条失败互不影响
 * - 等待上限 taskCeiling 从任务实际开始执行时计时，排队等待 worker 的时间不计入；
 *   超时的任务直接放弃：不再等待、结果不计入、不补占位
 * - 汇总后按「可用在前、耗时升序」排序，计数只基于已完成的结果
 *
 * <p>另有 {@link #runSequential} 的顺序模式，用于需要按顺序上报进度的场景，与并发模式刻意分开。</p>
 */
public class BatchAggregator {

    private static final Logger log = LoggerFactory.getLogger(BatchAggregator.class);

    private static final long NOT_STARTED = Long.MIN_VALUE;
    private static final long QUEUE_POLL_MILLIS = 50L;

    private final MirrorProbe probe;
    private final DurableResultLog durableLog;
    private final MirrorCheckMetrics metrics;
    private final Duration taskCeiling;
    private final ExecutorService workers;

    public BatchAggregator(MirrorProbe probe,
                           DurableResultLog durableLog,
                           MirrorCheckMetrics metrics,
                           Duration taskCeiling,
                           int workerCount) {
        this.probe = requireNonNull(probe, "probe");
        this.durableLog = requireNonNull(durableLog, "durableLog");
        this.metrics = requireNonNull(metrics, "metrics");
        this.taskCeiling = requirePositive(taskCeiling, "taskCeiling");
        int n = Math.max(1, workerCount);
        AtomicInteger seq = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(n, r -> {
            Thread t = new Thread(r, "mirror-probe-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ProbeBatch runBatch(List<String> endpoints, Duration timeout, boolean persist) {
        requireNonNull(endpoints, "endpoints");
        requirePositive(timeout, "timeout");

        Instant observedAt = Instant.now();
        int n = endpoints.size();
        // 每个任务开始执行时写入自己的起点，排队中的任务不计时
        AtomicLongArray startedAt = new AtomicLongArray(n);
        for (int i = 0; i < n; i++) {
            startedAt.set(i, NOT_STARTED);
        }

        List<Future<ProbeResult>> futures = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            final int idx = i;
            final String endpoint = endpoints.get(i);
            futures.add(workers.submit(() -> {
                startedAt.set(idx, System.nanoTime());
                return probeAndRecord(endpoint, timeout, persist);
            }));
        }

        List<ProbeResult> completed = new ArrayList<>(n);
        int abandoned = 0;
        for (int i = 0; i < n; i++) {
            ProbeResult result = await(futures.get(i), startedAt, i, endpoints.get(i));
            if (result == null) {
                abandoned++;
            } else {
                completed.add(result);
            }
        }

        ProbeBatch batch = ProbeBatch.of(observedAt, completed);
        metrics.batch(batch.getTotal(), batch.getAvailableCount(), abandoned);
        log.info("[mirror] 批次完成 total={} available={} unavailable={} abandoned={}",
                batch.getTotal(), batch.getAvailableCount(), batch.getUnavailableCount(), abandoned);
        return batch;
    }

    /**
     * 等待单个任务：未开始时只等它被调度，开始后最多等 taskCeiling。
     * 只有已经开始且超过上限的任务才会被取消，返回 null 表示放弃。
     */
    private ProbeResult await(Future<ProbeResult> f, AtomicLongArray startedAt, int idx, String endpoint) {
        long ceilingNanos = taskCeiling.toNanos();
        try {
            while (true) {
                long started = startedAt.get(idx);
                if (started == NOT_STARTED) {
                    try {
                        return f.get(QUEUE_POLL_MILLIS, TimeUnit.MILLISECONDS);
                    } catch (TimeoutException e) {
                        continue;
                    }
                }
                long remaining = started + ceilingNanos - System.nanoTime();
                try {
                    return f.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                } catch (TimeoutException e) {
                    f.cancel(true);
                    log.warn("[mirror] 探测超过等待上限，放弃 endpoint={} ceiling={}", endpoint, taskCeiling);
                    return null;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return null;
        } catch (ExecutionException | CancellationException e) {
            log.warn("[mirror] 探测任务异常 endpoint={} err={}", endpoint, String.valueOf(e.getCause()));
            return null;
        }
    }

    /**
     * 顺序探测，每完成一个回调一次 listener，最终结果与并发模式同样排序。
     */
    public ProbeBatch runSequential(List<String> endpoints, Duration timeout, boolean persist,
                                    ProbeProgressListener listener) {
        requireNonNull(endpoints, "endpoints");
        requirePositive(timeout, "timeout");
        requireNonNull(listener, "listener");

        Instant observedAt = Instant.now();
        List<ProbeResult> completed = new ArrayList<>(endpoints.size());
        int total = endpoints.size();
        for (String endpoint : endpoints) {
            ProbeResult result = probeAndRecord(endpoint, timeout, persist);
            completed.add(result);
            listener.onProgress(completed.size(), total, result);
        }
        return ProbeBatch.of(observedAt, completed);
    }

    public ProbeResult probeOne(String endpoint, Duration timeout, boolean persist) {
        return probeAndRecord(endpoint, timeout, persist);
    }

    private ProbeResult probeAndRecord(String endpoint, Duration timeout, boolean persist) {
        ProbeResult result = probe.probe(endpoint, timeout);
        metrics.probe(result.isAvailable() ? "available" : "unavailable");
        if (persist) {
            durableLog.recordProbe(result);
        }
        return result;
    }

    public void shutdown() {
        workers.shutdownNow();
    }
}
