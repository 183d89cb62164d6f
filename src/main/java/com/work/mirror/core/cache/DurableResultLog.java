package com.work.mirror.core.cache;

import com.work.mirror.core.exception.MirrorCheckException;
import com.work.mirror.core.model.BatchRecord;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeBatch;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RollingStat;
import com.work.mirror.core.repository.ProbeRecordRepository;
import com.work.mirror.core.support.metrics.MirrorCheckMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.work.mirror.core.support.ValidationUtils.requireNonNull;

/**
 * durable tier 的入口：history / rolling stats / batch log。
 *
 * <p>写入失败只记录日志并返回 false，不向上抛出，内存与 volatile 路径继续工作；
 * 读取失败包装为 {@link MirrorCheckException}，由查询方决定如何呈现。</p>
 */
public class DurableResultLog {

    private static final Logger log = LoggerFactory.getLogger(DurableResultLog.class);

    private final ProbeRecordRepository repository;
    private final MirrorCheckMetrics metrics;
    private final int historyMaxLimit;

    public DurableResultLog(ProbeRecordRepository repository, MirrorCheckMetrics metrics, int historyMaxLimit) {
        this.repository = requireNonNull(repository, "repository");
        this.metrics = requireNonNull(metrics, "metrics");
        this.historyMaxLimit = Math.max(1, historyMaxLimit);
    }

    public boolean recordProbe(ProbeResult result) {
        try {
            repository.recordProbe(result);
            return true;
        } catch (RuntimeException e) {
            log.warn("[mirror] 保存探测结果失败 endpoint={} err={}", result.getEndpoint(), e.toString());
            metrics.persistFailure("probe");
            return false;
        }
    }

    public boolean recordBatch(ProbeBatch batch) {
        try {
            repository.recordBatch(BatchRecord.of(batch));
            return true;
        } catch (RuntimeException e) {
            log.warn("[mirror] 保存批次信息失败 observedAt={} total={} err={}",
                    batch.getObservedAt(), batch.getTotal(), e.toString());
            metrics.persistFailure("batch");
            return false;
        }
    }

    /**
     * limit 会被收敛到 [1, historyMaxLimit]。
     */
    public List<HistoryRecord> history(String endpoint, int limit) {
        int bounded = Math.min(historyMaxLimit, Math.max(1, limit));
        try {
            return repository.findHistory(endpoint, bounded);
        } catch (RuntimeException e) {
            throw new MirrorCheckException("查询历史记录失败", e);
        }
    }

    public List<RollingStat> statistics() {
        try {
            return repository.findStatistics();
        } catch (RuntimeException e) {
            throw new MirrorCheckException("查询统计信息失败", e);
        }
    }
}
