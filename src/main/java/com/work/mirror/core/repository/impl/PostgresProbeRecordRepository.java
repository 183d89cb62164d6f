package com.work.mirror.core.repository.impl;

import com.work.mirror.core.model.BatchRecord;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RollingStat;
import com.work.mirror.core.repository.ProbeRecordRepository;
import com.work.mirror.core.repository.entity.MirrorStatisticsEntity;
import com.work.mirror.core.repository.entity.MirrorTestHistoryEntity;
import com.work.mirror.core.repository.entity.TestBatchEntity;
import com.work.mirror.core.repository.mapper.MirrorStatisticsMapper;
import com.work.mirror.core.repository.mapper.MirrorTestHistoryMapper;
import com.work.mirror.core.repository.mapper.TestBatchMapper;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.work.mirror.core.support.ValidationUtils.requireNonEmpty;
import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 基于 PostgreSQL + MyBatis-Plus 的 ProbeRecordRepository 实现
 *
 * 注意：
 * 1. 连接来自连接池，由 MyBatis-Spring 按操作借出并在任何退出路径上归还
 * 2. 写失败直接抛出，由上层 {@link com.work.mirror.core.cache.DurableResultLog} 统一降级
 */
public class PostgresProbeRecordRepository implements ProbeRecordRepository {

    private final MirrorTestHistoryMapper historyMapper;
    private final MirrorStatisticsMapper statisticsMapper;
    private final TestBatchMapper batchMapper;

    public PostgresProbeRecordRepository(MirrorTestHistoryMapper historyMapper,
                                         MirrorStatisticsMapper statisticsMapper,
                                         TestBatchMapper batchMapper) {
        this.historyMapper = historyMapper;
        this.statisticsMapper = statisticsMapper;
        this.batchMapper = batchMapper;
    }

    @Override
    @Transactional
    public void recordProbe(ProbeResult result) {
        requireNonNull(result, "result");
        requireNonEmpty(result.getEndpoint(), "result.endpoint");

        Instant now = Instant.now();
        MirrorTestHistoryEntity history = new MirrorTestHistoryEntity();
        history.setMirrorUrl(result.getEndpoint());
        history.setAvailable(result.isAvailable());
        history.setStatus(result.getStatusLabel());
        history.setStatusCode(result.getStatusCode());
        history.setResponseTime(result.getResponseTimeMs());
        history.setTestTime(result.getObservedAt());
        history.setCreatedAt(now);
        historyMapper.insert(history);

        boolean ok = result.isAvailable();
        statisticsMapper.upsertStatistics(
                result.getEndpoint(),
                ok ? 1 : 0,
                ok ? 0 : 1,
                result.getResponseTimeMs(),
                ok ? result.getObservedAt() : null,
                ok ? null : result.getObservedAt(),
                ok,
                result.getObservedAt());
    }

    @Override
    public void recordBatch(BatchRecord batch) {
        requireNonNull(batch, "batch");

        TestBatchEntity entity = new TestBatchEntity();
        entity.setBatchTime(batch.getObservedAt());
        entity.setTotalMirrors(batch.getTotal());
        entity.setAvailableCount(batch.getAvailableCount());
        entity.setUnavailableCount(batch.getUnavailableCount());
        entity.setCreatedAt(Instant.now());
        batchMapper.insert(entity);
    }

    @Override
    public List<HistoryRecord> findHistory(String endpoint, int limit) {
        requirePositive(limit, "limit");

        List<MirrorTestHistoryEntity> rows = (endpoint == null || endpoint.trim().isEmpty())
                ? historyMapper.listRecent(limit)
                : historyMapper.listRecentByMirror(endpoint.trim(), limit);
        List<HistoryRecord> out = new ArrayList<>(rows.size());
        for (MirrorTestHistoryEntity row : rows) {
            out.add(convertToHistory(row));
        }
        return out;
    }

    @Override
    public List<RollingStat> findStatistics() {
        List<MirrorStatisticsEntity> rows = statisticsMapper.listRanked();
        List<RollingStat> out = new ArrayList<>(rows.size());
        for (MirrorStatisticsEntity row : rows) {
            out.add(convertToStat(row));
        }
        return out;
    }

    private HistoryRecord convertToHistory(MirrorTestHistoryEntity e) {
        ProbeResult result = new ProbeResult(
                e.getMirrorUrl(),
                Boolean.TRUE.equals(e.getAvailable()),
                e.getStatus(),
                e.getStatusCode() == null ? 0 : e.getStatusCode(),
                e.getResponseTime() == null ? 0.0 : e.getResponseTime(),
                e.getTestTime());
        return new HistoryRecord(e.getId(), result, e.getCreatedAt());
    }

    private RollingStat convertToStat(MirrorStatisticsEntity e) {
        return new RollingStat(
                e.getMirrorUrl(),
                e.getTotalTests() == null ? 0L : e.getTotalTests(),
                e.getSuccessCount() == null ? 0L : e.getSuccessCount(),
                e.getFailCount() == null ? 0L : e.getFailCount(),
                e.getAvgResponseTime() == null ? 0.0 : e.getAvgResponseTime(),
                e.getLastSuccessTime(),
                e.getLastFailTime(),
                Boolean.TRUE.equals(e.getCurrentStatus()),
                e.getUpdatedAt());
    }
}
