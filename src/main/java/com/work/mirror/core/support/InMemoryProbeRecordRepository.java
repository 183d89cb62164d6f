package com.work.mirror.core.support;

import com.work.mirror.core.model.BatchRecord;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RollingStat;
import com.work.mirror.core.repository.ProbeRecordRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 纯内存实现，方便在没有 Postgres 的环境下运行组件。
 * 注意：该实现不具备跨进程一致性，重启即丢失。
 */
public class InMemoryProbeRecordRepository implements ProbeRecordRepository {

    private static final Comparator<RollingStat> STAT_RANKING =
            Comparator.comparingLong(RollingStat::getSuccessCount).reversed()
                    .thenComparingDouble(RollingStat::getAvgResponseTimeMs);

    private final List<HistoryRecord> history = new CopyOnWriteArrayList<>();
    private final List<BatchRecord> batches = new CopyOnWriteArrayList<>();
    private final Map<String, RollingStat> statistics = new ConcurrentHashMap<>();
    private final AtomicLong historyIds = new AtomicLong(1);
    private final AtomicLong batchIds = new AtomicLong(1);

    @Override
    public void recordProbe(ProbeResult result) {
        history.add(new HistoryRecord(historyIds.getAndIncrement(), result, Instant.now()));
        statistics.merge(result.getEndpoint(), RollingStat.first(result),
                (existing, ignored) -> existing.accumulate(result));
    }

    @Override
    public void recordBatch(BatchRecord batch) {
        batches.add(new BatchRecord(batchIds.getAndIncrement(), batch.getObservedAt(), batch.getTotal(),
                batch.getAvailableCount(), batch.getUnavailableCount()));
    }

    @Override
    public List<HistoryRecord> findHistory(String endpoint, int limit) {
        List<HistoryRecord> matched = new ArrayList<>();
        for (HistoryRecord record : history) {
            if (endpoint == null || endpoint.trim().isEmpty()
                    || endpoint.trim().equals(record.getResult().getEndpoint())) {
                matched.add(record);
            }
        }
        matched.sort(Comparator.comparing((HistoryRecord r) -> r.getResult().getObservedAt())
                .thenComparing(HistoryRecord::getId)
                .reversed());
        return matched.size() > limit ? new ArrayList<>(matched.subList(0, limit)) : matched;
    }

    @Override
    public List<RollingStat> findStatistics() {
        List<RollingStat> out = new ArrayList<>(statistics.values());
        out.sort(STAT_RANKING);
        return out;
    }

    public List<BatchRecord> getBatches() {
        return Collections.unmodifiableList(batches);
    }
}
