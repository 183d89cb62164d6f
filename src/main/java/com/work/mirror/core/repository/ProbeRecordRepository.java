package com.work.mirror.core.repository;

import com.work.mirror.core.model.BatchRecord;
import com.work.mirror.core.model.HistoryRecord;
import com.work.mirror.core.model.ProbeResult;
import com.work.mirror.core.model.RollingStat;

import java.util.List;

/**
 * durable store 的全部读写操作。真实环境由 MyBatis-Plus + PostgreSQL 实现。
 *
 * <p>写操作都是按记录的 append / upsert，可在不同镜像、不同批次间任意交错。</p>
 */
public interface ProbeRecordRepository {

    /**
     * 追加一条历史记录，并在同一事务中 upsert 该镜像的累计统计。
     */
    void recordProbe(ProbeResult result);

    /**
     * 追加一条批次汇总。
     */
    void recordBatch(BatchRecord batch);

    /**
     * 按时间倒序查询历史，endpoint 为 null 时不过滤。
     */
    List<HistoryRecord> findHistory(String endpoint, int limit);

    /**
     * 按 successCount 降序、avgResponseTimeMs 升序返回全部统计。
     */
    List<RollingStat> findStatistics();
}
