package com.work.mirror.core.cache;

import com.work.mirror.core.model.CachedSnapshot;

import java.time.Duration;
import java.util.Optional;

/**
 * volatile tier：单个 key 保存最新快照，带 TTL。
 *
 * <p>实现必须自行吞掉并记录底层异常：不可用时 {@link #load()} 返回空，{@link #save} 返回 false。</p>
 */
public interface VolatileSnapshotStore {

    boolean save(CachedSnapshot snapshot, Duration ttl);

    Optional<CachedSnapshot> load();
}
