package com.work.mirror.core.cache;

import com.work.mirror.core.model.CachedSnapshot;
import com.work.mirror.core.model.ProbeBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static com.work.mirror.core.support.ValidationUtils.requireNonNull;
import static com.work.mirror.core.support.ValidationUtils.requirePositive;

/**
 * 两级读路径：volatile tier 优先，缺失/过期/不可用时回落到进程内最后一次成功写入的快照。
 *
 * <p>进程内快照是一个原子引用：写入方整体替换，读者拿到的是不可变快照本身。
 * 定时任务与手动批次同时写入时以最后完成者为准。</p>
 */
public class TieredSnapshotCache {

    private static final Logger log = LoggerFactory.getLogger(TieredSnapshotCache.class);

    private final VolatileSnapshotStore volatileStore;
    private final Duration ttl;
    private final AtomicReference<CachedSnapshot> lastKnown = new AtomicReference<>();

    public TieredSnapshotCache(VolatileSnapshotStore volatileStore, Duration ttl) {
        this.volatileStore = requireNonNull(volatileStore, "volatileStore");
        this.ttl = requirePositive(ttl, "ttl");
    }

    /**
     * 由 batch 生成快照（nextUpdate = now + ttl），写入 volatile tier 并替换进程内快照。
     */
    public CachedSnapshot publish(ProbeBatch batch) {
        requireNonNull(batch, "batch");
        CachedSnapshot snapshot = CachedSnapshot.of(batch, Instant.now(), ttl);
        if (!volatileStore.save(snapshot, ttl)) {
            log.warn("[mirror] volatile tier 写入失败，仅更新进程内快照 total={}", snapshot.getTotal());
        }
        lastKnown.set(snapshot);
        return snapshot;
    }

    public Optional<CachedSnapshot> current() {
        Optional<CachedSnapshot> cached = volatileStore.load();
        if (cached.isPresent()) {
            return cached;
        }
        return Optional.ofNullable(lastKnown.get());
    }

    /**
     * 启动时用 volatile tier 中残留的快照预热进程内快照（进程内已有值时不覆盖）。
     */
    public boolean warmUp() {
        Optional<CachedSnapshot> cached = volatileStore.load();
        return cached.isPresent() && lastKnown.compareAndSet(null, cached.get());
    }

    public Optional<CachedSnapshot> lastKnown() {
        return Optional.ofNullable(lastKnown.get());
    }
}
